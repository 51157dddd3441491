package com.agentledger.diary;

import com.agentledger.domain.model.DiaryRecord;
import java.util.List;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class DiaryReadResult {

    @Builder.Default
    private List<DiaryRecord> records = List.of();

    /** Non-blank lines that were not valid diary records. */
    private int skippedLines;

    public static DiaryReadResult empty() {
        return DiaryReadResult.builder().build();
    }
}
