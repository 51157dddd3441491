package com.agentledger.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ProcessLogExtract {

    @Builder.Default
    private List<ReasoningEntry> reasonings = List.of();

    @Builder.Default
    private List<DecisionRationale> rationales = List.of();

    public static ProcessLogExtract empty() {
        return ProcessLogExtract.builder().build();
    }

    public boolean hasReasoning() {
        return reasonings != null && !reasonings.isEmpty();
    }
}
