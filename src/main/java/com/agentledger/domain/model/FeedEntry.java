package com.agentledger.domain.model;

import com.agentledger.domain.enums.FeedEntryKind;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class FeedEntry {

    private String id;
    private FeedEntryKind kind;
    private Instant timestamp;
    private String asset;
    private String text;
}
