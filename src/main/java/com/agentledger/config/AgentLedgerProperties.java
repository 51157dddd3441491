package com.agentledger.config;

import java.time.ZoneId;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds the {@code agentledger.*} prefix in application.properties.
 *
 * <p>Directories point at where the agent writes its artifacts. Per-account files
 * are {@code <accountKey>.jsonl}, {@code <accountKey>.log} and
 * {@code <accountKey>.prompts.log}; the global file names are the fallbacks used by
 * a single-account agent.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "agentledger")
public class AgentLedgerProperties {

    /** Directory holding per-account diaries and the shared diary. */
    private String diaryDir = ".";

    private String globalDiaryFile = "diary.jsonl";

    /** Directory holding process logs and prompt logs. */
    private String logDir = ".";

    private String globalProcessLogFile = "agent_output.log";

    private String globalPromptLogFile = "prompts.log";

    /** Zone applied to timestamps the agent wrote without an offset. */
    private String zoneId = "UTC";

    /** Max number of artifact files whose read cursor is retained. */
    private long cursorCacheSize = 256;

    /** Max bytes read from an artifact in one chunk. */
    private int readChunkBytes = 8 * 1024 * 1024;

    /** Max number of accounts whose last published stats are retained. */
    private long statsCacheSize = 1024;

    private Exchange exchange = new Exchange();

    public ZoneId zone() {
        return ZoneId.of(zoneId);
    }

    @Getter
    @Setter
    public static class Exchange {

        /** When false, no live snapshot is fetched and every poll uses the fallbacks. */
        private boolean enabled = true;

        private String baseUrl = "https://api.hyperliquid.xyz";

        /** HTTP connect timeout in milliseconds. */
        private int connectTimeout = 3000;

        /** HTTP read timeout in milliseconds. */
        private int readTimeout = 5000;
    }
}
