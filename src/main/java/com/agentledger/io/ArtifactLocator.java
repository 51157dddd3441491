package com.agentledger.io;

import com.agentledger.config.AgentLedgerProperties;
import com.agentledger.exception.InvalidAccountKeyException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Resolves which file on disk holds an account's diary, process log or prompt log.
 *
 * <p>The per-account file wins when it exists; otherwise the shared file is used.
 * Neither existing is not an error: callers treat an empty Optional as empty input.
 */
@Component
public class ArtifactLocator {

    private static final Pattern ACCOUNT_KEY = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_.-]{0,127}");

    private final AgentLedgerProperties properties;

    public ArtifactLocator(AgentLedgerProperties properties) {
        this.properties = properties;
    }

    public Optional<Path> diaryFor(String accountKey) {
        return resolve(
                Path.of(properties.getDiaryDir()),
                validated(accountKey) + ".jsonl",
                properties.getGlobalDiaryFile());
    }

    public Optional<Path> processLogFor(String accountKey) {
        return resolve(
                Path.of(properties.getLogDir()),
                validated(accountKey) + ".log",
                properties.getGlobalProcessLogFile());
    }

    public Optional<Path> promptLogFor(String accountKey) {
        return resolve(
                Path.of(properties.getLogDir()),
                validated(accountKey) + ".prompts.log",
                properties.getGlobalPromptLogFile());
    }

    /** Rejects keys that could escape the artifact directories once used as a file name. */
    public static String validated(String accountKey) {
        if (accountKey == null || !ACCOUNT_KEY.matcher(accountKey).matches() || accountKey.contains("..")) {
            throw new InvalidAccountKeyException(accountKey);
        }
        return accountKey;
    }

    private Optional<Path> resolve(Path dir, String perAccountName, String globalName) {
        Path perAccount = dir.resolve(perAccountName);
        if (Files.isRegularFile(perAccount)) {
            return Optional.of(perAccount);
        }
        Path global = dir.resolve(globalName);
        if (Files.isRegularFile(global)) {
            return Optional.of(global);
        }
        return Optional.empty();
    }
}
