package io.promptrelay.config;

import io.promptrelay.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public final class PromptRelayConfig {
    public static final String SETTINGS_FILE = "promptrelay-settings.json";
    public static final int DEFAULT_MAX_CONCURRENT = 3;
    public static final long DEFAULT_STEP_TIMEOUT_MS = 10L * 60L * 1_000L;
    public static final long DEFAULT_PROMPT_TIMEOUT_MS = 60L * 60L * 1_000L;
    public static final boolean DEFAULT_AUTO_RETRY = true;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_RETRY_DELAY_MS = 5_000L;
    public static final String DEFAULT_EXTERNAL_TOOL_COMMAND = "code";

    private final Path rootDir;
    private final Path workspaceDir;
    private final int maxConcurrent;
    private final Duration stepTimeout;
    private final Duration promptTimeout;
    private final boolean autoRetry;
    private final int maxRetries;
    private final Duration retryDelay;
    private final String authToken;
    private final List<String> callbackUrls;
    private final String externalToolCommand;
    private final boolean auditEnabled;

    private PromptRelayConfig(Builder b) {
        this.rootDir = b.rootDir;
        this.workspaceDir = b.workspaceDir == null ? b.rootDir : b.workspaceDir;
        this.maxConcurrent = Math.max(1, b.maxConcurrent);
        this.stepTimeout = Duration.ofMillis(Math.max(1L, b.stepTimeoutMs));
        this.promptTimeout = Duration.ofMillis(Math.max(1L, b.promptTimeoutMs));
        this.autoRetry = b.autoRetry;
        this.maxRetries = Math.max(0, b.maxRetries);
        this.retryDelay = Duration.ofMillis(Math.max(0L, b.retryDelayMs));
        this.authToken = b.authToken == null || b.authToken.isBlank() ? null : b.authToken.trim();
        this.callbackUrls = List.copyOf(b.callbackUrls);
        this.externalToolCommand = b.externalToolCommand == null || b.externalToolCommand.isBlank()
                ? DEFAULT_EXTERNAL_TOOL_COMMAND
                : b.externalToolCommand.trim();
        this.auditEnabled = b.auditEnabled;
    }

    public static PromptRelayConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        return load(resolved.toAbsolutePath().normalize());
    }

    /**
     * Defaults overlaid with {@value #SETTINGS_FILE} from the root directory when it exists.
     */
    public static PromptRelayConfig load(Path rootDir) {
        Builder builder = builder(rootDir);
        Path settings = rootDir.resolve(SETTINGS_FILE);
        if (Files.isRegularFile(settings)) {
            SettingsFile file;
            try {
                file = Jsons.mapper().readValue(settings.toFile(), SettingsFile.class);
            } catch (IOException e) {
                throw new IllegalArgumentException("Invalid settings file: " + settings + ": " + e.getMessage(), e);
            }
            builder.apply(file);
        }
        return builder.build();
    }

    public static Builder builder(Path rootDir) {
        return new Builder(rootDir);
    }

    public Builder toBuilder() {
        Builder b = new Builder(rootDir);
        b.workspaceDir = workspaceDir;
        b.maxConcurrent = maxConcurrent;
        b.stepTimeoutMs = stepTimeout.toMillis();
        b.promptTimeoutMs = promptTimeout.toMillis();
        b.autoRetry = autoRetry;
        b.maxRetries = maxRetries;
        b.retryDelayMs = retryDelay.toMillis();
        b.authToken = authToken;
        b.callbackUrls.addAll(callbackUrls);
        b.externalToolCommand = externalToolCommand;
        b.auditEnabled = auditEnabled;
        return b;
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path workspaceDir() {
        return workspaceDir;
    }

    public int maxConcurrent() {
        return maxConcurrent;
    }

    public Duration stepTimeout() {
        return stepTimeout;
    }

    public Duration promptTimeout() {
        return promptTimeout;
    }

    public boolean autoRetry() {
        return autoRetry;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public Duration retryDelay() {
        return retryDelay;
    }

    public String authToken() {
        return authToken;
    }

    public List<String> callbackUrls() {
        return callbackUrls;
    }

    public String externalToolCommand() {
        return externalToolCommand;
    }

    public boolean auditEnabled() {
        return auditEnabled;
    }

    public Path auditFile() {
        return rootDir.resolve("audit").resolve("audit.log");
    }

    public static final class Builder {
        private final Path rootDir;
        private Path workspaceDir;
        private int maxConcurrent = DEFAULT_MAX_CONCURRENT;
        private long stepTimeoutMs = DEFAULT_STEP_TIMEOUT_MS;
        private long promptTimeoutMs = DEFAULT_PROMPT_TIMEOUT_MS;
        private boolean autoRetry = DEFAULT_AUTO_RETRY;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private long retryDelayMs = DEFAULT_RETRY_DELAY_MS;
        private String authToken;
        private final List<String> callbackUrls = new ArrayList<>();
        private String externalToolCommand = DEFAULT_EXTERNAL_TOOL_COMMAND;
        private boolean auditEnabled = true;

        private Builder(Path rootDir) {
            if (rootDir == null) {
                throw new IllegalArgumentException("root directory is required");
            }
            this.rootDir = rootDir.toAbsolutePath().normalize();
        }

        public Builder workspaceDir(Path workspaceDir) {
            this.workspaceDir = workspaceDir == null ? null : workspaceDir.toAbsolutePath().normalize();
            return this;
        }

        public Builder maxConcurrent(int maxConcurrent) {
            this.maxConcurrent = maxConcurrent;
            return this;
        }

        public Builder stepTimeout(Duration stepTimeout) {
            this.stepTimeoutMs = stepTimeout.toMillis();
            return this;
        }

        public Builder promptTimeout(Duration promptTimeout) {
            this.promptTimeoutMs = promptTimeout.toMillis();
            return this;
        }

        public Builder autoRetry(boolean autoRetry) {
            this.autoRetry = autoRetry;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            this.retryDelayMs = retryDelay.toMillis();
            return this;
        }

        public Builder authToken(String authToken) {
            this.authToken = authToken;
            return this;
        }

        public Builder callbackUrls(List<String> urls) {
            this.callbackUrls.clear();
            if (urls != null) {
                for (String url : urls) {
                    if (url != null && !url.isBlank()) {
                        this.callbackUrls.add(url.trim());
                    }
                }
            }
            return this;
        }

        public Builder externalToolCommand(String command) {
            this.externalToolCommand = command;
            return this;
        }

        public Builder auditEnabled(boolean auditEnabled) {
            this.auditEnabled = auditEnabled;
            return this;
        }

        public PromptRelayConfig build() {
            return new PromptRelayConfig(this);
        }

        private void apply(SettingsFile file) {
            if (file == null) {
                return;
            }
            if (file.workspaceDir() != null && !file.workspaceDir().isBlank()) {
                Path raw = Paths.get(file.workspaceDir().trim());
                workspaceDir(raw.isAbsolute() ? raw : rootDir.resolve(raw));
            }
            maxConcurrent = sanitizeInt(file.maxConcurrent(), maxConcurrent, 1);
            stepTimeoutMs = sanitizeLong(file.stepTimeoutMs(), stepTimeoutMs, 1L);
            promptTimeoutMs = sanitizeLong(file.promptTimeoutMs(), promptTimeoutMs, 1L);
            autoRetry = sanitizeBoolean(file.autoRetry(), autoRetry);
            maxRetries = sanitizeInt(file.maxRetries(), maxRetries, 0);
            retryDelayMs = sanitizeLong(file.retryDelayMs(), retryDelayMs, 0L);
            if (file.authToken() != null) {
                authToken = file.authToken();
            }
            if (file.callbackUrls() != null) {
                callbackUrls(file.callbackUrls());
            }
            if (file.externalToolCommand() != null) {
                externalToolCommand = file.externalToolCommand();
            }
            auditEnabled = sanitizeBoolean(file.auditEnabled(), auditEnabled);
        }

        private static int sanitizeInt(Integer raw, int fallback, int min) {
            if (raw == null) {
                return fallback;
            }
            return Math.max(min, raw);
        }

        private static long sanitizeLong(Long raw, long fallback, long min) {
            if (raw == null) {
                return fallback;
            }
            return Math.max(min, raw);
        }

        private static boolean sanitizeBoolean(Boolean raw, boolean fallback) {
            if (raw == null) {
                return fallback;
            }
            return raw;
        }
    }

    private record SettingsFile(
            String workspaceDir,
            Integer maxConcurrent,
            Long stepTimeoutMs,
            Long promptTimeoutMs,
            Boolean autoRetry,
            Integer maxRetries,
            Long retryDelayMs,
            String authToken,
            List<String> callbackUrls,
            String externalToolCommand,
            Boolean auditEnabled
    ) {
    }
}
