package com.kmg.extract.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "extractor")
public class ExtractorProperties {
    @NotBlank
    private String baseDir;
    @NotNull
    private Credentials credentials = new Credentials();
    @NotNull
    private Dispatch dispatch = new Dispatch();
    @NotNull
    private Inference inference = new Inference();
    @NotNull
    private Batch batch = new Batch();
    @NotNull
    private Output output = new Output();
    @NotNull
    private State state = new State();
    @NotNull
    private Logs logs = new Logs();

    public String getBaseDir() {
        return baseDir;
    }

    public void setBaseDir(String baseDir) {
        this.baseDir = baseDir;
    }

    public Credentials getCredentials() {
        return credentials;
    }

    public void setCredentials(Credentials credentials) {
        this.credentials = credentials;
    }

    public Dispatch getDispatch() {
        return dispatch;
    }

    public void setDispatch(Dispatch dispatch) {
        this.dispatch = dispatch;
    }

    public Inference getInference() {
        return inference;
    }

    public void setInference(Inference inference) {
        this.inference = inference;
    }

    public Batch getBatch() {
        return batch;
    }

    public void setBatch(Batch batch) {
        this.batch = batch;
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output;
    }

    public State getState() {
        return state;
    }

    public void setState(State state) {
        this.state = state;
    }

    public Logs getLogs() {
        return logs;
    }

    public void setLogs(Logs logs) {
        this.logs = logs;
    }

    public Path baseDirPath() {
        return Path.of(baseDir);
    }

    public static class Credentials {
        private List<String> keys = new ArrayList<>();
        private String keysFile;
        private String envVar = "GEMINI_API_KEY";
        @NotNull
        private Duration cooldown = Duration.ofSeconds(60);
        @Min(1)
        private int transientFailureThreshold = 3;
        @NotBlank
        private String timezone = "America/Los_Angeles";

        public List<String> getKeys() {
            return keys;
        }

        public void setKeys(List<String> keys) {
            this.keys = keys;
        }

        public String getKeysFile() {
            return keysFile;
        }

        public void setKeysFile(String keysFile) {
            this.keysFile = keysFile;
        }

        public String getEnvVar() {
            return envVar;
        }

        public void setEnvVar(String envVar) {
            this.envVar = envVar;
        }

        public Duration getCooldown() {
            return cooldown;
        }

        public void setCooldown(Duration cooldown) {
            this.cooldown = cooldown;
        }

        public int getTransientFailureThreshold() {
            return transientFailureThreshold;
        }

        public void setTransientFailureThreshold(int transientFailureThreshold) {
            this.transientFailureThreshold = transientFailureThreshold;
        }

        public String getTimezone() {
            return timezone;
        }

        public void setTimezone(String timezone) {
            this.timezone = timezone;
        }
    }

    public static class Dispatch {
        @Min(1)
        private int maxAttempts = 3;
        @NotNull
        private Duration retryDelay = Duration.ofSeconds(2);
        @DecimalMin("1.0")
        private double backoffMultiplier = 1.0;
        @NotNull
        private Duration maxDelay = Duration.ofSeconds(30);
        @NotNull
        private Duration requestTimeout = Duration.ofSeconds(120);
        @Min(1)
        private int callThreads = 8;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getRetryDelay() {
            return retryDelay;
        }

        public void setRetryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }

        public int getCallThreads() {
            return callThreads;
        }

        public void setCallThreads(int callThreads) {
            this.callThreads = callThreads;
        }
    }

    public static class Inference {
        @NotBlank
        private String baseUrl = "https://generativelanguage.googleapis.com";
        @NotBlank
        private String model = "gemini-2.5-flash";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }
    }

    public static class Batch {
        @Min(1)
        @Max(8)
        private int defaultWorkers = 1;
        @Min(0)
        private int minTextLength = 50;

        public int getDefaultWorkers() {
            return defaultWorkers;
        }

        public void setDefaultWorkers(int defaultWorkers) {
            this.defaultWorkers = defaultWorkers;
        }

        public int getMinTextLength() {
            return minTextLength;
        }

        public void setMinTextLength(int minTextLength) {
            this.minTextLength = minTextLength;
        }
    }

    public static class Output {
        @NotBlank
        private String dir;

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }
    }

    public static class State {
        @NotBlank
        private String dbPath;

        public String getDbPath() {
            return dbPath;
        }

        public void setDbPath(String dbPath) {
            this.dbPath = dbPath;
        }
    }

    public static class Logs {
        @NotBlank
        private String dir;

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }
    }
}
