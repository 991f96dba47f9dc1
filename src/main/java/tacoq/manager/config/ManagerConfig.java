package tacoq.manager.config;

import java.time.Clock;
import java.time.Duration;

/**
 * Configuration holder for Manager settings.
 * All settings have sensible defaults.
 */
public final class ManagerConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/tacoq;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 3000;
    private String serverHost = "0.0.0.0";

    // Liveness settings
    private Duration heartbeatTimeout = Duration.ofSeconds(30);
    private Duration deathTimeout = Duration.ofSeconds(90);
    private Duration livenessSweepInterval = null; // defaults to heartbeatTimeout / 2

    // Dispatch settings
    private Duration dispatchInterval = Duration.ofSeconds(1);
    private int dispatchBatchSize = 100;
    private int publishMaxAttempts = 3;
    private Duration publishBackoff = Duration.ofMillis(200);

    // Result consumer settings
    private Duration resultPollTimeout = Duration.ofMillis(500);

    // Task types
    private boolean autoCreateTaskTypes = false;

    // Auth settings (optional)
    private String agentKey = null; // If set, workers must provide X-TacoQ-Key header

    private Clock clock = Clock.systemUTC();

    private ManagerConfig() {
    }

    public static ManagerConfig defaults() {
        return new ManagerConfig();
    }

    public static ManagerConfig fromEnv() {
        ManagerConfig config = new ManagerConfig();

        String dbUrl = System.getenv("TACOQ_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = System.getenv("TACOQ_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String agentKey = System.getenv("TACOQ_AGENT_KEY");
        if (agentKey != null && !agentKey.isBlank()) {
            config.agentKey = agentKey;
        }

        String heartbeatTimeout = System.getenv("TACOQ_HEARTBEAT_TIMEOUT_SECONDS");
        if (heartbeatTimeout != null && !heartbeatTimeout.isBlank()) {
            config.heartbeatTimeout = Duration.ofSeconds(Long.parseLong(heartbeatTimeout));
        }

        String deathTimeout = System.getenv("TACOQ_DEATH_TIMEOUT_SECONDS");
        if (deathTimeout != null && !deathTimeout.isBlank()) {
            config.deathTimeout = Duration.ofSeconds(Long.parseLong(deathTimeout));
        }

        String dispatchInterval = System.getenv("TACOQ_DISPATCH_INTERVAL_MS");
        if (dispatchInterval != null && !dispatchInterval.isBlank()) {
            config.dispatchInterval = Duration.ofMillis(Long.parseLong(dispatchInterval));
        }

        String autoCreate = System.getenv("TACOQ_AUTO_CREATE_TASK_TYPES");
        if (autoCreate != null && !autoCreate.isBlank()) {
            config.autoCreateTaskTypes = Boolean.parseBoolean(autoCreate);
        }

        return config.validate();
    }

    /**
     * Reject combinations the liveness detector cannot work with.
     */
    public ManagerConfig validate() {
        if (heartbeatTimeout.isZero() || heartbeatTimeout.isNegative()) {
            throw new IllegalArgumentException("heartbeatTimeout must be positive");
        }
        if (deathTimeout.compareTo(heartbeatTimeout) <= 0) {
            throw new IllegalArgumentException("deathTimeout must be greater than heartbeatTimeout");
        }
        if (publishMaxAttempts <= 0) {
            throw new IllegalArgumentException("publishMaxAttempts must be positive");
        }
        if (dispatchBatchSize <= 0) {
            throw new IllegalArgumentException("dispatchBatchSize must be positive");
        }
        return this;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public Duration heartbeatTimeout() {
        return heartbeatTimeout;
    }

    public Duration deathTimeout() {
        return deathTimeout;
    }

    public Duration livenessSweepInterval() {
        return livenessSweepInterval != null ? livenessSweepInterval : heartbeatTimeout.dividedBy(2);
    }

    public Duration dispatchInterval() {
        return dispatchInterval;
    }

    public int dispatchBatchSize() {
        return dispatchBatchSize;
    }

    public int publishMaxAttempts() {
        return publishMaxAttempts;
    }

    public Duration publishBackoff() {
        return publishBackoff;
    }

    public Duration resultPollTimeout() {
        return resultPollTimeout;
    }

    public boolean autoCreateTaskTypes() {
        return autoCreateTaskTypes;
    }

    public String agentKey() {
        return agentKey;
    }

    public boolean hasAgentKey() {
        return agentKey != null && !agentKey.isBlank();
    }

    public Clock clock() {
        return clock;
    }

    // Fluent setters for testing/customization
    public ManagerConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public ManagerConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public ManagerConfig withAgentKey(String key) {
        this.agentKey = key;
        return this;
    }

    public ManagerConfig withHeartbeatTimeout(Duration timeout) {
        this.heartbeatTimeout = timeout;
        return this;
    }

    public ManagerConfig withDeathTimeout(Duration timeout) {
        this.deathTimeout = timeout;
        return this;
    }

    public ManagerConfig withLivenessSweepInterval(Duration interval) {
        this.livenessSweepInterval = interval;
        return this;
    }

    public ManagerConfig withDispatchInterval(Duration interval) {
        this.dispatchInterval = interval;
        return this;
    }

    public ManagerConfig withDispatchBatchSize(int batchSize) {
        this.dispatchBatchSize = batchSize;
        return this;
    }

    public ManagerConfig withPublishRetry(int maxAttempts, Duration backoff) {
        this.publishMaxAttempts = maxAttempts;
        this.publishBackoff = backoff;
        return this;
    }

    public ManagerConfig withResultPollTimeout(Duration timeout) {
        this.resultPollTimeout = timeout;
        return this;
    }

    public ManagerConfig withAutoCreateTaskTypes(boolean autoCreate) {
        this.autoCreateTaskTypes = autoCreate;
        return this;
    }

    public ManagerConfig withClock(Clock clock) {
        this.clock = clock;
        return this;
    }

    @Override
    public String toString() {
        return "ManagerConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", heartbeatTimeout=" + heartbeatTimeout +
                ", deathTimeout=" + deathTimeout +
                ", dispatchInterval=" + dispatchInterval +
                ", autoCreateTaskTypes=" + autoCreateTaskTypes +
                ", agentKeySet=" + hasAgentKey() +
                '}';
    }
}
