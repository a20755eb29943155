package cronmanager.coordinator.config;

import cronmanager.coordinator.model.ExecutionMode;

import java.io.File;
import java.time.Duration;
import java.util.Map;

/**
 * Configuration holder for cron-manager settings.
 * Defaults first, then the optional INI file, then environment variables.
 */
public final class ManagerConfig {

    public static final String CONFIG_FILE_ENV = "CRON_MANAGER_CONFIG";
    public static final String DEFAULT_CONFIG_FILE = "/etc/cron-manager/cron-manager.ini";

    // Store
    private String databaseUrl = "jdbc:h2:file:/data/state;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 5;

    // Machines API
    private String machinesApiUrl = "https://api.machines.dev/v1";
    private String apiTokenEnv = "FLY_API_TOKEN";
    private Duration providerRequestTimeout = Duration.ofSeconds(30);
    private ExecutionMode executionMode = ExecutionMode.EXEC;
    private Duration machineStartTimeout = Duration.ofSeconds(60);

    // Monitor
    private Duration monitorInterval = Duration.ofSeconds(5);
    private int monitorConcurrency = 8;

    // Cron
    private String schedulesFile = "/usr/local/share/schedules.json";
    private String crontabPath = "/data/crontab";
    private String triggerExecutable = "/usr/local/bin/process-job";

    // Server
    private String serverHost = "0.0.0.0";
    private int serverPort = 5500;

    private ManagerConfig() {
    }

    public static ManagerConfig defaults() {
        return new ManagerConfig();
    }

    /**
     * Defaults, overridden by the INI file (if present) and then the process environment.
     */
    public static ManagerConfig load() {
        return load(null);
    }

    /**
     * Like {@link #load()} but reading {@code configFile} when given. An explicit
     * file must exist; the default one is optional.
     */
    public static ManagerConfig load(File configFile) {
        Map<String, String> env = System.getenv();
        ManagerConfig config = defaults();

        if (configFile != null) {
            if (!configFile.isFile()) {
                throw new IllegalStateException("Config file not found: " + configFile);
            }
            IniLoader.apply(configFile, config);
        } else {
            File file = new File(env.getOrDefault(CONFIG_FILE_ENV, DEFAULT_CONFIG_FILE));
            if (file.isFile()) {
                IniLoader.apply(file, config);
            }
        }
        return config.applyEnv(env);
    }

    public static ManagerConfig fromEnv() {
        return defaults().applyEnv(System.getenv());
    }

    ManagerConfig applyEnv(Map<String, String> env) {
        String dbUrl = env.get("CRON_MANAGER_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            databaseUrl = dbUrl;
        }

        String apiUrl = env.get("CRON_MANAGER_MACHINES_API_URL");
        if (apiUrl != null && !apiUrl.isBlank()) {
            machinesApiUrl = apiUrl;
        }

        String mode = env.get("CRON_MANAGER_EXECUTION_MODE");
        if (mode != null && !mode.isBlank()) {
            executionMode = ExecutionMode.parse(mode);
        }

        String interval = env.get("CRON_MANAGER_MONITOR_INTERVAL");
        if (interval != null && !interval.isBlank()) {
            monitorInterval = Duration.ofSeconds(Long.parseLong(interval.trim()));
        }

        String concurrency = env.get("CRON_MANAGER_MONITOR_CONCURRENCY");
        if (concurrency != null && !concurrency.isBlank()) {
            monitorConcurrency = Integer.parseInt(concurrency.trim());
        }

        String schedules = env.get("CRON_MANAGER_SCHEDULES_FILE");
        if (schedules != null && !schedules.isBlank()) {
            schedulesFile = schedules;
        }

        String crontab = env.get("CRON_MANAGER_CRONTAB");
        if (crontab != null && !crontab.isBlank()) {
            crontabPath = crontab;
        }

        String port = env.get("CRON_MANAGER_PORT");
        if (port != null && !port.isBlank()) {
            serverPort = Integer.parseInt(port.trim());
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

    public String machinesApiUrl() {
        return machinesApiUrl;
    }

    /** Name of the environment variable holding the provider credential. */
    public String apiTokenEnv() {
        return apiTokenEnv;
    }

    public Duration providerRequestTimeout() {
        return providerRequestTimeout;
    }

    public ExecutionMode executionMode() {
        return executionMode;
    }

    public Duration machineStartTimeout() {
        return machineStartTimeout;
    }

    public Duration monitorInterval() {
        return monitorInterval;
    }

    public int monitorConcurrency() {
        return monitorConcurrency;
    }

    public String schedulesFile() {
        return schedulesFile;
    }

    public String crontabPath() {
        return crontabPath;
    }

    public String triggerExecutable() {
        return triggerExecutable;
    }

    public String serverHost() {
        return serverHost;
    }

    public int serverPort() {
        return serverPort;
    }

    // Fluent setters for INI loading and tests
    public ManagerConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public ManagerConfig withDatabasePoolSize(int poolSize) {
        this.databasePoolSize = poolSize;
        return this;
    }

    public ManagerConfig withMachinesApiUrl(String url) {
        this.machinesApiUrl = url;
        return this;
    }

    public ManagerConfig withProviderRequestTimeout(Duration timeout) {
        this.providerRequestTimeout = timeout;
        return this;
    }

    public ManagerConfig withExecutionMode(ExecutionMode mode) {
        this.executionMode = mode;
        return this;
    }

    public ManagerConfig withMachineStartTimeout(Duration timeout) {
        this.machineStartTimeout = timeout;
        return this;
    }

    public ManagerConfig withMonitorInterval(Duration interval) {
        this.monitorInterval = interval;
        return this;
    }

    public ManagerConfig withMonitorConcurrency(int concurrency) {
        this.monitorConcurrency = concurrency;
        return this;
    }

    public ManagerConfig withSchedulesFile(String path) {
        this.schedulesFile = path;
        return this;
    }

    public ManagerConfig withCrontabPath(String path) {
        this.crontabPath = path;
        return this;
    }

    public ManagerConfig withTriggerExecutable(String path) {
        this.triggerExecutable = path;
        return this;
    }

    public ManagerConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public ManagerConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    @Override
    public String toString() {
        return "ManagerConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", machinesApiUrl='" + machinesApiUrl + '\'' +
                ", executionMode=" + executionMode +
                ", monitorInterval=" + monitorInterval +
                ", monitorConcurrency=" + monitorConcurrency +
                ", schedulesFile='" + schedulesFile + '\'' +
                ", crontabPath='" + crontabPath + '\'' +
                ", serverPort=" + serverPort +
                '}';
    }
}
