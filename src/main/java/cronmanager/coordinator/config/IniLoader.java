package cronmanager.coordinator.config;

import cronmanager.coordinator.model.ExecutionMode;
import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.File;
import java.io.IOException;
import java.time.Duration;

/**
 * Applies settings from an INI file onto a {@link ManagerConfig}.
 * Recognised sections: [STORE], [MACHINES], [MONITOR], [CRON], [SERVER].
 * Missing sections and keys keep the current value.
 */
public final class IniLoader {

    private IniLoader() {
    }

    public static ManagerConfig apply(File file, ManagerConfig config) {
        Ini ini;
        try {
            ini = new Ini(file);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config file " + file, e);
        }

        Profile.Section store = ini.get("STORE");
        Profile.Section machines = ini.get("MACHINES");
        Profile.Section monitor = ini.get("MONITOR");
        Profile.Section cron = ini.get("CRON");
        Profile.Section server = ini.get("SERVER");

        try {
            // STORE
            String dbUrl = opt(store, "database_url");
            if (dbUrl != null) config.withDatabaseUrl(dbUrl);
            String poolSize = opt(store, "pool_size");
            if (poolSize != null) config.withDatabasePoolSize(Integer.parseInt(poolSize));

            // MACHINES
            String apiUrl = opt(machines, "api_url");
            if (apiUrl != null) config.withMachinesApiUrl(apiUrl);
            String mode = opt(machines, "execution_mode");
            if (mode != null) config.withExecutionMode(ExecutionMode.parse(mode));
            String startTimeout = opt(machines, "start_timeout_seconds");
            if (startTimeout != null) config.withMachineStartTimeout(seconds(startTimeout));
            String requestTimeout = opt(machines, "request_timeout_seconds");
            if (requestTimeout != null) config.withProviderRequestTimeout(seconds(requestTimeout));

            // MONITOR
            String interval = opt(monitor, "interval_seconds");
            if (interval != null) config.withMonitorInterval(seconds(interval));
            String concurrency = opt(monitor, "concurrency");
            if (concurrency != null) config.withMonitorConcurrency(Integer.parseInt(concurrency));

            // CRON
            String schedulesFile = opt(cron, "schedules_file");
            if (schedulesFile != null) config.withSchedulesFile(schedulesFile);
            String crontab = opt(cron, "crontab_path");
            if (crontab != null) config.withCrontabPath(crontab);
            String executable = opt(cron, "executable");
            if (executable != null) config.withTriggerExecutable(executable);

            // SERVER
            String host = opt(server, "host");
            if (host != null) config.withServerHost(host);
            String port = opt(server, "port");
            if (port != null) config.withServerPort(Integer.parseInt(port));
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid number in config file " + file + ": " + e.getMessage(), e);
        }

        return config;
    }

    // ===== helpers =====
    private static String opt(Profile.Section s, String key) {
        if (s == null) return null;
        String v = s.get(key);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    private static Duration seconds(String value) {
        return Duration.ofSeconds(Long.parseLong(value));
    }
}
