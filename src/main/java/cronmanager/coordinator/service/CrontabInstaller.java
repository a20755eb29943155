package cronmanager.coordinator.service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Registers a crontab file with the OS scheduler.
 */
@FunctionalInterface
public interface CrontabInstaller {

    /**
     * @return exit code and combined output of the install step
     */
    Result install(Path crontab) throws IOException, InterruptedException;

    record Result(int exitCode, String output) {

        public boolean succeeded() {
            return exitCode == 0;
        }
    }

    /** Runs {@code crontab <file>}. */
    static CrontabInstaller system() {
        return crontab -> {
            Process process = new ProcessBuilder("crontab", crontab.toString())
                    .redirectErrorStream(true)
                    .start();
            String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            return new Result(process.waitFor(), output);
        };
    }
}
