package cronmanager.coordinator.service;

import cronmanager.coordinator.model.Schedule;
import cronmanager.coordinator.repository.ScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Regenerates the crontab from the enabled schedules.
 *
 * The new content goes to a temp file next to the real one and is installed
 * from there; the real file is replaced only if the install step succeeds.
 */
public class CrontabSync {

    private static final Logger log = LoggerFactory.getLogger(CrontabSync.class);

    private final ScheduleRepository scheduleRepository;
    private final Path crontabPath;
    private final String executable;
    private final CrontabInstaller installer;

    public CrontabSync(ScheduleRepository scheduleRepository, Path crontabPath, String executable,
            CrontabInstaller installer) {
        this.scheduleRepository = scheduleRepository;
        this.crontabPath = crontabPath;
        this.executable = executable;
        this.installer = installer;
    }

    public Path crontabPath() {
        return crontabPath;
    }

    /**
     * @return number of entries installed
     * @throws CrontabSyncException if the install step rejects the file
     */
    public int sync() {
        List<Schedule> schedules = scheduleRepository.findEnabled();
        String content = render(schedules);

        Path dir = crontabPath.toAbsolutePath().getParent();
        Path temp = null;
        try {
            Files.createDirectories(dir);
            temp = Files.createTempFile(dir, "crontab-", ".tmp");
            Files.writeString(temp, content, StandardCharsets.UTF_8);

            CrontabInstaller.Result result = installer.install(temp);
            if (!result.succeeded()) {
                throw new CrontabSyncException("failed to install crontab (exit code " + result.exitCode() + ")",
                        result.output());
            }

            Files.move(temp, crontabPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            temp = null;
        } catch (IOException e) {
            throw new CrontabSyncException("failed to write crontab " + crontabPath + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CrontabSyncException("interrupted while installing crontab", e);
        } finally {
            deleteTemp(temp);
        }

        log.info("Installed crontab {} with {} entr{}", crontabPath, schedules.size(),
                schedules.size() == 1 ? "y" : "ies");
        return schedules.size();
    }

    /** One line per schedule: {@code <cron> <executable> <schedule id>}. */
    String render(List<Schedule> schedules) {
        StringBuilder sb = new StringBuilder();
        for (Schedule schedule : schedules) {
            sb.append(String.format("%s %s %d\n", schedule.cronExpression(), executable, schedule.id()));
        }
        return sb.toString();
    }

    private void deleteTemp(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to remove temporary crontab {}: {}", temp, e.getMessage());
        }
    }
}
