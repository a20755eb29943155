package cronmanager.coordinator.service;

import cronmanager.coordinator.model.Schedule;
import cronmanager.coordinator.model.ScheduleDefinition;
import cronmanager.coordinator.repository.NotFoundException;
import cronmanager.coordinator.repository.ScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Administrative schedule operations. Changes are pushed to the crontab right away.
 */
public class ScheduleService {

    private static final Logger log = LoggerFactory.getLogger(ScheduleService.class);

    private final ScheduleRepository scheduleRepository;
    private final CrontabSync crontabSync;

    public ScheduleService(ScheduleRepository scheduleRepository, CrontabSync crontabSync) {
        this.scheduleRepository = scheduleRepository;
        this.crontabSync = crontabSync;
    }

    public List<Schedule> list() {
        return scheduleRepository.findAll();
    }

    public Schedule get(long id) {
        return scheduleRepository.getById(id);
    }

    /**
     * @throws IllegalArgumentException if the definition is invalid or the name is taken
     */
    public Schedule create(ScheduleDefinition definition) {
        definition.validate();
        CronExpressions.validate(definition.schedule());

        Schedule schedule = definition.toSchedule();
        if (scheduleRepository.findByName(schedule.name()).isPresent()) {
            throw new IllegalArgumentException("schedule '" + schedule.name() + "' already exists");
        }

        Schedule created = scheduleRepository.create(schedule);
        log.info("Created schedule {} (id {})", created.name(), created.id());
        resyncCrontab();
        return created;
    }

    /**
     * Delete a schedule and its job history.
     */
    public void delete(long id) {
        if (!scheduleRepository.deleteById(id)) {
            throw NotFoundException.schedule(id);
        }
        log.info("Deleted schedule {}", id);
        resyncCrontab();
    }

    public void deleteByName(String name) {
        if (!scheduleRepository.deleteByName(name)) {
            throw NotFoundException.schedule(name);
        }
        log.info("Deleted schedule {}", name);
        resyncCrontab();
    }

    /**
     * The store change already happened; a crontab that lags behind is reported, not fatal.
     */
    private void resyncCrontab() {
        try {
            crontabSync.sync();
        } catch (CrontabSyncException e) {
            log.warn("Schedule saved but crontab sync failed: {}", e.getMessage());
        }
    }
}
