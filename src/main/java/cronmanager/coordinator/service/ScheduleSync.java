package cronmanager.coordinator.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import cronmanager.coordinator.model.Schedule;
import cronmanager.coordinator.model.ScheduleDefinition;
import cronmanager.coordinator.repository.ScheduleRepository;
import cronmanager.coordinator.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Makes the stored schedules match the declarative schedules file, keyed by
 * name: missing ones are created, changed ones overwritten, and ones no longer
 * in the file deleted together with their jobs.
 */
public class ScheduleSync {

    private static final Logger log = LoggerFactory.getLogger(ScheduleSync.class);

    private final ScheduleRepository scheduleRepository;
    private final ObjectMapper mapper = Json.mapper();

    public ScheduleSync(ScheduleRepository scheduleRepository) {
        this.scheduleRepository = scheduleRepository;
    }

    /**
     * What a sync changed, by schedule name.
     */
    public record Result(List<String> created, List<String> updated, List<String> deleted, int unchanged) {

        public boolean changed() {
            return !created.isEmpty() || !updated.isEmpty() || !deleted.isEmpty();
        }
    }

    public Result sync(Path file) {
        return apply(read(file));
    }

    /**
     * Validates every definition before touching the store.
     *
     * @throws ScheduleFileException if any definition is invalid
     */
    public Result apply(List<ScheduleDefinition> definitions) {
        Map<String, Schedule> desired = new LinkedHashMap<>();
        for (ScheduleDefinition definition : definitions) {
            Schedule schedule;
            try {
                definition.validate();
                CronExpressions.validate(definition.schedule());
                schedule = definition.toSchedule();
            } catch (IllegalArgumentException e) {
                throw new ScheduleFileException(e.getMessage(), e);
            }
            if (desired.put(schedule.name(), schedule) != null) {
                throw new ScheduleFileException("duplicate schedule name '" + schedule.name() + "'");
            }
        }

        Map<String, Schedule> existing = new LinkedHashMap<>();
        for (Schedule schedule : scheduleRepository.findAll()) {
            existing.put(schedule.name(), schedule);
        }

        List<String> created = new ArrayList<>();
        List<String> updated = new ArrayList<>();
        int unchanged = 0;

        for (Schedule schedule : desired.values()) {
            Schedule current = existing.get(schedule.name());
            if (current == null) {
                scheduleRepository.create(schedule);
                created.add(schedule.name());
                log.info("Created schedule {}", schedule.name());
            } else if (!current.sameDefinitionAs(schedule)) {
                scheduleRepository.update(schedule);
                updated.add(schedule.name());
                log.info("Updated schedule {}", schedule.name());
            } else {
                unchanged++;
            }
        }

        Set<String> keep = new HashSet<>(desired.keySet());
        List<String> deleted = new ArrayList<>();
        for (String name : existing.keySet()) {
            if (!keep.contains(name)) {
                scheduleRepository.deleteByName(name);
                deleted.add(name);
                log.info("Deleted schedule {} and its jobs", name);
            }
        }

        log.info("Schedule sync: {} created, {} updated, {} deleted, {} unchanged",
                created.size(), updated.size(), deleted.size(), unchanged);
        return new Result(created, updated, deleted, unchanged);
    }

    /**
     * Parse the schedules file. A missing or empty file means no schedules.
     */
    public List<ScheduleDefinition> read(Path file) {
        if (!Files.exists(file)) {
            log.warn("Schedules file {} does not exist, treating it as empty", file);
            return List.of();
        }
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            if (content.isBlank()) {
                return List.of();
            }
            List<ScheduleDefinition> definitions = mapper.readValue(content,
                    new TypeReference<List<ScheduleDefinition>>() {
                    });
            return definitions == null ? List.of() : definitions;
        } catch (IOException e) {
            throw new ScheduleFileException("failed to read schedules file " + file + ": " + e.getMessage(), e);
        }
    }
}
