package cronmanager.coordinator.repository;

import cronmanager.coordinator.model.Schedule;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Schedule persistence.
 */
public interface ScheduleRepository {

    /**
     * Insert a new schedule.
     *
     * @return the stored schedule with its assigned id
     */
    Schedule create(Schedule schedule);

    /**
     * Overwrite every field of the schedule with the same name.
     *
     * @return the stored schedule
     * @throws NotFoundException if no schedule has that name
     */
    Schedule update(Schedule schedule);

    /**
     * Delete a schedule and every job it owns.
     *
     * @return true if a schedule was deleted
     */
    boolean deleteById(long id);

    /**
     * Delete a schedule, looked up by name, and every job it owns.
     *
     * @return true if a schedule was deleted
     */
    boolean deleteByName(String name);

    Optional<Schedule> findById(long id);

    Optional<Schedule> findByName(String name);

    /** All schedules in insertion order. */
    List<Schedule> findAll();

    /** Schedules that belong in the crontab. */
    List<Schedule> findEnabled();

    default Schedule getById(long id) {
        return findById(id).orElseThrow(() -> NotFoundException.schedule(id));
    }

    default Schedule getByName(String name) {
        return findByName(name).orElseThrow(() -> NotFoundException.schedule(name));
    }
}
