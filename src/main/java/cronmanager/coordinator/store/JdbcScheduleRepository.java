package cronmanager.coordinator.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import cronmanager.cloud.model.MachineConfig;
import cronmanager.coordinator.model.Schedule;
import cronmanager.coordinator.repository.NotFoundException;
import cronmanager.coordinator.repository.ScheduleRepository;
import cronmanager.coordinator.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of ScheduleRepository.
 * The machine launch config is kept as JSON text in {@code schedules.config}.
 */
public class JdbcScheduleRepository implements ScheduleRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcScheduleRepository.class);

    private final Database db;
    private final ObjectMapper mapper = Json.mapper();

    public JdbcScheduleRepository(Database db) {
        this.db = db;
    }

    @Override
    public Schedule create(Schedule schedule) {
        String sql = """
                    INSERT INTO schedules (name, app_name, schedule, region, command, command_timeout, enabled, config)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            bindDefinition(ps, schedule);
            ps.executeUpdate();

            long id;
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("no id generated for schedule " + schedule.name());
                }
                id = keys.getLong(1);
            }
            conn.commit();

            log.debug("Created schedule {} with id {}", schedule.name(), id);
            return schedule.toBuilder().id(id).build();
        } catch (SQLException e) {
            throw new StoreException("Failed to create schedule: " + schedule.name(), e);
        }
    }

    @Override
    public Schedule update(Schedule schedule) {
        String sql = """
                    UPDATE schedules
                    SET app_name = ?, schedule = ?, region = ?, command = ?, command_timeout = ?, enabled = ?, config = ?
                    WHERE name = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, schedule.appName());
            ps.setString(2, schedule.cronExpression());
            ps.setString(3, schedule.region());
            ps.setString(4, schedule.command());
            ps.setInt(5, schedule.commandTimeout());
            ps.setBoolean(6, schedule.enabled());
            ps.setString(7, toJson(schedule.config()));
            ps.setString(8, schedule.name());

            int updated = ps.executeUpdate();
            conn.commit();
            if (updated == 0) {
                throw NotFoundException.schedule(schedule.name());
            }

            log.debug("Updated schedule {}", schedule.name());
        } catch (SQLException e) {
            throw new StoreException("Failed to update schedule: " + schedule.name(), e);
        }
        return getByName(schedule.name());
    }

    @Override
    public boolean deleteById(long id) {
        return delete("id = ?", ps -> ps.setLong(1, id), String.valueOf(id));
    }

    @Override
    public boolean deleteByName(String name) {
        return delete("name = ?", ps -> ps.setString(1, name), name);
    }

    @Override
    public Optional<Schedule> findById(long id) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT * FROM schedules WHERE id = ?")) {

            ps.setLong(1, id);
            return findOne(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find schedule: " + id, e);
        }
    }

    @Override
    public Optional<Schedule> findByName(String name) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT * FROM schedules WHERE name = ?")) {

            ps.setString(1, name);
            return findOne(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find schedule: " + name, e);
        }
    }

    @Override
    public List<Schedule> findAll() {
        return executeQuery("SELECT * FROM schedules ORDER BY id");
    }

    @Override
    public List<Schedule> findEnabled() {
        return executeQuery("SELECT * FROM schedules WHERE enabled = TRUE ORDER BY id");
    }

    // --- Helpers ---

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    /**
     * Jobs go first, in the same transaction, so history never outlives its schedule.
     */
    private boolean delete(String where, Binder binder, String key) {
        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(
                    "DELETE FROM jobs WHERE schedule_id IN (SELECT id FROM schedules WHERE " + where + ")")) {
                binder.bind(ps);
                int jobs = ps.executeUpdate();
                log.debug("Deleting {} job(s) of schedule {}", jobs, key);
            }

            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM schedules WHERE " + where)) {
                binder.bind(ps);
                int deleted = ps.executeUpdate();
                conn.commit();
                return deleted > 0;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to delete schedule: " + key, e);
        }
    }

    private void bindDefinition(PreparedStatement ps, Schedule schedule) throws SQLException {
        ps.setString(1, schedule.name());
        ps.setString(2, schedule.appName());
        ps.setString(3, schedule.cronExpression());
        ps.setString(4, schedule.region());
        ps.setString(5, schedule.command());
        ps.setInt(6, schedule.commandTimeout());
        ps.setBoolean(7, schedule.enabled());
        ps.setString(8, toJson(schedule.config()));
    }

    private Optional<Schedule> findOne(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            if (rs.next()) {
                return Optional.of(mapRow(rs));
            }
            return Optional.empty();
        }
    }

    private List<Schedule> executeQuery(String sql) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            List<Schedule> schedules = new ArrayList<>();
            while (rs.next()) {
                schedules.add(mapRow(rs));
            }
            return schedules;
        } catch (SQLException e) {
            throw new StoreException("Failed to list schedules", e);
        }
    }

    private Schedule mapRow(ResultSet rs) throws SQLException {
        return Schedule.builder()
                .id(rs.getLong("id"))
                .name(rs.getString("name"))
                .appName(rs.getString("app_name"))
                .cronExpression(rs.getString("schedule"))
                .region(rs.getString("region"))
                .command(rs.getString("command"))
                .commandTimeout(rs.getInt("command_timeout"))
                .enabled(rs.getBoolean("enabled"))
                .config(fromJson(rs.getString("config")))
                .build();
    }

    private String toJson(MachineConfig config) throws SQLException {
        try {
            return mapper.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new SQLException("Failed to encode machine config", e);
        }
    }

    private MachineConfig fromJson(String json) throws SQLException {
        try {
            return mapper.readValue(json, MachineConfig.class);
        } catch (JsonProcessingException e) {
            throw new SQLException("Failed to decode machine config", e);
        }
    }
}
