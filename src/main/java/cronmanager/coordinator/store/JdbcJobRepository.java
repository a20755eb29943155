package cronmanager.coordinator.store;

import cronmanager.coordinator.model.Job;
import cronmanager.coordinator.model.JobStatus;
import cronmanager.coordinator.repository.JobRepository;
import cronmanager.coordinator.repository.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of JobRepository.
 * Each write is a single-row statement committed on its own.
 */
public class JdbcJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobRepository.class);

    private static final String ACTIVE = "status IN ('pending', 'running')";

    private final Database db;

    public JdbcJobRepository(Database db) {
        this.db = db;
    }

    @Override
    public Job create(long scheduleId) {
        String sql = """
                    INSERT INTO jobs (schedule_id, status, created_at, updated_at)
                    VALUES (?, ?, ?, ?)
                """;

        long id;
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            Timestamp now = Timestamp.from(Instant.now());
            ps.setLong(1, scheduleId);
            ps.setString(2, JobStatus.PENDING.dbValue());
            ps.setTimestamp(3, now);
            ps.setTimestamp(4, now);
            ps.executeUpdate();

            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("no id generated for job of schedule " + scheduleId);
                }
                id = keys.getLong(1);
            }
            conn.commit();
        } catch (SQLException e) {
            throw new StoreException("Failed to create job for schedule: " + scheduleId, e);
        }

        log.debug("Created job {} for schedule {}", id, scheduleId);
        return findById(id).orElseThrow(() -> NotFoundException.job(id));
    }

    @Override
    public void updateStatus(long jobId, JobStatus status) {
        String sql = "UPDATE jobs SET status = ?, updated_at = ? WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.dbValue());
            ps.setTimestamp(2, Timestamp.from(Instant.now()));
            ps.setLong(3, jobId);
            requireRow(ps.executeUpdate(), jobId);
            conn.commit();
        } catch (SQLException e) {
            throw new StoreException("Failed to update job status: " + jobId, e);
        }
    }

    @Override
    public void updateMachine(long jobId, String machineId) {
        String sql = "UPDATE jobs SET machine_id = ?, updated_at = ? WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, machineId);
            ps.setTimestamp(2, Timestamp.from(Instant.now()));
            ps.setLong(3, jobId);
            requireRow(ps.executeUpdate(), jobId);
            conn.commit();
        } catch (SQLException e) {
            throw new StoreException("Failed to update job machine: " + jobId, e);
        }
    }

    @Override
    public void fail(long jobId, int exitCode, String message) {
        requireRow(finish(jobId, JobStatus.FAILED, exitCode, "stderr", message, false), jobId);
    }

    @Override
    public void complete(long jobId, int exitCode, String stdout) {
        requireRow(finish(jobId, JobStatus.COMPLETED, exitCode, "stdout", stdout, false), jobId);
    }

    @Override
    public boolean failIfActive(long jobId, int exitCode, String message) {
        return finish(jobId, JobStatus.FAILED, exitCode, "stderr", message, true) > 0;
    }

    @Override
    public boolean completeIfActive(long jobId, int exitCode, String stdout) {
        return finish(jobId, JobStatus.COMPLETED, exitCode, "stdout", stdout, true) > 0;
    }

    @Override
    public Optional<Job> findById(long jobId) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT * FROM jobs WHERE id = ?")) {

            ps.setLong(1, jobId);
            List<Job> jobs = executeQuery(ps);
            return jobs.isEmpty() ? Optional.empty() : Optional.of(jobs.get(0));
        } catch (SQLException e) {
            throw new StoreException("Failed to find job: " + jobId, e);
        }
    }

    @Override
    public Optional<Job> findByMachineId(String machineId) {
        String sql = "SELECT * FROM jobs WHERE machine_id = ? ORDER BY id DESC LIMIT 1";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, machineId);
            List<Job> jobs = executeQuery(ps);
            return jobs.isEmpty() ? Optional.empty() : Optional.of(jobs.get(0));
        } catch (SQLException e) {
            throw new StoreException("Failed to find job by machine: " + machineId, e);
        }
    }

    @Override
    public List<Job> findBySchedule(long scheduleId, int limit) {
        String sql = "SELECT * FROM jobs WHERE schedule_id = ? ORDER BY id DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, scheduleId);
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to list jobs of schedule: " + scheduleId, e);
        }
    }

    @Override
    public List<Job> findByStatus(JobStatus status) {
        String sql = "SELECT * FROM jobs WHERE status = ? ORDER BY id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.dbValue());
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find jobs by status: " + status, e);
        }
    }

    @Override
    public List<Job> findReconcilable() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT * FROM jobs WHERE " + ACTIVE + " ORDER BY id")) {
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find reconcilable jobs", e);
        }
    }

    // --- Helpers ---

    /**
     * Terminal write. {@code outputColumn} is {@code stdout} for completions and
     * {@code stderr} (which holds the failure message) for failures.
     *
     * @return rows changed
     */
    private int finish(long jobId, JobStatus status, int exitCode, String outputColumn, String output,
            boolean onlyActive) {
        String sql = "UPDATE jobs SET status = ?, exit_code = ?, " + outputColumn + " = ?, updated_at = ?, finished_at = ?"
                + " WHERE id = ?" + (onlyActive ? " AND " + ACTIVE : "");

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Timestamp now = Timestamp.from(Instant.now());
            ps.setString(1, status.dbValue());
            ps.setInt(2, exitCode);
            ps.setString(3, output);
            ps.setTimestamp(4, now);
            ps.setTimestamp(5, now);
            ps.setLong(6, jobId);

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Job {} -> {} (exit code {})", jobId, status, exitCode);
            }
            return updated;
        } catch (SQLException e) {
            throw new StoreException("Failed to mark job " + status.dbValue() + ": " + jobId, e);
        }
    }

    private static void requireRow(int updated, long jobId) {
        if (updated == 0) {
            throw NotFoundException.job(jobId);
        }
    }

    private List<Job> executeQuery(PreparedStatement ps) throws SQLException {
        List<Job> jobs = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                jobs.add(mapRow(rs));
            }
        }
        return jobs;
    }

    private Job mapRow(ResultSet rs) throws SQLException {
        int code = rs.getInt("exit_code");
        Integer exitCode = rs.wasNull() ? null : code;
        return Job.builder()
                .id(rs.getLong("id"))
                .scheduleId(rs.getLong("schedule_id"))
                .status(JobStatus.fromDb(rs.getString("status")))
                .machineId(rs.getString("machine_id"))
                .exitCode(exitCode)
                .stdout(rs.getString("stdout"))
                .stderr(rs.getString("stderr"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .finishedAt(toInstant(rs.getTimestamp("finished_at")))
                .build();
    }

    private Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
