package crewdesk.workflow.support;

import crewdesk.workflow.model.Cleaner;
import crewdesk.workflow.model.Job;
import crewdesk.workflow.model.JobStatus;
import crewdesk.workflow.repository.CleanerRepository;
import crewdesk.workflow.repository.JobRepository;
import crewdesk.workflow.store.Database;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.LocalTime;

public final class Fixtures {

    private Fixtures() {
    }

    public static Job job(JobRepository jobs, LocalDate date, String customer) {
        return jobs.insert(Job.builder()
                .customerName(customer)
                .customerPhone("+1555" + Math.abs(customer.hashCode() % 10_000_000))
                .address(customer + " residence")
                .serviceDate(date)
                .scheduledTime(LocalTime.of(9, 0))
                .build());
    }

    public static Job jobAt(JobRepository jobs, LocalDate date, LocalTime time, String customer) {
        return jobs.insert(Job.builder()
                .customerName(customer)
                .customerPhone("+1555" + Math.abs(customer.hashCode() % 10_000_000))
                .serviceDate(date)
                .scheduledTime(time)
                .build());
    }

    public static Cleaner cleaner(CleanerRepository cleaners, String name) {
        return cleaners.insert(new Cleaner(0L, null, name, "+1666" + Math.abs(name.hashCode() % 10_000_000),
                "chat-" + name, true, false, null, null));
    }

    public static Cleaner cleanerAt(CleanerRepository cleaners, String name, double lat, double lon) {
        return cleaners.insert(new Cleaner(0L, null, name, "+1666" + Math.abs(name.hashCode() % 10_000_000),
                "chat-" + name, true, false, lat, lon));
    }

    /**
     * Change a job's status the way the booking side would.
     */
    public static void setStatus(Database db, long jobId, JobStatus status) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("UPDATE jobs SET status = ? WHERE id = ?")) {
            ps.setString(1, status.name());
            ps.setLong(2, jobId);
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to set status of job " + jobId, e);
        }
    }
}
