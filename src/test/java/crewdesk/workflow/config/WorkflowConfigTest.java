package crewdesk.workflow.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowConfigTest {

    @Test
    void defaults() {
        WorkflowConfig config = WorkflowConfig.defaults();

        assertEquals(3, config.defaultMaxAttempts());
        assertEquals(Duration.ofMinutes(10), config.taskLeaseTimeout());
        assertEquals(Duration.ZERO, config.retryBackoff());
        assertEquals(List.of(0, 10, 15, 20, 30), config.leadFollowUpDelaysMinutes());
        assertEquals(Duration.ofHours(2), config.postServiceDelay());
        assertEquals(ZoneId.of("America/Los_Angeles"), config.businessZone());
        assertNull(config.offerTimeout());
        assertFalse(config.hasCronSecret());
        assertFalse(config.hasOwnerPhone());
    }

    @Test
    void fluentOverrides() {
        WorkflowConfig config = WorkflowConfig.defaults()
                .withCronSecret("abc")
                .withOwnerPhone("+15550000000")
                .withLeadFollowUpDelays(List.of(1, 2))
                .withBusinessZone(ZoneId.of("America/Chicago"));

        assertTrue(config.hasCronSecret());
        assertTrue(config.hasOwnerPhone());
        assertEquals(List.of(1, 2), config.leadFollowUpDelaysMinutes());
        assertEquals(ZoneId.of("America/Chicago"), config.businessZone());
        assertFalse(config.toString().contains("abc"), "secret must not be logged");
    }

    @Test
    void delaysParseFromCommaSeparatedList() {
        assertEquals(List.of(0, 5, 30), WorkflowConfig.parseDelays(" 0, 5,30 ,"));
        assertThrows(NumberFormatException.class, () -> WorkflowConfig.parseDelays("0,soon"));
    }
}
