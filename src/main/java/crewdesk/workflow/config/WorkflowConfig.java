package crewdesk.workflow.config;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration holder for the workflow core.
 * All settings have sensible defaults.
 */
public final class WorkflowConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/crewdesk;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Cron trigger auth (optional)
    private String cronSecret = null; // If set, /internal/* requires "Authorization: Bearer <secret>"

    // Task settings
    private int defaultMaxAttempts = 3;
    private int pollBatchSize = 50;
    private Duration pollInterval = Duration.ofMinutes(1);
    private Duration taskLeaseTimeout = Duration.ofMinutes(10);
    private Duration taskReaperInterval = Duration.ofMinutes(1);
    private Duration retryBackoff = Duration.ZERO;
    private boolean embeddedPolling = true;

    // Cascade settings
    private Duration offerTimeout = null; // null disables automatic offer expiry
    private Duration offerSweepInterval = Duration.ofMinutes(5);

    // Follow-up settings
    private List<Integer> leadFollowUpDelaysMinutes = List.of(0, 10, 15, 20, 30);
    private Duration doubleCallGap = Duration.ofSeconds(30);
    private Duration postServiceDelay = Duration.ofHours(2);

    // Business settings
    private ZoneId businessZone = ZoneId.of("America/Los_Angeles");
    private String businessName = "Our team";
    private String ownerPhone = null;
    private String serviceAreaZip = "90001";

    private WorkflowConfig() {
    }

    public static WorkflowConfig defaults() {
        return new WorkflowConfig();
    }

    public static WorkflowConfig fromEnv() {
        WorkflowConfig config = new WorkflowConfig();

        // Override from environment variables
        String dbUrl = System.getenv("CREWDESK_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = System.getenv("CREWDESK_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String cronSecret = System.getenv("CREWDESK_CRON_SECRET");
        if (cronSecret != null && !cronSecret.isBlank()) {
            config.cronSecret = cronSecret;
        }

        String maxAttempts = System.getenv("CREWDESK_MAX_ATTEMPTS");
        if (maxAttempts != null && !maxAttempts.isBlank()) {
            config.defaultMaxAttempts = Integer.parseInt(maxAttempts);
        }

        String leaseMinutes = System.getenv("CREWDESK_TASK_LEASE_MINUTES");
        if (leaseMinutes != null && !leaseMinutes.isBlank()) {
            config.taskLeaseTimeout = Duration.ofMinutes(Long.parseLong(leaseMinutes));
        }

        String backoffSeconds = System.getenv("CREWDESK_RETRY_BACKOFF_SECONDS");
        if (backoffSeconds != null && !backoffSeconds.isBlank()) {
            config.retryBackoff = Duration.ofSeconds(Long.parseLong(backoffSeconds));
        }

        String offerTimeoutMinutes = System.getenv("CREWDESK_OFFER_TIMEOUT_MINUTES");
        if (offerTimeoutMinutes != null && !offerTimeoutMinutes.isBlank()) {
            config.offerTimeout = Duration.ofMinutes(Long.parseLong(offerTimeoutMinutes));
        }

        String embedded = System.getenv("CREWDESK_EMBEDDED_POLLING");
        if (embedded != null && !embedded.isBlank()) {
            config.embeddedPolling = Boolean.parseBoolean(embedded);
        }

        String zone = System.getenv("CREWDESK_TIMEZONE");
        if (zone != null && !zone.isBlank()) {
            config.businessZone = ZoneId.of(zone);
        }

        String businessName = System.getenv("CREWDESK_BUSINESS_NAME");
        if (businessName != null && !businessName.isBlank()) {
            config.businessName = businessName;
        }

        String ownerPhone = System.getenv("CREWDESK_OWNER_PHONE");
        if (ownerPhone != null && !ownerPhone.isBlank()) {
            config.ownerPhone = ownerPhone;
        }

        String zip = System.getenv("CREWDESK_SERVICE_AREA_ZIP");
        if (zip != null && !zip.isBlank()) {
            config.serviceAreaZip = zip;
        }

        String delays = System.getenv("CREWDESK_LEAD_FOLLOWUP_DELAYS");
        if (delays != null && !delays.isBlank()) {
            config.leadFollowUpDelaysMinutes = parseDelays(delays);
        }

        return config;
    }

    static List<Integer> parseDelays(String csv) {
        List<Integer> result = new ArrayList<>();
        for (String part : csv.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                result.add(Integer.parseInt(trimmed));
            }
        }
        return List.copyOf(result);
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public String cronSecret() {
        return cronSecret;
    }

    public boolean hasCronSecret() {
        return cronSecret != null && !cronSecret.isBlank();
    }

    public int defaultMaxAttempts() {
        return defaultMaxAttempts;
    }

    public int pollBatchSize() {
        return pollBatchSize;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public Duration taskLeaseTimeout() {
        return taskLeaseTimeout;
    }

    public Duration taskReaperInterval() {
        return taskReaperInterval;
    }

    public Duration retryBackoff() {
        return retryBackoff;
    }

    public boolean embeddedPolling() {
        return embeddedPolling;
    }

    public Duration offerTimeout() {
        return offerTimeout;
    }

    public boolean hasOfferTimeout() {
        return offerTimeout != null && !offerTimeout.isZero() && !offerTimeout.isNegative();
    }

    public Duration offerSweepInterval() {
        return offerSweepInterval;
    }

    public List<Integer> leadFollowUpDelaysMinutes() {
        return leadFollowUpDelaysMinutes;
    }

    public Duration doubleCallGap() {
        return doubleCallGap;
    }

    public Duration postServiceDelay() {
        return postServiceDelay;
    }

    public ZoneId businessZone() {
        return businessZone;
    }

    public String businessName() {
        return businessName;
    }

    public String ownerPhone() {
        return ownerPhone;
    }

    public boolean hasOwnerPhone() {
        return ownerPhone != null && !ownerPhone.isBlank();
    }

    public String serviceAreaZip() {
        return serviceAreaZip;
    }

    // Fluent setters for testing/customization
    public WorkflowConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public WorkflowConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public WorkflowConfig withCronSecret(String secret) {
        this.cronSecret = secret;
        return this;
    }

    public WorkflowConfig withMaxAttempts(int attempts) {
        this.defaultMaxAttempts = attempts;
        return this;
    }

    public WorkflowConfig withPollBatchSize(int batchSize) {
        this.pollBatchSize = batchSize;
        return this;
    }

    public WorkflowConfig withTaskLeaseTimeout(Duration timeout) {
        this.taskLeaseTimeout = timeout;
        return this;
    }

    public WorkflowConfig withRetryBackoff(Duration backoff) {
        this.retryBackoff = backoff;
        return this;
    }

    public WorkflowConfig withEmbeddedPolling(boolean enabled) {
        this.embeddedPolling = enabled;
        return this;
    }

    public WorkflowConfig withOfferTimeout(Duration timeout) {
        this.offerTimeout = timeout;
        return this;
    }

    public WorkflowConfig withLeadFollowUpDelays(List<Integer> delaysMinutes) {
        this.leadFollowUpDelaysMinutes = List.copyOf(delaysMinutes);
        return this;
    }

    public WorkflowConfig withDoubleCallGap(Duration gap) {
        this.doubleCallGap = gap;
        return this;
    }

    public WorkflowConfig withPostServiceDelay(Duration delay) {
        this.postServiceDelay = delay;
        return this;
    }

    public WorkflowConfig withBusinessZone(ZoneId zone) {
        this.businessZone = zone;
        return this;
    }

    public WorkflowConfig withBusinessName(String name) {
        this.businessName = name;
        return this;
    }

    public WorkflowConfig withOwnerPhone(String phone) {
        this.ownerPhone = phone;
        return this;
    }

    public WorkflowConfig withServiceAreaZip(String zip) {
        this.serviceAreaZip = zip;
        return this;
    }

    @Override
    public String toString() {
        return "WorkflowConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", maxAttempts=" + defaultMaxAttempts +
                ", leaseTimeout=" + taskLeaseTimeout +
                ", embeddedPolling=" + embeddedPolling +
                ", zone=" + businessZone +
                ", cronSecretSet=" + hasCronSecret() +
                '}';
    }
}
