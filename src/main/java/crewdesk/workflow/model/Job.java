package crewdesk.workflow.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Objects;

/**
 * A booked service visit. Owned by the booking side of the business; the
 * workflow core only moves its date and records crew confirmation and
 * customer notification.
 */
public final class Job {
    private final long id;
    private final String tenantId;
    private final String customerName;
    private final String customerPhone;
    private final String address;
    private final LocalDate serviceDate;
    private final LocalTime scheduledTime;
    private final Double price;
    private final JobStatus status;
    private final Long cleanerId;
    private final Double latitude;
    private final Double longitude;
    private final boolean cleanerConfirmed;
    private final boolean customerNotified;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Job(Builder builder) {
        this.id = builder.id;
        this.tenantId = builder.tenantId;
        this.customerName = builder.customerName;
        this.customerPhone = builder.customerPhone;
        this.address = builder.address;
        this.serviceDate = Objects.requireNonNull(builder.serviceDate, "serviceDate is required");
        this.scheduledTime = builder.scheduledTime;
        this.price = builder.price;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.cleanerId = builder.cleanerId;
        this.latitude = builder.latitude;
        this.longitude = builder.longitude;
        this.cleanerConfirmed = builder.cleanerConfirmed;
        this.customerNotified = builder.customerNotified;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    public long id() {
        return id;
    }

    public String tenantId() {
        return tenantId;
    }

    public String customerName() {
        return customerName;
    }

    public String customerPhone() {
        return customerPhone;
    }

    public String address() {
        return address;
    }

    public LocalDate serviceDate() {
        return serviceDate;
    }

    public LocalTime scheduledTime() {
        return scheduledTime;
    }

    public Double price() {
        return price;
    }

    public JobStatus status() {
        return status;
    }

    public Long cleanerId() {
        return cleanerId;
    }

    public Double latitude() {
        return latitude;
    }

    public Double longitude() {
        return longitude;
    }

    public boolean cleanerConfirmed() {
        return cleanerConfirmed;
    }

    public boolean customerNotified() {
        return customerNotified;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public boolean hasLocation() {
        return latitude != null && longitude != null;
    }

    public boolean hasCustomerPhone() {
        return customerPhone != null && !customerPhone.isBlank();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .tenantId(tenantId)
                .customerName(customerName)
                .customerPhone(customerPhone)
                .address(address)
                .serviceDate(serviceDate)
                .scheduledTime(scheduledTime)
                .price(price)
                .status(status)
                .cleanerId(cleanerId)
                .latitude(latitude)
                .longitude(longitude)
                .cleanerConfirmed(cleanerConfirmed)
                .customerNotified(customerNotified)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long id;
        private String tenantId;
        private String customerName;
        private String customerPhone;
        private String address;
        private LocalDate serviceDate;
        private LocalTime scheduledTime;
        private Double price;
        private JobStatus status = JobStatus.SCHEDULED;
        private Long cleanerId;
        private Double latitude;
        private Double longitude;
        private boolean cleanerConfirmed;
        private boolean customerNotified;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder customerName(String customerName) {
            this.customerName = customerName;
            return this;
        }

        public Builder customerPhone(String customerPhone) {
            this.customerPhone = customerPhone;
            return this;
        }

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder serviceDate(LocalDate serviceDate) {
            this.serviceDate = serviceDate;
            return this;
        }

        public Builder scheduledTime(LocalTime scheduledTime) {
            this.scheduledTime = scheduledTime;
            return this;
        }

        public Builder price(Double price) {
            this.price = price;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder cleanerId(Long cleanerId) {
            this.cleanerId = cleanerId;
            return this;
        }

        public Builder latitude(Double latitude) {
            this.latitude = latitude;
            return this;
        }

        public Builder longitude(Double longitude) {
            this.longitude = longitude;
            return this;
        }

        public Builder cleanerConfirmed(boolean cleanerConfirmed) {
            this.cleanerConfirmed = cleanerConfirmed;
            return this;
        }

        public Builder customerNotified(boolean customerNotified) {
            this.customerNotified = customerNotified;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Job job))
            return false;
        return id == job.id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "Job{id=" + id + ", serviceDate=" + serviceDate + ", status=" + status
                + ", cleanerId=" + cleanerId + ", confirmed=" + cleanerConfirmed + "}";
    }
}
