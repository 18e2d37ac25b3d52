package com.planorama.rsvp.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Metrics service for monitoring and observability.
 * Records custom meters through Micrometer; they reach CloudWatch when the CloudWatch
 * registry is enabled (see {@link com.planorama.rsvp.config.CloudWatchConfig}).
 *
 * Key Metrics:
 * - RSVP admissions and rejections by reason
 * - Admission latency
 * - Invitations issued and email dispatch outcome
 * - Rate limit rejections
 * - Error counts
 *
 * @author Planorama Team
 */
@Service
public class CloudWatchMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(CloudWatchMetricsService.class);

    private final MeterRegistry meterRegistry;

    private static final String METRIC_PREFIX = "rsvp.";
    private static final String ADMISSION_PREFIX = METRIC_PREFIX + "admission.";
    private static final String INVITATION_PREFIX = METRIC_PREFIX + "invitation.";
    private static final String EMAIL_PREFIX = METRIC_PREFIX + "email.";

    public CloudWatchMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Record an admitted response.
     *
     * @param path "token" or "user"
     * @param status Wire value of the status
     */
    public void recordRsvpAdmitted(String path, String status) {
        Counter.builder(ADMISSION_PREFIX + "success")
                .tag("path", path)
                .tag("status", status)
                .description("Admitted RSVP responses")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded RSVP admission, path: {}, status: {}", path, status);
    }

    /**
     * Record a rejected response.
     *
     * @param reason e.g. "CAPACITY_EXCEEDED", "ALREADY_RESPONDED", "INVALID_STATUS"
     */
    public void recordRsvpRejected(String reason) {
        Counter.builder(ADMISSION_PREFIX + "rejected")
                .tag("reason", reason)
                .description("Rejected RSVP responses")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded RSVP rejection, reason: {}", reason);
    }

    /**
     * Record time spent inside the admission transaction.
     *
     * @param durationMs Duration in milliseconds
     */
    public void recordAdmissionLatency(long durationMs) {
        Timer.builder(ADMISSION_PREFIX + "latency")
                .description("Token admission latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordInvitationCreated(boolean emailSent) {
        Counter.builder(INVITATION_PREFIX + "created")
                .tag("email_sent", String.valueOf(emailSent))
                .description("Invitation tokens issued")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record the outcome of handing an email to the transport.
     *
     * @param kind "invitation" or "direct"
     * @param success Whether the transport accepted the message
     */
    public void recordEmailDispatch(String kind, boolean success) {
        Counter.builder(EMAIL_PREFIX + (success ? "sent" : "failed"))
                .tag("kind", kind)
                .description("Email dispatch outcomes")
                .register(meterRegistry)
                .increment();
    }

    public void recordRateLimitRejection(String policy) {
        Counter.builder(METRIC_PREFIX + "ratelimit.rejected")
                .tag("policy", policy)
                .description("Requests rejected by rate limiting")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record an unexpected error.
     *
     * @param errorType Error type
     * @param operation Operation that failed
     */
    public void recordError(String errorType, String operation) {
        Counter.builder(METRIC_PREFIX + "errors")
                .tag("error_type", errorType)
                .tag("operation", operation)
                .description("Application errors")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded error, type: {}, operation: {}", errorType, operation);
    }
}
