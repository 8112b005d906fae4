package villagecompute.wpautomation.observability;

import java.util.UUID;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;

import org.jboss.logging.MDC;

/**
 * Structured logging helpers for automation work units.
 *
 * <p>
 * Background work (job processing, schedule firings, bulk operations) runs outside any request, so every unit sets the
 * identifiers below on entry and calls {@link #clearMDC()} in a {@code finally} block. The console pattern in
 * {@code application.yaml} prints them alongside each line.
 *
 * <p>
 * <b>MDC Keys:</b>
 * <ul>
 * <li>{@code trace_id}, {@code span_id} - OpenTelemetry correlation</li>
 * <li>{@code user_id} - owner of the record being processed</li>
 * <li>{@code job_id} - article job being processed</li>
 * <li>{@code schedule_id} - schedule being fired</li>
 * <li>{@code bulk_operation_id} - bulk operation being applied</li>
 * </ul>
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_USER_ID = "user_id";

    public static final String MDC_JOB_ID = "job_id";

    public static final String MDC_SCHEDULE_ID = "schedule_id";

    public static final String MDC_BULK_OPERATION_ID = "bulk_operation_id";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Copies the current span's trace and span ids into the MDC. Empty strings are written when no span is active so
     * the log layout stays stable.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();

        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    public static void setUserId(UUID userId) {
        put(MDC_USER_ID, userId);
    }

    public static void setJobId(UUID jobId) {
        put(MDC_JOB_ID, jobId);
    }

    public static void setScheduleId(UUID scheduleId) {
        put(MDC_SCHEDULE_ID, scheduleId);
    }

    public static void setBulkOperationId(UUID operationId) {
        put(MDC_BULK_OPERATION_ID, operationId);
    }

    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_USER_ID);
        MDC.remove(MDC_JOB_ID);
        MDC.remove(MDC_SCHEDULE_ID);
        MDC.remove(MDC_BULK_OPERATION_ID);
    }

    private static void put(String key, UUID value) {
        if (value != null) {
            MDC.put(key, value.toString());
        }
    }
}
