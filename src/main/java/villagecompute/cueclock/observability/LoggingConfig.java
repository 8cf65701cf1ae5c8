/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;
import villagecompute.cueclock.data.models.ScheduledJob;

/**
 * Standard MDC field names and helpers for enriching trigger-engine logs with contextual metadata.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier of the current dispatch span</li>
 * <li>{@code span_id} - Current span identifier within the trace</li>
 * <li>{@code event_id} - Calendar event the current trigger belongs to</li>
 * <li>{@code trigger_index} - Position of the trigger in the event's sorted trigger list</li>
 * <li>{@code job_due} - Due time of the job being dispatched</li>
 * <li>{@code action_sink} - Which sink the action targets (COMPANION or LOCAL_API)</li>
 * </ul>
 *
 * <p>
 * <b>Usage in the dispatch loop:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setJob(job);
 * try {
 *     dispatcher.dispatch(job);
 * } finally {
 *     LoggingConfig.clearMDC();
 * }
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> All methods operate on {@link MDC}, which uses ThreadLocal storage. The dispatch thread clears
 * MDC after each job to prevent context leaking into the next one.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    /**
     * Calendar event identifier (long as String).
     */
    public static final String MDC_EVENT_ID = "event_id";

    /**
     * Zero-based trigger index within the event's trigger list ordered by signed offset.
     */
    public static final String MDC_TRIGGER_INDEX = "trigger_index";

    /**
     * ISO-8601 local due time of the job, second resolution.
     */
    public static final String MDC_JOB_DUE = "job_due";

    public static final String MDC_ACTION_SINK = "action_sink";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Enriches MDC with trace_id and span_id from the current OpenTelemetry span. Empty strings are written when no
     * span is active so the JSON log shape stays stable.
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

    /**
     * Sets event, trigger, due time and sink fields for the given job.
     *
     * @param job
     *            the job about to be dispatched
     */
    public static void setJob(ScheduledJob job) {
        if (job == null) {
            return;
        }
        MDC.put(MDC_EVENT_ID, String.valueOf(job.event().id()));
        MDC.put(MDC_TRIGGER_INDEX, String.valueOf(job.triggerIndex()));
        MDC.put(MDC_JOB_DUE, job.due().toString());
        MDC.put(MDC_ACTION_SINK, job.trigger().action().sink().name());
    }

    /**
     * Clears all trigger-engine MDC fields.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_EVENT_ID);
        MDC.remove(MDC_TRIGGER_INDEX);
        MDC.remove(MDC_JOB_DUE);
        MDC.remove(MDC_ACTION_SINK);
    }
}
