/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.services;

import java.time.Duration;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.jboss.logging.Logger;

import villagecompute.cueclock.data.models.ActionSink;
import villagecompute.cueclock.data.models.ButtonPressAction;
import villagecompute.cueclock.data.models.InternalCallAction;
import villagecompute.cueclock.data.models.ScheduledJob;
import villagecompute.cueclock.data.models.TriggerAction;
import villagecompute.cueclock.exceptions.ActionRejectedException;
import villagecompute.cueclock.integration.ButtonPressSink;
import villagecompute.cueclock.integration.InternalCallSink;
import villagecompute.cueclock.observability.LoggingConfig;
import villagecompute.cueclock.observability.SchedulerMetrics;

/**
 * Executes a job's action against its sink and tracks sink connectivity.
 *
 * <p>
 * <b>Execution Flow:</b>
 * <ol>
 * <li>Button press: when the button-press service is not known to be connected it is probed first; if the probe fails
 * the press is skipped and counted as a failure</li>
 * <li>Internal call: the method and path are checked against {@link LocalPathPolicy} before any request is built, then
 * sent with the configured bounded timeout</li>
 * <li>The outcome is compared with the sink's last known state in {@link ConnectivityTracker}; only a flip produces a
 * WARN/INFO transition line</li>
 * </ol>
 *
 * <p>
 * <b>Error Handling:</b> {@link #dispatch(ScheduledJob)} never throws. Rejected internal calls are logged at ERROR and
 * do not count against the sink's connectivity since no request was made. Nothing is retried.
 *
 * <p>
 * <b>Telemetry:</b> each dispatch runs in a {@code trigger.dispatch} span with {@code event.id},
 * {@code trigger.index}, {@code action.sink} and {@code dispatch.result} attributes, and feeds the
 * {@code cueclock_dispatch_total} and {@code cueclock_dispatch_duration} meters.
 *
 * <p>
 * Instances are rebuilt by the dispatch loop whenever the runtime configuration changes; the connectivity tracker is
 * owned by the loop and handed to every new instance.
 */
public class ActionDispatcher {

    private static final Logger LOG = Logger.getLogger(ActionDispatcher.class);

    private final ButtonPressSink buttonPressSink;
    private final InternalCallSink internalCallSink;
    private final LocalPathPolicy pathPolicy;
    private final Duration internalCallTimeout;
    private final ConnectivityTracker connectivity;
    private final SchedulerMetrics metrics;
    private final Tracer tracer;

    public ActionDispatcher(ButtonPressSink buttonPressSink, InternalCallSink internalCallSink,
            LocalPathPolicy pathPolicy, Duration internalCallTimeout, ConnectivityTracker connectivity,
            SchedulerMetrics metrics, Tracer tracer) {
        this.buttonPressSink = buttonPressSink;
        this.internalCallSink = internalCallSink;
        this.pathPolicy = pathPolicy;
        this.internalCallTimeout = internalCallTimeout;
        this.connectivity = connectivity;
        this.metrics = metrics;
        this.tracer = tracer;
    }

    /**
     * Executes the job's action.
     *
     * @return {@code true} when the sink reported success
     */
    public boolean dispatch(ScheduledJob job) {
        TriggerAction action = job.trigger().action();
        ActionSink sink = action.sink();

        Span span = tracer.spanBuilder("trigger.dispatch").setAttribute("event.id", job.event().id())
                .setAttribute("trigger.index", job.triggerIndex()).setAttribute("action.sink", sink.name())
                .startSpan();
        long started = System.nanoTime();
        String result = SchedulerMetrics.RESULT_FAILURE;

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setJob(job);
            LOG.debugf("Dispatching trigger %d of %s due %s: %s", job.triggerIndex(), job.event(), job.due(),
                    action.describe());

            result = execute(action);
            boolean ok = SchedulerMetrics.RESULT_SUCCESS.equals(result);
            if (!SchedulerMetrics.RESULT_REJECTED.equals(result)) {
                noteConnectivity(sink, ok);
            }

            LOG.debugf("Trigger %d of %s -> %s", job.triggerIndex(), job.event(), result);
            if (ok) {
                LOG.infof("Fired %s | event=%s | due=%s", action.describe(), job.event(), job.due());
            } else {
                span.setStatus(StatusCode.ERROR, result);
            }
            span.setAttribute("dispatch.result", result);
            return ok;
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            LOG.errorf(e, "Dispatch of trigger %d of %s failed unexpectedly", job.triggerIndex(), job.event());
            noteConnectivity(sink, false);
            result = SchedulerMetrics.RESULT_FAILURE;
            return false;
        } finally {
            metrics.recordDispatch(sink, result);
            metrics.recordDispatchDuration(sink, Duration.ofNanos(System.nanoTime() - started));
            span.end();
            LoggingConfig.clearMDC();
        }
    }

    /**
     * Actively probes the button-press service and reports a connectivity flip if the probe changed its state.
     */
    public boolean probeButtonPressSink() {
        boolean ok = buttonPressSink.checkConnection();
        noteConnectivity(ActionSink.COMPANION, ok);
        return ok;
    }

    public boolean isButtonPressSinkConnected() {
        return buttonPressSink.isConnected();
    }

    public ConnectivityTracker getConnectivity() {
        return connectivity;
    }

    private String execute(TriggerAction action) {
        if (action instanceof ButtonPressAction press) {
            if (!buttonPressSink.isConnected() && !buttonPressSink.checkConnection()) {
                LOG.debugf("Button-press service not connected; skipping press '%s'", press.url());
                return SchedulerMetrics.RESULT_SKIPPED;
            }
            return buttonPressSink.attempt(press.url()) ? SchedulerMetrics.RESULT_SUCCESS
                    : SchedulerMetrics.RESULT_FAILURE;
        }
        if (action instanceof InternalCallAction call) {
            String method;
            String path;
            try {
                method = pathPolicy.checkMethod(call.method());
                path = pathPolicy.canonicalize(call.path());
            } catch (ActionRejectedException e) {
                LOG.errorf("Rejected internal call %s: %s", call.describe(), e.getMessage());
                return SchedulerMetrics.RESULT_REJECTED;
            }
            return internalCallSink.attempt(method, path, call.body(), internalCallTimeout)
                    ? SchedulerMetrics.RESULT_SUCCESS
                    : SchedulerMetrics.RESULT_FAILURE;
        }
        throw new IllegalStateException("Unsupported action type: " + action.getClass().getName());
    }

    private void noteConnectivity(ActionSink sink, boolean ok) {
        ConnectivityTracker.Transition transition = connectivity.record(sink, ok);
        if (transition == ConnectivityTracker.Transition.WENT_OFFLINE) {
            LOG.warnf("The %s appears unreachable; further failures are logged at DEBUG until it recovers",
                    sink.getDescription());
            metrics.recordTransition(sink, false);
        } else if (transition == ConnectivityTracker.Transition.CAME_ONLINE) {
            LOG.infof("The %s is reachable again", sink.getDescription());
            metrics.recordTransition(sink, true);
        }
    }
}
