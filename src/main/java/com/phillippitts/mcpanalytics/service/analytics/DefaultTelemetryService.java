package com.phillippitts.mcpanalytics.service.analytics;

import com.phillippitts.mcpanalytics.config.properties.AnalyticsProperties;
import com.phillippitts.mcpanalytics.domain.AnalyticsSummary;
import com.phillippitts.mcpanalytics.domain.ImportDelta;
import com.phillippitts.mcpanalytics.domain.ImportResult;
import com.phillippitts.mcpanalytics.domain.RequestContext;
import com.phillippitts.mcpanalytics.domain.ToolUsageReport;
import com.phillippitts.mcpanalytics.exception.InvalidImportException;
import com.phillippitts.mcpanalytics.exception.RecordingException;
import com.phillippitts.mcpanalytics.service.metrics.AnalyticsMetrics;
import com.phillippitts.mcpanalytics.service.persistence.LoadResult;
import com.phillippitts.mcpanalytics.service.persistence.SaveStatus;
import com.phillippitts.mcpanalytics.service.persistence.SnapshotPersistence;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the {@link CounterStore} and drives {@link SnapshotPersistence} on a fixed interval.
 *
 * <p>Lifecycle: started in phase 0, i.e. before the embedded web server accepts requests, and
 * stopped after it, so the final flush sees every request the server answered. Spring Boot's
 * shutdown hook turns SIGTERM/SIGINT into {@link #stop()}.
 *
 * <p>The counter store is created here and never handed out; other components see only
 * snapshots and summaries.
 */
@Service
public class DefaultTelemetryService implements TelemetryService, SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(DefaultTelemetryService.class);

    private final CounterStore store;
    private final SnapshotPersistence persistence;
    private final TaskScheduler scheduler;
    private final Duration saveInterval;
    private final AnalyticsMetrics metrics;
    private final Clock clock;

    private final AtomicBoolean initialized = new AtomicBoolean();
    private final AtomicBoolean shutDown = new AtomicBoolean();
    private volatile ScheduledFuture<?> flushTask;

    public DefaultTelemetryService(SnapshotPersistence persistence,
                                   SnapshotSummarizer summarizer,
                                   @Qualifier("analyticsScheduler") TaskScheduler scheduler,
                                   AnalyticsProperties properties,
                                   AnalyticsMetrics metrics,
                                   Clock clock) {
        this.persistence = Objects.requireNonNull(persistence, "persistence");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.saveInterval = properties.getSaveInterval();
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.store = new CounterStore(summarizer,
                properties.getRecentCallsCapacity(),
                properties.getUserAgentMaxLength(),
                clock.instant());
        metrics.bindTotals(store::totalRequests, store::totalToolCalls);
    }

    @Override
    public void initialize() {
        if (!initialized.compareAndSet(false, true)) {
            LOG.warn("Analytics already initialized; ignoring repeated initialize()");
            return;
        }
        LoadResult loaded = persistence.load();
        store.restore(loaded.snapshot());
        flushTask = scheduler.scheduleAtFixedRate(this::flush, clock.instant().plus(saveInterval), saveInterval);
        LOG.info("Analytics initialized: load={}, file={}, saveInterval={}",
                loaded.status(), persistence.location(), saveInterval);
    }

    @Override
    public void recordRequest(RequestContext context) {
        try {
            if (context == null) {
                throw new RecordingException("request", "Request context is required");
            }
            store.recordRequest(context.method(), context.endpoint(),
                    context.clientIdentity(), context.userAgent(), clock.instant());
        } catch (RecordingException e) {
            LOG.warn("Request not recorded: {}", e.getMessage());
            metrics.incrementRecordingFailure(e.getEventKind());
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure recording request", e);
            metrics.incrementRecordingFailure("request");
        }
    }

    @Override
    public void recordToolCall(String toolName, RequestContext context) {
        try {
            if (context == null) {
                throw new RecordingException("tool-call", "Request context is required");
            }
            store.recordToolCall(toolName, context.clientIdentity(), context.userAgent(), clock.instant());
        } catch (RecordingException e) {
            LOG.warn("Tool call not recorded: {}", e.getMessage());
            metrics.incrementRecordingFailure(e.getEventKind());
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure recording tool call", e);
            metrics.incrementRecordingFailure("tool-call");
        }
    }

    @Override
    public AnalyticsSummary summarize() {
        return store.summarize(clock.instant());
    }

    @Override
    public ToolUsageReport recentToolUsage() {
        return store.toolUsage();
    }

    @Override
    public ImportResult importDelta(ImportDelta delta) {
        validate(delta);
        long requests = delta.totalRequests() == null ? 0L : delta.totalRequests();
        long toolCalls = delta.totalToolCalls() == null ? 0L : delta.totalToolCalls();
        try {
            store.applyDelta(requests, toolCalls);
        } catch (ArithmeticException e) {
            metrics.incrementImportRejected();
            throw new InvalidImportException("totals would overflow");
        }
        LOG.info("Imported analytics delta: +{} requests, +{} tool calls", requests, toolCalls);
        persistence.save(store::snapshot);
        return new ImportResult(store.totalRequests(), store.totalToolCalls());
    }

    @Override
    public void shutdown() {
        if (!shutDown.compareAndSet(false, true)) {
            return;
        }
        ScheduledFuture<?> task = flushTask;
        if (task != null) {
            task.cancel(false);
        }
        if (!initialized.get()) {
            // Never loaded: saving now would overwrite the stored snapshot with an empty one
            LOG.warn("Analytics shut down before initialization; skipping final save");
            return;
        }
        SaveStatus status = persistence.save(store::snapshot);
        LOG.info("Analytics final save on shutdown: {}", status);
    }

    @Override
    public void start() {
        initialize();
    }

    @Override
    public void stop() {
        shutdown();
    }

    @Override
    public boolean isRunning() {
        return initialized.get() && !shutDown.get();
    }

    @Override
    public int getPhase() {
        return 0;
    }

    /** Periodic flush body. */
    void flush() {
        persistence.save(store::snapshot);
    }

    /** Visible for tests */
    CounterStore counterStore() {
        return store;
    }

    private void validate(ImportDelta delta) {
        String problem = null;
        if (delta == null || (delta.totalRequests() == null && delta.totalToolCalls() == null)) {
            problem = "at least one of totalRequests or totalToolCalls is required";
        } else if (isNegative(delta.totalRequests())) {
            problem = "totalRequests must be non-negative, got " + delta.totalRequests();
        } else if (isNegative(delta.totalToolCalls())) {
            problem = "totalToolCalls must be non-negative, got " + delta.totalToolCalls();
        }
        if (problem != null) {
            metrics.incrementImportRejected();
            LOG.warn("Rejected analytics import: {}", problem);
            throw new InvalidImportException(problem);
        }
    }

    private static boolean isNegative(Long value) {
        return value != null && value < 0;
    }
}
