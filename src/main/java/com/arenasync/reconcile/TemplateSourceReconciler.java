package com.arenasync.reconcile;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.arenasync.fetch.Artifact;
import com.arenasync.fetch.FetchContext;
import com.arenasync.fetch.FetchException;
import com.arenasync.fetch.FetchOptions;
import com.arenasync.fetch.Fetcher;
import com.arenasync.fetch.FetcherSelector;
import com.arenasync.fetch.FileTrees;
import com.arenasync.source.ArenaTemplateSource;
import com.arenasync.source.ArenaTemplateSourceSpec;
import com.arenasync.source.ArenaTemplateSourceStatus;
import com.arenasync.source.ArtifactStatus;
import com.arenasync.source.ConditionStatus;
import com.arenasync.source.Conditions;
import com.arenasync.source.ConfigurationException;
import com.arenasync.source.IntervalParser;
import com.arenasync.source.SourceException;
import com.arenasync.source.SourceKey;
import com.arenasync.source.SourcePhase;
import com.arenasync.template.IndexException;
import com.arenasync.template.Template;
import com.arenasync.template.TemplateDiscoverer;
import com.arenasync.template.TemplateIndexWriter;
import com.arenasync.template.TemplateParseException;
import com.arenasync.versioning.ContentStore;
import com.arenasync.versioning.SyncException;
import com.arenasync.versioning.SyncResult;

/**
 * Drives template sources through Pending, Fetching, Ready and Error. A pass never blocks on
 * remote I/O: fetching runs as a background job whose result is picked up by a later pass.
 */
public class TemplateSourceReconciler implements Reconciler, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TemplateSourceReconciler.class);

    public static final String CONDITION_READY = "Ready";
    public static final String CONDITION_FETCHING = "Fetching";
    public static final String CONDITION_TEMPLATES_SCANNED = "TemplatesScanned";
    public static final String CONDITION_ARTIFACT_AVAILABLE = "ArtifactAvailable";

    public static final String EVENT_FETCH_STARTED = "FetchStarted";
    public static final String EVENT_FETCH_SUCCEEDED = "FetchSucceeded";
    public static final String EVENT_FETCH_FAILED = "FetchFailed";

    public static final String REASON_SUSPENDED = "Suspended";

    static final String TARGET_PREFIX = "arena/template-sources/";

    private final SourceStore sourceStore;
    private final FetcherSelector fetcherSelector;
    private final ContentStore contentStore;
    private final TemplateIndexWriter indexWriter;
    private final WorkspaceResolver workspaceResolver;
    private final ReconcilerSettings settings;
    private final Clock clock;
    private final ExecutorService fetchExecutor;
    private final ScheduledExecutorService watchdogScheduler;

    private final Map<SourceKey, FetchJob> jobs = new ConcurrentHashMap<>();
    private final Map<SourceKey, TemplateFetchResult> results = new ConcurrentHashMap<>();
    private final Object eventSinkLock = new Object();
    private EventSink eventSink;
    private volatile Consumer<SourceKey> resultListener;

    public TemplateSourceReconciler(
            SourceStore sourceStore,
            FetcherSelector fetcherSelector,
            ContentStore contentStore,
            TemplateIndexWriter indexWriter,
            WorkspaceResolver workspaceResolver,
            ReconcilerSettings settings) {
        this(sourceStore, fetcherSelector, contentStore, indexWriter, workspaceResolver, settings, Clock.systemUTC(),
                newFetchExecutor(), newWatchdogScheduler());
    }

    TemplateSourceReconciler(
            SourceStore sourceStore,
            FetcherSelector fetcherSelector,
            ContentStore contentStore,
            TemplateIndexWriter indexWriter,
            WorkspaceResolver workspaceResolver,
            ReconcilerSettings settings,
            Clock clock,
            ExecutorService fetchExecutor,
            ScheduledExecutorService watchdogScheduler) {
        this.sourceStore = sourceStore;
        this.fetcherSelector = fetcherSelector;
        this.contentStore = contentStore;
        this.indexWriter = indexWriter;
        this.workspaceResolver = workspaceResolver;
        this.settings = settings;
        this.clock = clock;
        this.fetchExecutor = fetchExecutor;
        this.watchdogScheduler = watchdogScheduler;
    }

    /**
     * Registers the callback invoked whenever a fetch result becomes available for a key.
     */
    public void onResultReady(Consumer<SourceKey> listener) {
        this.resultListener = listener;
    }

    /**
     * Installs a new event sink. The previous sink is closed before the new one takes its place.
     */
    public void replaceEventSink(EventSink next) {
        synchronized (eventSinkLock) {
            if (eventSink != null) {
                try {
                    eventSink.close();
                } catch (IOException e) {
                    log.warn("events.sink.close.failed reason={}", e.getMessage());
                }
            }
            eventSink = next;
        }
    }

    public boolean hasOutstandingFetch(SourceKey key) {
        return jobs.containsKey(key);
    }

    public static String targetPath(String sourceName) {
        return TARGET_PREFIX + sourceName;
    }

    @Override
    public ReconcileResult reconcile(SourceKey key) throws IOException {
        ArenaTemplateSource source = sourceStore.get(key).orElse(null);
        if (source == null) {
            FetchJob job = jobs.remove(key);
            if (job != null) {
                discard(job.cancel("source deleted"));
            }
            discard(results.remove(key));
            log.info("reconcile.skip key={} reason=not-found", key);
            return ReconcileResult.done();
        }

        ArenaTemplateSourceStatus status = source.getStatus();
        boolean generationChanged = status.getObservedGeneration() != source.generation();
        status.setObservedGeneration(source.generation());
        ArenaTemplateSourceSpec spec = source.getSpec();

        if (spec != null && spec.suspend()) {
            FetchJob job = jobs.remove(key);
            if (job != null) {
                discard(job.cancel("source suspended"));
            }
            discard(results.remove(key));
            setCondition(source, CONDITION_READY, ConditionStatus.FALSE, REASON_SUSPENDED,
                    "ArenaTemplateSource reconciliation is suspended");
            sourceStore.updateStatus(source);
            log.info("reconcile.suspended key={}", key);
            return ReconcileResult.done();
        }
        if (status.getPhase() == null) {
            status.setPhase(SourcePhase.PENDING);
        }

        Duration syncInterval;
        Duration timeout;
        Fetcher fetcher;
        try {
            if (spec == null) {
                throw new ConfigurationException("source spec is missing");
            }
            syncInterval = IntervalParser.parse("syncInterval", spec.syncInterval());
            timeout = IntervalParser.parse("timeout", spec.timeout());
            fetcher = fetcherSelector.select(spec, key.namespace(), new FetchOptions(settings.workDir(), timeout));
        } catch (ConfigurationException e) {
            markFailed(source, e, null);
            sourceStore.updateStatus(source);
            log.warn("reconcile.config.invalid key={} reason={}", key, e.getMessage());
            return ReconcileResult.done();
        }

        TemplateFetchResult result = results.remove(key);
        if (result != null) {
            FetchJob finished = jobs.remove(key);
            if (finished == null || finished.generation() == source.generation()) {
                return handleResult(source, result, syncInterval);
            }
            discard(result);
            log.info("reconcile.result.stale key={} fetchedGeneration={} generation={}",
                    key, finished.generation(), source.generation());
            dispatch(source, fetcher, timeout);
            return ReconcileResult.requeue(settings.pollInterval());
        }

        if (jobs.containsKey(key)) {
            log.debug("reconcile.fetch.pending key={}", key);
            return ReconcileResult.requeue(settings.pollInterval());
        }

        Instant now = clock.instant();
        SourcePhase phase = status.getPhase();
        boolean due = status.getNextFetchTime() == null || !now.isBefore(status.getNextFetchTime());
        boolean needsFetch = generationChanged
                || phase == SourcePhase.PENDING
                || phase == SourcePhase.FETCHING
                || due
                || (status.getArtifact() == null && phase != SourcePhase.ERROR);
        if (!needsFetch) {
            Duration remaining = Duration.between(now, status.getNextFetchTime());
            return ReconcileResult.requeue(remaining.isNegative() || remaining.isZero() ? syncInterval : remaining);
        }

        dispatch(source, fetcher, timeout);
        return ReconcileResult.requeue(settings.pollInterval());
    }

    private void dispatch(ArenaTemplateSource source, Fetcher fetcher, Duration timeout) throws IOException {
        SourceKey key = source.key();
        ArenaTemplateSourceStatus status = source.getStatus();
        Instant now = clock.instant();
        status.setPhase(SourcePhase.FETCHING);
        setCondition(source, CONDITION_FETCHING, ConditionStatus.TRUE, "FetchInProgress", "Fetching templates from source");
        status.setLastFetchTime(now);
        sourceStore.updateStatus(source);
        emit(source, EventType.NORMAL, EVENT_FETCH_STARTED, "Started fetching templates");

        String currentRevision = status.getArtifact() == null || status.getArtifact().revision() == null
                ? ""
                : status.getArtifact().revision();
        List<Template> previousTemplates = List.copyOf(status.getTemplates());
        String templatesPath = source.getSpec().templatesPath();

        FetchJob job = new FetchJob(key, new FetchContext(timeout, clock), now, source.generation());
        jobs.put(key, job);
        Future<?> task = fetchExecutor.submit(() -> runFetch(job, fetcher, templatesPath, currentRevision, previousTemplates));
        ScheduledFuture<?> watchdog = watchdogScheduler.schedule(() -> {
            TemplateFetchResult canceled = job.cancel("timeout after " + timeout.toMillis() + "ms");
            if (canceled != null) {
                log.warn("fetch.timeout key={} timeoutMs={}", key, timeout.toMillis());
                publish(job, canceled);
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);
        job.attach(task, watchdog);
        log.info("fetch.dispatched key={} type={} currentRevision={}", key, fetcher.type().wireName(), currentRevision);
    }

    private void runFetch(
            FetchJob job,
            Fetcher fetcher,
            String templatesPath,
            String currentRevision,
            List<Template> previousTemplates) {
        FetchContext context = job.context();
        TemplateFetchResult result = null;
        try {
            String latest = fetcher.latestRevision(context);
            if (!currentRevision.isEmpty() && fetcher.revisionLabel(latest).equals(currentRevision)) {
                log.debug("fetch.unchanged key={} revision={}", job.key(), currentRevision);
                result = TemplateFetchResult.unchanged(previousTemplates);
            } else {
                Artifact artifact = fetcher.fetch(context, latest);
                try {
                    List<Template> templates = new TemplateDiscoverer(artifact.path(), templatesPath).discover();
                    result = TemplateFetchResult.success(artifact, templates);
                    log.info("fetch.complete key={} revision={} templates={}", job.key(), artifact.revision(), templates.size());
                } catch (TemplateParseException e) {
                    result = TemplateFetchResult.failure(artifact,
                            new TemplateParseException("template discovery failed: " + e.getMessage(), e));
                }
            }
        } catch (SourceException e) {
            result = TemplateFetchResult.failure(null, e);
        } catch (RuntimeException e) {
            result = TemplateFetchResult.failure(null, new FetchException("fetch failed: " + e.getMessage(), e));
        } finally {
            if (result == null) {
                result = TemplateFetchResult.failure(null, new FetchException("fetch terminated unexpectedly"));
            }
            if (job.complete(result)) {
                publish(job, result);
            } else {
                discard(result);
            }
        }
    }

    private void publish(FetchJob job, TemplateFetchResult result) {
        boolean[] stored = {false};
        jobs.computeIfPresent(job.key(), (key, current) -> {
            if (current == job) {
                results.put(key, result);
                stored[0] = true;
            }
            return current;
        });
        if (!stored[0]) {
            discard(result);
            return;
        }
        Consumer<SourceKey> listener = resultListener;
        if (listener != null) {
            listener.accept(job.key());
        }
    }

    private ReconcileResult handleResult(ArenaTemplateSource source, TemplateFetchResult result, Duration syncInterval)
            throws IOException {
        SourceKey key = source.key();
        ArenaTemplateSourceStatus status = source.getStatus();
        if (result.failed()) {
            discard(result);
            markFailed(source, result.error(), syncInterval);
            sourceStore.updateStatus(source);
            log.warn("fetch.failed key={} reason={} message={}", key, result.error().reason(), result.error().getMessage());
            return ReconcileResult.requeue(syncInterval);
        }

        String workspace = workspaceResolver.resolve(key.namespace());
        if (!result.unchanged()) {
            Artifact artifact = result.artifact();
            SyncResult synced;
            try {
                synced = contentStore.sync(workspace, key.namespace(), targetPath(key.name()), artifact);
            } catch (SyncException e) {
                markFailed(source, e, syncInterval);
                sourceStore.updateStatus(source);
                log.warn("content.sync.failed key={} reason={}", key, e.getMessage());
                return ReconcileResult.requeue(syncInterval);
            } finally {
                discard(result);
            }
            status.setArtifact(new ArtifactStatus(
                    artifact.revision(),
                    synced.contentPath(),
                    synced.version(),
                    artifact.checksum(),
                    artifact.size(),
                    clock.instant()));
            if (!synced.isEmpty()) {
                status.setHeadVersion(synced.version());
            }
        }

        List<Template> templates = result.templates();
        status.setTemplates(templates);
        try {
            indexWriter.writeIndex(workspace, key.namespace(), key.name(), templates);
        } catch (IndexException e) {
            markFailed(source, e, settings.indexRetryDelay());
            sourceStore.updateStatus(source);
            log.warn("template.index.failed key={} reason={}", key, e.getMessage());
            return ReconcileResult.requeue(settings.indexRetryDelay());
        }

        String revision = status.getArtifact() == null ? "" : status.getArtifact().revision();
        status.setTemplateCount(templates.size());
        status.setPhase(SourcePhase.READY);
        status.setMessage(null);
        setCondition(source, CONDITION_FETCHING, ConditionStatus.FALSE, "FetchComplete", "Successfully fetched content");
        setCondition(source, CONDITION_TEMPLATES_SCANNED, ConditionStatus.TRUE, "ScanComplete",
                "Discovered " + templates.size() + " templates");
        setCondition(source, CONDITION_ARTIFACT_AVAILABLE, ConditionStatus.TRUE, "ArtifactAvailable",
                "Content synced at revision " + revision);
        setCondition(source, CONDITION_READY, ConditionStatus.TRUE, "Ready", "ArenaTemplateSource is ready");
        status.setNextFetchTime(clock.instant().plus(syncInterval));
        sourceStore.updateStatus(source);
        emit(source, EventType.NORMAL, EVENT_FETCH_SUCCEEDED,
                "Successfully fetched " + templates.size() + " templates at revision " + revision);
        log.info("reconcile.ready key={} revision={} version={} templates={} unchanged={}",
                key, revision, status.getHeadVersion(), templates.size(), result.unchanged());
        return ReconcileResult.requeue(syncInterval);
    }

    private void markFailed(ArenaTemplateSource source, SourceException error, Duration retryAfter) {
        ArenaTemplateSourceStatus status = source.getStatus();
        status.setPhase(SourcePhase.ERROR);
        status.setMessage(error.getMessage());
        setCondition(source, CONDITION_FETCHING, ConditionStatus.FALSE, EVENT_FETCH_FAILED, error.getMessage());
        setCondition(source, CONDITION_READY, ConditionStatus.FALSE, error.reason(), error.getMessage());
        if (retryAfter != null) {
            status.setNextFetchTime(clock.instant().plus(retryAfter));
        }
        emit(source, EventType.WARNING, EVENT_FETCH_FAILED, error.getMessage());
    }

    private void setCondition(ArenaTemplateSource source, String type, ConditionStatus conditionStatus, String reason, String message) {
        Conditions.set(source.getStatus().getConditions(), source.generation(), type, conditionStatus, reason, message, clock.instant());
    }

    private void emit(ArenaTemplateSource source, EventType type, String reason, String message) {
        synchronized (eventSinkLock) {
            if (eventSink == null) {
                return;
            }
            try {
                eventSink.record(new SourceEvent(clock.instant(), source.namespace(), source.name(), type, reason, message));
            } catch (IOException | RuntimeException e) {
                log.warn("events.record.failed key={} reason={} error={}", source.key(), reason, e.getMessage());
            }
        }
    }

    private void discard(TemplateFetchResult result) {
        if (result == null || result.artifact() == null) {
            return;
        }
        try {
            FileTrees.deleteRecursively(result.artifact().path());
        } catch (IOException e) {
            log.warn("artifact.cleanup.failed path={} reason={}", result.artifact().path(), e.getMessage());
        }
    }

    @Override
    public void close() {
        jobs.values().forEach(job -> job.cancel("shutdown"));
        jobs.clear();
        results.values().forEach(this::discard);
        results.clear();
        fetchExecutor.shutdownNow();
        watchdogScheduler.shutdownNow();
        replaceEventSink(null);
    }

    private static ExecutorService newFetchExecutor() {
        AtomicInteger ids = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "template-fetch-" + ids.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    private static ScheduledExecutorService newWatchdogScheduler() {
        return Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "template-fetch-watchdog");
            thread.setDaemon(true);
            return thread;
        });
    }
}
