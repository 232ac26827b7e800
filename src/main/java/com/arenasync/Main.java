package com.arenasync;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.arenasync.fetch.CredentialLoader;
import com.arenasync.fetch.FetcherSelector;
import com.arenasync.fetch.GitCommandRunner;
import com.arenasync.fetch.YamlConfigStoreClient;
import com.arenasync.fetch.YamlSecretStore;
import com.arenasync.reconcile.JsonLinesEventSink;
import com.arenasync.reconcile.ManifestSourceStore;
import com.arenasync.reconcile.ReconcileLoop;
import com.arenasync.reconcile.ReconcilerSettings;
import com.arenasync.reconcile.TemplateSourceReconciler;
import com.arenasync.reconcile.WorkspaceResolver;
import com.arenasync.runtime.AppConfig;
import com.arenasync.source.ArenaTemplateSource;
import com.arenasync.source.ArenaTemplateSourceStatus;
import com.arenasync.source.SourceKey;
import com.arenasync.source.SourcePhase;
import com.arenasync.template.TemplateIndexWriter;
import com.arenasync.versioning.ContentStore;
import com.arenasync.versioning.StoredVersion;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "arena-sync",
        mixinStandardHelpOptions = true,
        version = "arena-sync 0.1.0",
        description = "Fetches arena template sources and keeps versioned snapshots of their content.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "reconcile")
    Mode mode;

    @Option(names = { "-n", "--namespace" }, description = "Namespace of the source for gc, versions and purge", defaultValue = "default")
    String namespace;

    @Option(names = "--name", description = "Source name for gc, versions and purge")
    String name;

    @Option(names = "--keep", description = "Versions to keep in gc mode (defaults to engine.maxVersionsPerSource)", defaultValue = "0")
    int keep;

    @Option(names = "--max-wait-ms", description = "Reconcile: give up after this long. Watch: stop after this long (0 runs until interrupted)", defaultValue = "300000")
    long maxWaitMs;

    @Option(names = "--rescan-interval-ms", description = "Watch mode: how often source manifests are re-read", defaultValue = "30000")
    long rescanIntervalMs;

    private final PrintStream out;

    enum Mode {
        reconcile,
        watch,
        gc,
        versions,
        purge
    }

    public Main() {
        this(System.out);
    }

    Main(PrintStream out) {
        this.out = out;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(Path.of(configPath));
        log.info("Starting arena-sync in {} mode", mode);
        log.info("Using config file: {}", configPath);

        if (mode == Mode.gc || mode == Mode.versions || mode == Mode.purge) {
            if (name == null || name.isBlank()) {
                log.error("--name is required in {} mode", mode);
                return 2;
            }
            return runMaintenance(config);
        }
        if (mode == Mode.watch) {
            return runWatch(config);
        }
        return runReconcile(config);
    }

    static AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AppConfig loaded = mapper.readValue(config.toFile(), AppConfig.class);
        return loaded == null ? new AppConfig() : loaded;
    }

    private int runReconcile(AppConfig config) throws IOException, InterruptedException {
        try (Engine engine = new Engine(config)) {
            List<SourceKey> keys = engine.sourceStore.list();
            log.info("reconcile.start sources={} maxWaitMs={}", keys.size(), maxWaitMs);
            keys.forEach(engine.loop::enqueue);

            long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(Math.max(0, maxWaitMs));
            while (!settled(engine, keys)) {
                if (System.nanoTime() >= deadline) {
                    log.warn("reconcile.timeout sources={} maxWaitMs={}", keys.size(), maxWaitMs);
                    printSummary(engine, keys);
                    return 1;
                }
                Thread.sleep(100);
            }
            printSummary(engine, keys);
            return 0;
        }
    }

    private int runWatch(AppConfig config) throws IOException {
        try (Engine engine = new Engine(config)) {
            long stopAt = maxWaitMs > 0 ? System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(maxWaitMs) : Long.MAX_VALUE;
            long rescanMs = Math.max(100, rescanIntervalMs);
            Set<SourceKey> known = new LinkedHashSet<>();
            while (maxWaitMs <= 0 || System.nanoTime() < stopAt) {
                List<SourceKey> current = engine.sourceStore.list();
                known.addAll(current);
                known.forEach(engine.loop::enqueue);
                known.retainAll(current);
                log.debug("watch.rescan sources={}", current.size());
                try {
                    Thread.sleep(rescanMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.info("watch.interrupted");
                    break;
                }
            }
            return 0;
        }
    }

    private int runMaintenance(AppConfig config) throws Exception {
        ContentStore contentStore = contentStore(config);
        TemplateIndexWriter indexWriter = new TemplateIndexWriter(contentBase(config));
        String workspace = new WorkspaceResolver(config.getWorkspaces()).resolve(namespace);
        String target = TemplateSourceReconciler.targetPath(name);
        if (!contentStore.isConfigured()) {
            log.error("engine.workspaceContentPath is not configured");
            return 2;
        }

        if (mode == Mode.gc) {
            List<String> deleted = contentStore.collectGarbage(workspace, namespace, target, keep);
            log.info("gc.complete namespace={} name={} deleted={}", namespace, name, deleted.size());
            deleted.forEach(version -> out.println("deleted " + version));
            return 0;
        }
        if (mode == Mode.versions) {
            Optional<String> head = contentStore.readHead(workspace, namespace, target);
            out.println("HEAD " + head.orElse("-"));
            for (StoredVersion version : contentStore.listVersions(workspace, namespace, target)) {
                out.println((version.head() ? "* " : "  ") + version.version() + " " + version.lastModified());
            }
            return 0;
        }

        boolean purged = contentStore.purge(workspace, namespace, target);
        boolean indexDeleted = indexWriter.deleteIndex(workspace, namespace, name);
        SourceKey key = new SourceKey(namespace, name);
        new ManifestSourceStore(Path.of(config.getStores().getSourcesPath()), Path.of(config.getStores().getStatusPath()))
                .deleteStatus(key);
        log.info("purge.complete key={} content={} index={}", key, purged, indexDeleted);
        out.println("purged " + key);
        return 0;
    }

    private boolean settled(Engine engine, List<SourceKey> keys) throws IOException {
        if (!engine.loop.isIdle()) {
            return false;
        }
        for (SourceKey key : keys) {
            if (engine.reconciler.hasOutstandingFetch(key)) {
                return false;
            }
            Optional<ArenaTemplateSource> source = engine.sourceStore.get(key);
            if (source.isEmpty()) {
                continue;
            }
            if (source.get().getSpec() != null && source.get().getSpec().suspend()) {
                continue;
            }
            SourcePhase phase = source.get().getStatus().getPhase();
            if (phase != SourcePhase.READY && phase != SourcePhase.ERROR) {
                return false;
            }
        }
        return true;
    }

    private void printSummary(Engine engine, List<SourceKey> keys) throws IOException {
        for (SourceKey key : keys) {
            ArenaTemplateSourceStatus status = engine.sourceStore.readStatus(key).orElseGet(ArenaTemplateSourceStatus::new);
            String phase = status.getPhase() == null ? "-" : status.getPhase().label();
            String version = status.getHeadVersion() == null ? "-" : status.getHeadVersion();
            String message = status.getMessage() == null ? "" : " " + status.getMessage();
            out.println(key + " " + phase + " " + version + " templates=" + status.getTemplateCount() + message);
        }
    }

    private static Path contentBase(AppConfig config) {
        String base = config.getEngine().getWorkspaceContentPath();
        return base == null || base.isBlank() ? null : Path.of(base);
    }

    private static ContentStore contentStore(AppConfig config) {
        return new ContentStore(contentBase(config), config.getEngine().getMaxVersionsPerSource());
    }

    /**
     * The long-running pieces of a reconcile or watch run, closed together.
     */
    private static final class Engine implements AutoCloseable {
        private final ManifestSourceStore sourceStore;
        private final TemplateSourceReconciler reconciler;
        private final ReconcileLoop loop;
        private final OkHttpClient httpClient;

        Engine(AppConfig config) {
            AppConfig.EngineConfig engine = config.getEngine();
            AppConfig.StoresConfig stores = config.getStores();
            this.httpClient = new OkHttpClient();
            this.sourceStore = new ManifestSourceStore(Path.of(stores.getSourcesPath()), Path.of(stores.getStatusPath()));

            FetcherSelector selector = new FetcherSelector(
                    new CredentialLoader(new YamlSecretStore(Path.of(stores.getSecretStorePath()))),
                    new YamlConfigStoreClient(Path.of(stores.getConfigStorePath())),
                    new GitCommandRunner(Duration.ofMillis(engine.getGitTimeoutMs())),
                    httpClient);
            String workDir = engine.getWorkDir();
            ReconcilerSettings settings = new ReconcilerSettings(
                    Duration.ofMillis(engine.getFetchPollIntervalMs()),
                    Duration.ofMillis(engine.getIndexRetryDelayMs()),
                    workDir == null || workDir.isBlank() ? null : Path.of(workDir));

            this.reconciler = new TemplateSourceReconciler(
                    sourceStore,
                    selector,
                    contentStore(config),
                    new TemplateIndexWriter(contentBase(config)),
                    new WorkspaceResolver(config.getWorkspaces()),
                    settings);
            String eventLog = stores.getEventLogPath();
            if (eventLog != null && !eventLog.isBlank()) {
                reconciler.replaceEventSink(new JsonLinesEventSink(Path.of(eventLog)));
            }
            this.loop = new ReconcileLoop(
                    reconciler,
                    engine.getWorkers(),
                    Duration.ofMillis(engine.getRetryBaseDelayMs()),
                    Duration.ofMillis(engine.getRetryMaxDelayMs()));
            reconciler.onResultReady(loop::enqueue);
            loop.start();
        }

        @Override
        public void close() {
            loop.close();
            reconciler.close();
            httpClient.dispatcher().executorService().shutdown();
            httpClient.connectionPool().evictAll();
        }
    }
}
