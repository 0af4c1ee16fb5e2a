package com.framesmith.core.nodes;

import com.framesmith.core.engine.ActiveJobs;
import com.framesmith.core.engine.DispatchProperties;
import com.framesmith.core.engine.JobContext;
import com.framesmith.core.events.EventBus;
import com.framesmith.core.events.FramesmithEvent;
import com.framesmith.core.logging.MdcContext;
import com.framesmith.core.metrics.FramesmithMetrics;
import com.framesmith.core.model.GeneratedArtifact;
import com.framesmith.core.model.GenerationOptions;
import com.framesmith.core.model.JobStatus;
import com.framesmith.core.model.Screen;
import com.framesmith.core.model.ScreenStatus;
import com.framesmith.core.oracle.CodeOracleAdapter;
import com.framesmith.core.state.JobState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntSupplier;

/**
 * Generates every pending screen on a fixed pool bounded by {@code framesmith.dispatch.max-concurrency}.
 * <p>
 * Each worker checks the job's cancellation flag before it starts; a screen that has not started when the
 * job is cancelled is SKIPPED. A failing screen never affects its siblings: failures, including unexpected
 * exceptions, end up as FAILED screens with a failed artifact.
 */
@Component
public class DispatchScreensNode {

    private static final Logger log = LoggerFactory.getLogger(DispatchScreensNode.class);

    static final String CANCELLED_REASON = "Cancelled before start";
    static final String FILTERED_REASON = "Not selected by target screen filter";

    private final CodeOracleAdapter adapter;
    private final ActiveJobs activeJobs;
    private final IntSupplier maxConcurrency;
    private final EventBus eventBus;
    private final FramesmithMetrics metrics;

    @Autowired
    public DispatchScreensNode(CodeOracleAdapter adapter, ActiveJobs activeJobs, DispatchProperties properties,
                               EventBus eventBus, FramesmithMetrics metrics) {
        this(adapter, activeJobs, properties::getMaxConcurrency, eventBus, metrics);
    }

    DispatchScreensNode(CodeOracleAdapter adapter, ActiveJobs activeJobs, int maxConcurrency,
                        EventBus eventBus, FramesmithMetrics metrics) {
        this(adapter, activeJobs, () -> maxConcurrency, eventBus, metrics);
    }

    private DispatchScreensNode(CodeOracleAdapter adapter, ActiveJobs activeJobs, IntSupplier maxConcurrency,
                                EventBus eventBus, FramesmithMetrics metrics) {
        this.adapter = adapter;
        this.activeJobs = activeJobs;
        // read per job so the CLI --concurrency override applies
        this.maxConcurrency = maxConcurrency;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(JobState state) {
        String jobId = state.jobId();
        JobContext context = activeJobs.require(jobId);
        GenerationOptions options = state.options();
        List<Screen> screens = state.screens();

        var updated = new Screen[screens.size()];
        var artifacts = new GeneratedArtifact[screens.size()];
        var futures = new HashMap<Integer, CompletableFuture<Outcome>>();
        int poolSize = Math.min(Math.max(1, maxConcurrency.getAsInt()), Math.max(1, screens.size()));
        var threadCounter = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(poolSize, r -> {
            Thread t = new Thread(r, "screen-worker-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        log.info("Job {}: dispatching {} screens with concurrency {}", jobId, screens.size(), poolSize);
        try {
            for (int i = 0; i < screens.size(); i++) {
                Screen screen = screens.get(i);
                if (screen.status() != ScreenStatus.PENDING) {
                    // rejected during analysis
                    updated[i] = screen;
                    publish("screen.failed", jobId, screen, screenPayload(screen, 0L));
                    record(screen);
                    continue;
                }
                if (!options.selects(screen)) {
                    updated[i] = screen.transitionTo(ScreenStatus.SKIPPED, FILTERED_REASON);
                    publish("screen.skipped", jobId, updated[i], screenPayload(updated[i], 0L));
                    record(updated[i]);
                    continue;
                }
                futures.put(i, CompletableFuture.supplyAsync(() -> process(context, screen, options), pool));
            }

            for (var entry : futures.entrySet()) {
                Outcome outcome = entry.getValue().join();
                updated[entry.getKey()] = outcome.screen();
                artifacts[entry.getKey()] = outcome.artifact();
            }
        } finally {
            pool.shutdown();
        }

        var artifactList = new ArrayList<GeneratedArtifact>();
        for (GeneratedArtifact artifact : artifacts) {
            if (artifact != null) {
                artifactList.add(artifact);
            }
        }
        return Map.of(
                JobState.SCREENS, List.of(updated),
                JobState.ARTIFACTS, List.copyOf(artifactList),
                JobState.STATUS, JobStatus.MERGING.name()
        );
    }

    private Outcome process(JobContext context, Screen screen, GenerationOptions options) {
        String jobId = context.jobId();
        MdcContext.setScreen(jobId, screen.id(), screen.ordinal());
        long start = System.currentTimeMillis();
        try {
            if (context.isCancelled()) {
                Screen skipped = screen.transitionTo(ScreenStatus.SKIPPED, CANCELLED_REASON);
                log.info("Skipping screen {}: job cancelled", screen.id());
                publish("screen.skipped", jobId, skipped, screenPayload(skipped, 0L));
                record(skipped);
                return new Outcome(skipped, null);
            }

            Screen processing = screen.transitionTo(ScreenStatus.PROCESSING);
            publish("screen.started", jobId, processing, screenPayload(processing, 0L));

            GeneratedArtifact artifact;
            try {
                artifact = adapter.generate(processing, context.registry(), options);
            } catch (Exception e) {
                log.error("Screen {} failed unexpectedly: {}", screen.id(), e.getMessage(), e);
                artifact = GeneratedArtifact.failed(processing, "Unexpected error: " + e.getMessage(), null, 0,
                        System.currentTimeMillis() - start, 0L);
            }

            Screen done;
            if (artifact.success()) {
                Screen withRefs = processing;
                for (String ref : artifact.componentRefs()) {
                    withRefs = withRefs.withComponentRef(ref);
                }
                done = withRefs.transitionTo(ScreenStatus.SUCCEEDED);
                publish("screen.succeeded", jobId, done, screenPayload(done, artifact.elapsedMs()));
            } else {
                done = processing.transitionTo(ScreenStatus.FAILED, artifact.error());
                publish("screen.failed", jobId, done, screenPayload(done, artifact.elapsedMs()));
            }
            record(done);
            return new Outcome(done, artifact);
        } finally {
            MdcContext.clear();
        }
    }

    private static Map<String, Object> screenPayload(Screen screen, long elapsedMs) {
        var payload = new HashMap<String, Object>();
        payload.put("status", screen.status().name());
        payload.put("ordinal", screen.ordinal());
        payload.put("name", screen.name());
        payload.put("elapsedMs", elapsedMs);
        if (screen.failureReason() != null) {
            payload.put("reason", screen.failureReason());
        }
        return payload;
    }

    private void publish(String type, String jobId, Screen screen, Map<String, Object> payload) {
        eventBus.publish(FramesmithEvent.of(type, jobId, screen.id(), payload));
    }

    private void record(Screen screen) {
        if (metrics != null) {
            metrics.recordScreenResult(screen.status().name());
        }
    }

    private record Outcome(Screen screen, GeneratedArtifact artifact) {}
}
