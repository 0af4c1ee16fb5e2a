package com.framesmith.core.oracle;

import com.framesmith.core.metrics.FramesmithMetrics;
import com.framesmith.core.model.ComponentDescriptor;
import com.framesmith.core.model.GeneratedArtifact;
import com.framesmith.core.model.GeneratedFile;
import com.framesmith.core.model.GenerationOptions;
import com.framesmith.core.model.Screen;
import com.framesmith.core.registry.ComponentNames;
import com.framesmith.core.registry.ComponentRegistry;
import com.framesmith.core.registry.RegistrationResult;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.DoubleSupplier;

/**
 * Generates one screen through the {@link CodeOracle} and folds the result into the job's registry.
 * <p>
 * Transient failures are retried with capped exponential backoff; rejected requests and unparseable
 * output fail the screen immediately. Screen-level failures are returned as failed artifacts, never thrown.
 */
@Service
public class CodeOracleAdapter {

    private static final Logger log = LoggerFactory.getLogger(CodeOracleAdapter.class);

    private final CodeOracle oracle;
    private final OraclePromptBuilder promptBuilder;
    private final OracleResponseParser parser;
    private final OracleProperties properties;
    private final FramesmithMetrics metrics;
    private final Sleeper sleeper;
    private final DoubleSupplier jitterSource;
    private final ExecutorService callExecutor;

    @Autowired
    public CodeOracleAdapter(CodeOracle oracle, OraclePromptBuilder promptBuilder, OracleResponseParser parser,
                             OracleProperties properties, FramesmithMetrics metrics) {
        this(oracle, promptBuilder, parser, properties, metrics, Sleeper.THREAD,
                () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Package-private constructor for testing with a controllable sleeper and jitter source.
     */
    CodeOracleAdapter(CodeOracle oracle, OraclePromptBuilder promptBuilder, OracleResponseParser parser,
                      OracleProperties properties, FramesmithMetrics metrics,
                      Sleeper sleeper, DoubleSupplier jitterSource) {
        this.oracle = oracle;
        this.promptBuilder = promptBuilder;
        this.parser = parser;
        this.properties = properties;
        this.metrics = metrics;
        this.sleeper = sleeper;
        this.jitterSource = jitterSource;
        var counter = new AtomicInteger();
        this.callExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "oracle-call-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        callExecutor.shutdownNow();
    }

    public GeneratedArtifact generate(Screen screen, ComponentRegistry registry, GenerationOptions options) {
        long start = System.currentTimeMillis();
        OracleRequest request = promptBuilder.build(screen, registry.knownNames(), options);
        int maxAttempts = Math.max(1, properties.getMaxAttempts());
        long costUnits = 0;
        String raw = null;

        for (int attempt = 1; ; attempt++) {
            long callStart = System.currentTimeMillis();
            try {
                OracleResponse response = call(request);
                metrics.recordOracleCall("success", System.currentTimeMillis() - callStart);
                raw = response.content();
                costUnits += costUnits(request, response);
                ParsedOracleResponse parsed = parser.parse(raw);
                return toArtifact(screen, registry, parsed, raw, attempt,
                        System.currentTimeMillis() - start, costUnits);
            } catch (TransientOracleException e) {
                metrics.recordOracleCall(e.getCause() instanceof TimeoutException ? "timeout" : "transient",
                        System.currentTimeMillis() - callStart);
                if (attempt >= maxAttempts) {
                    log.warn("Screen {} failed after {} attempts: {}", screen.id(), attempt, e.getMessage());
                    return GeneratedArtifact.failed(screen, "Oracle unavailable after " + attempt
                            + " attempts: " + e.getMessage(), raw, attempt,
                            System.currentTimeMillis() - start, costUnits);
                }
                long delay = backoffDelayMs(attempt);
                log.info("Transient oracle failure for screen {} (attempt {}/{}), retrying in {}ms: {}",
                        screen.id(), attempt, maxAttempts, delay, e.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return GeneratedArtifact.failed(screen, "Interrupted while waiting to retry", raw, attempt,
                            System.currentTimeMillis() - start, costUnits);
                }
            } catch (OracleRequestException e) {
                metrics.recordOracleCall("rejected", System.currentTimeMillis() - callStart);
                log.warn("Oracle rejected request for screen {}: {}", screen.id(), e.getMessage());
                return GeneratedArtifact.failed(screen, e.getMessage(), raw, attempt,
                        System.currentTimeMillis() - start, costUnits);
            } catch (OracleParseException e) {
                metrics.recordOracleCall("parse_error", 0);
                log.warn("Unparseable oracle response for screen {}: {}", screen.id(), e.getMessage());
                log.debug("Raw oracle response: {}", raw);
                return GeneratedArtifact.failed(screen, "ParseError: " + e.getMessage(), raw, attempt,
                        System.currentTimeMillis() - start, costUnits);
            }
        }
    }

    /**
     * Delay before the attempt following {@code attempt}: base * multiplier^(attempt-1), with up to 10%
     * jitter either way, capped at the maximum delay.
     */
    long backoffDelayMs(int attempt) {
        double delay = properties.getBaseDelayMs() * Math.pow(properties.getBackoffMultiplier(), attempt - 1);
        if (properties.isJitter()) {
            double range = delay * 0.1;
            delay += (jitterSource.getAsDouble() * 2 - 1) * range;
        }
        delay = Math.min(delay, properties.getMaxDelayMs());
        return Math.max(0L, Math.round(delay));
    }

    private OracleResponse call(OracleRequest request) {
        long timeout = properties.getCallTimeoutSeconds();
        if (timeout <= 0) {
            return oracle.generate(request);
        }
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<OracleResponse> future = callExecutor.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return oracle.generate(request);
            } finally {
                MDC.clear();
            }
        });
        try {
            return future.get(timeout, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TransientOracleException("Oracle call timed out after " + timeout + "s", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new OracleRequestException("Oracle call failed: " + cause, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new OracleRequestException("Interrupted while waiting for the oracle", e);
        }
    }

    private GeneratedArtifact toArtifact(Screen screen, ComponentRegistry registry, ParsedOracleResponse parsed,
                                         String raw, int attempts, long elapsedMs, long costUnits) {
        if (parsed.isRegistryRef()) {
            var updated = registry.recordUsage(parsed.registryRef(), screen.id());
            if (updated.isEmpty()) {
                log.warn("Screen {} references unknown component '{}'", screen.id(), parsed.registryRef());
                return GeneratedArtifact.failed(screen, "Unknown component reference: " + parsed.registryRef(),
                        raw, attempts, elapsedMs, costUnits);
            }
            log.info("Screen {} reuses registered component {}", screen.id(), updated.get().displayName());
            return new GeneratedArtifact(screen.id(), screen.ordinal(), List.of(), List.of(), List.of(),
                    List.of(updated.get().name()), raw, true, null, attempts, elapsedMs, costUnits);
        }

        var uiFiles = new ArrayList<>(parsed.uiFiles());
        var apiFiles = new ArrayList<>(parsed.apiFiles());
        var created = new ArrayList<ComponentDescriptor>();
        var refs = new LinkedHashSet<String>();
        for (ComponentDescriptor descriptor : parsed.components()) {
            RegistrationResult result = registry.register(descriptor, screen.id());
            refs.add(ComponentNames.normalize(descriptor.name()));
            if (result.created()) {
                created.add(result.descriptor());
                continue;
            }
            result.collisionWarning().ifPresent(w -> metrics.recordRegistryCollision());
            if (descriptor.filePath() != null) {
                uiFiles.removeIf(f -> f.path().equals(descriptor.filePath()));
                apiFiles.removeIf(f -> f.path().equals(descriptor.filePath()));
            }
        }
        log.info("Screen {} generated {} UI and {} API files, {} new components", screen.id(),
                uiFiles.size(), apiFiles.size(), created.size());
        return new GeneratedArtifact(screen.id(), screen.ordinal(), uiFiles, apiFiles, created,
                new ArrayList<>(refs), raw, true, null, attempts, elapsedMs, costUnits);
    }

    /**
     * Reported token usage, or prompt words plus response words when the model reports none.
     */
    static long costUnits(OracleRequest request, OracleResponse response) {
        if (response.hasUsage()) {
            return response.tokensUsed();
        }
        return words(request.systemPrompt()) + words(request.userPrompt()) + words(response.content());
    }

    private static long words(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }
}
