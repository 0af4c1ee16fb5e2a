package com.framesmith.core.engine;

import com.framesmith.core.events.FramesmithEvent;
import com.framesmith.core.graph.PipelineFixture;
import com.framesmith.core.loader.MalformedInputException;
import com.framesmith.core.model.AggregateResult;
import com.framesmith.core.model.GenerationOptions;
import com.framesmith.core.model.JobStatus;
import com.framesmith.core.model.ProcessingMode;
import com.framesmith.core.model.RouteEntry;
import com.framesmith.core.model.ScreenOutcome;
import com.framesmith.core.model.ScreenStatus;
import com.framesmith.core.oracle.CodeOracle;
import com.framesmith.core.oracle.OracleRequest;
import com.framesmith.core.oracle.OracleResponse;
import com.framesmith.core.state.JobState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * End-to-end tests for GenerationEngine over the real pipeline with a mocked oracle.
 */
class GenerationEngineTest {

    private static final Map<String, String> NAMES = Map.of(
            "2:1", "Home", "2:2", "Login", "2:3", "Dashboard", "2:4", "Settings", "2:5", "Profile");

    private CodeOracle oracle;
    private PipelineFixture pipeline;
    private GenerationEngine engine;

    @BeforeEach
    void setUp() throws Exception {
        oracle = mock(CodeOracle.class);
        when(oracle.generate(any(OracleRequest.class))).thenAnswer(inv -> respond(inv.getArgument(0)));
        pipeline = new PipelineFixture(oracle, 10);
        engine = new GenerationEngine(pipeline.graph, pipeline.activeJobs, pipeline.eventBus, pipeline.metrics);
    }

    @AfterEach
    void tearDown() {
        pipeline.close();
    }

    private static OracleResponse respond(OracleRequest request) {
        String id = request.screenId();
        if (id.equals("2:3")) {
            return OracleResponse.of("I'm sorry, I cannot generate code for this dashboard.");
        }
        String name = NAMES.get(id);
        String json = "{\"files\": [{\"path\": \"src/pages/" + name + ".tsx\", \"content\": \"export default " + name + "\"}";
        if (id.equals("2:1")) {
            json += ", {\"path\": \"src/components/Button.tsx\", \"content\": \"button\"}],"
                    + " \"registryEntry\": {\"componentName\": \"Button\", \"path\": \"src/components/Button.tsx\"}}";
        } else {
            json += "]}";
        }
        return new OracleResponse(json, 10);
    }

    @Nested
    @DisplayName("generate")
    class Generate {

        @Test
        @DisplayName("Five screens with one unparseable reply end partially completed at 4/5")
        void partialCompletion() {
            String jobId = engine.generateJobId();
            List<FramesmithEvent> events = new CopyOnWriteArrayList<>();
            pipeline.eventBus.subscribe(jobId, events::add);

            AggregateResult result = engine.generate(jobId, PipelineFixture.fixture("five-screens.json"),
                    GenerationOptions.defaults());

            assertEquals(jobId, result.jobId());
            assertEquals("Shop App", result.documentName());
            assertEquals(ProcessingMode.CHUNKED, result.mode());
            assertEquals(JobStatus.PARTIALLY_COMPLETED, result.status());
            assertEquals("4/5 screens succeeded", result.summary());

            List<ScreenOutcome> table = result.statusTable();
            assertEquals(5, table.size());
            assertEquals(ScreenStatus.FAILED, table.get(2).status());
            assertTrue(table.get(2).failureReason().startsWith("ParseError"));
            assertEquals(1, result.failures().size());

            assertEquals(5, result.uiFiles().size());
            assertEquals(1, result.components().size());
            assertEquals("Button", result.components().get(0).displayName());
            assertEquals(List.of("home", "login", "settings", "profile"),
                    result.navigation().routes().stream().map(RouteEntry::slug).toList());
            assertEquals(5, result.statistics().oracleCalls());

            assertEquals("job.created", events.get(0).eventType());
            assertEquals("job.completed", events.get(events.size() - 1).eventType());
            verify(oracle, times(5)).generate(any());
            assertTrue(pipeline.activeJobs.activeJobIds().isEmpty());

            int seen = events.size();
            pipeline.eventBus.publish(FramesmithEvent.of("screen.started", jobId, "2:1", Map.of()));
            assertEquals(seen, events.size(), "job subscribers are dropped when the job ends");
        }

        @Test
        @DisplayName("Every route points at its own screen's page when all screens emit the same path")
        void routesSurviveSharedPagePath() {
            doAnswer(inv -> {
                OracleRequest request = inv.getArgument(0);
                return new OracleResponse("{\"files\": [{\"path\": \"src/pages/Page.tsx\", \"content\": \"screen "
                        + request.screenId() + "\"}]}", 10);
            }).when(oracle).generate(any(OracleRequest.class));

            AggregateResult result = engine.generate(PipelineFixture.fixture("five-screens.json"),
                    GenerationOptions.defaults());

            assertEquals(JobStatus.COMPLETED, result.status());
            assertEquals(5, result.navigation().routes().size());
            for (RouteEntry route : result.navigation().routes()) {
                String content = result.uiFiles().stream()
                        .filter(f -> f.path().equals(route.entryFile()))
                        .findFirst().orElseThrow().content();
                assertEquals("screen " + route.screenId(), content, route.slug());
            }
        }

        @Test
        @DisplayName("A target filter skips the other screens")
        void targetFilter() {
            var options = new GenerationOptions("react", "nodejs", false, false, null, Set.of("Login"));

            AggregateResult result = engine.generate(PipelineFixture.fixture("five-screens.json"), options);

            assertEquals(1, result.statistics().screensSucceeded());
            assertEquals(4, result.statistics().screensSkipped());
            verify(oracle, times(1)).generate(any());
        }

        @Test
        @DisplayName("Malformed input is rethrown and the job is released")
        void malformedInput() {
            assertThrows(MalformedInputException.class,
                    () -> engine.generate("{not json", GenerationOptions.defaults()));
            assertTrue(pipeline.activeJobs.activeJobIds().isEmpty());
            verify(oracle, never()).generate(any());
        }
    }

    @Nested
    @DisplayName("analyze")
    class Analyze {

        @Test
        @DisplayName("Plans screens without oracle calls")
        void analyze() {
            JobState state = engine.analyze(PipelineFixture.fixture("five-screens.json"));

            assertEquals(ProcessingMode.CHUNKED, state.mode());
            assertEquals(List.of("Home", "Login", "Dashboard", "Settings", "Profile"),
                    state.screens().stream().map(s -> s.name()).toList());
            assertTrue(state.result().isEmpty());
            verify(oracle, never()).generate(any());
        }

        @Test
        @DisplayName("Small documents are processed as a single screen")
        void standardMode() {
            JobState state = engine.analyze(PipelineFixture.fixture("flat-small.json"));

            assertEquals(ProcessingMode.STANDARD, state.mode());
            assertEquals(1, state.screens().size());
        }
    }

    @Test
    @DisplayName("Job ids follow FSMT-YYYY-NNNN and are unique")
    void jobIdFormat() {
        String first = engine.generateJobId();
        String second = engine.generateJobId();

        assertTrue(first.matches("FSMT-\\d{4}-\\d{4}"), first);
        assertNotEquals(first, second);
    }

    @Test
    @DisplayName("Cancelling an unknown job reports false")
    void cancelUnknown() {
        assertFalse(engine.cancel("FSMT-0000-9999"));
    }
}
