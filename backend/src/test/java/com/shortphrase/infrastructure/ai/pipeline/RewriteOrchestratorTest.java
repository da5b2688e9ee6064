package com.shortphrase.infrastructure.ai.pipeline;

import com.shortphrase.domain.rewrite.exception.FatalOracleException;
import com.shortphrase.domain.rewrite.exception.InvalidRewriteRequestException;
import com.shortphrase.domain.rewrite.exception.TransientOracleException;
import com.shortphrase.domain.rewrite.model.OracleItem;
import com.shortphrase.domain.rewrite.model.OracleRequest;
import com.shortphrase.domain.rewrite.model.ProcessingMode;
import com.shortphrase.domain.rewrite.model.Provenance;
import com.shortphrase.domain.rewrite.model.RejectionReason;
import com.shortphrase.domain.rewrite.model.RewriteCommand;
import com.shortphrase.domain.rewrite.model.RewriteProgressEvent;
import com.shortphrase.domain.rewrite.model.RewriteReport;
import com.shortphrase.domain.rewrite.model.RunMetricsSnapshot;
import com.shortphrase.domain.rewrite.model.SentenceRewrite;
import com.shortphrase.domain.rewrite.model.TaskStatus;
import com.shortphrase.domain.rewrite.service.WordCounter;
import com.shortphrase.infrastructure.ai.BackoffSleeper;
import com.shortphrase.infrastructure.ai.CostRateTable;
import com.shortphrase.infrastructure.ai.RetryPolicy;
import com.shortphrase.infrastructure.ai.ScriptedOracle;
import com.shortphrase.infrastructure.ai.batching.BatchScheduler;
import com.shortphrase.infrastructure.ai.batching.TokenEstimator;
import com.shortphrase.infrastructure.ai.cache.RewriteCache;
import com.shortphrase.infrastructure.ai.chunking.DeterministicChunker;
import com.shortphrase.infrastructure.ai.preprocessing.TextNormalizer;
import com.shortphrase.infrastructure.ai.routing.SentenceRouter;
import com.shortphrase.infrastructure.ai.validation.LanguageDetector;
import com.shortphrase.infrastructure.ai.validation.RewriteValidator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RewriteOrchestratorTest {

    private static final String SHORT = "Il faisait beau.";
    private static final String A = "Le vieux pêcheur réparait ses filets sur le port ensoleillé.";
    private static final String B = "Les enfants jouaient dans le jardin pendant que leurs parents discutaient.";
    private static final String C = "Le boulanger préparait le pain chaud avant le lever du soleil.";
    private static final String D = "La neige tombait doucement sur les toits de la vieille ville.";
    private static final String E = "Le train partait toujours en retard depuis la gare du village.";
    private static final String M = "Le vieux pêcheur réparait ses filets sur le port ensoleillé"
            + " pendant que les mouettes criaient fort.";
    private static final String X = "Les enfants jouaient dans le jardin pendant que leurs parents discutaient"
            + " longuement de leurs projets pour les vacances prochaines au bord de la mer.";

    private static final String[] A_REWRITE = {"Le vieux pêcheur réparait ses filets.", "Il était sur le port ensoleillé."};
    private static final String[] A_ENGLISH = {"The old fisherman was mending his nets.", "He was on the sunny harbour."};

    private ExecutorService executor;
    private RewriteCache cache;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        cache = new RewriteCache(500);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private RewriteOrchestrator orchestrator(int maxConcurrentBatches) {
        TokenEstimator tokenEstimator = new TokenEstimator(250);
        return new RewriteOrchestrator(
                new TextNormalizer(),
                new SentenceRouter(4, 500),
                new DeterministicChunker(true),
                cache,
                new BatchScheduler(1.5, 2.25, 20, 10, 5, 2000, tokenEstimator),
                new RewriteValidator(new LanguageDetector(), 3, 0.4),
                new CostRateTable(Map.of("openai", new CostRateTable.Rate(0.15, 0.60))),
                new RetryPolicy(3, 1, 2.0, 10, 0),
                BackoffSleeper.NO_WAIT,
                executor,
                maxConcurrentBatches,
                true);
    }

    private RewriteOrchestrator orchestrator() {
        return orchestrator(4);
    }

    private static ScriptedOracle frenchOracle() {
        return new ScriptedOracle()
                .answer(A, A_REWRITE)
                .answer(B, "Les enfants jouaient dans le jardin.", "Leurs parents discutaient pendant ce temps.")
                .answer(C, "Le boulanger préparait le pain chaud.", "Il le faisait avant le lever du soleil.")
                .answer(D, "La neige tombait doucement.", "Elle couvrait les toits de la vieille ville.")
                .answer(E, "Le train partait toujours en retard.", "Il partait depuis la gare du village.")
                .answer(M, "Le vieux pêcheur réparait ses filets.", "Il était sur le port ensoleillé.",
                        "Les mouettes criaient fort.")
                .answer(X, "Les enfants jouaient dans le jardin.", "Leurs parents discutaient longuement.",
                        "Ils parlaient de leurs projets.", "C'était pour les vacances prochaines.",
                        "Ils iraient au bord de la mer.");
    }

    private static void assertWithinLimit(RewriteReport report, int limit) {
        assertThat(report.allFragments()).allSatisfy(fragment ->
                assertThat(WordCounter.count(fragment)).isBetween(1, limit));
    }

    private static List<TaskStatus> statuses(RewriteReport report) {
        return report.results().stream().map(SentenceRewrite::status).toList();
    }

    @Test
    @DisplayName("every sentence gets compliant output, in input order")
    void total_coverage() {
        String runOn = String.join(" ", Collections.nCopies(40, "mot")) + ".";
        ScriptedOracle oracle = frenchOracle();

        RewriteReport report = orchestrator().run(RewriteCommand.of(List.of(SHORT, A, B, runOn), 8), oracle);

        assertThat(report.results()).extracting(SentenceRewrite::index).containsExactly(0, 1, 2, 3);
        assertThat(statuses(report)).containsExactly(
                TaskStatus.ROUTED_DIRECT, TaskStatus.VALIDATED, TaskStatus.VALIDATED, TaskStatus.ROUTED_MECHANICAL);
        assertThat(report.results().get(3).outputFragments()).hasSize(5);
        assertThat(String.join(" ", report.results().get(3).outputFragments())).isEqualTo(runOn);
        assertWithinLimit(report, 8);
        assertThat(report.cancelled()).isFalse();
        assertThat(report.warnings()).isEmpty();

        // A and B share one SIMPLE batch
        assertThat(oracle.callCount()).isEqualTo(1);
        assertThat(oracle.requests().get(0).sentences()).containsExactly(A, B);

        RunMetricsSnapshot metrics = report.metrics();
        assertThat(metrics.sentencesSeen()).isEqualTo(4);
        assertThat(metrics.directPassThroughs()).isEqualTo(1);
        assertThat(metrics.oracleSuccesses()).isEqualTo(2);
        assertThat(metrics.mechanicalRouted()).isEqualTo(1);
        assertThat(metrics.mechanicalFallbacks()).isZero();
        assertThat(metrics.cacheMisses()).isEqualTo(2);
        assertThat(metrics.oracleCalls()).isEqualTo(1);
        assertThat(metrics.batches()).isEqualTo(1);
        assertThat(metrics.inputTokens()).isEqualTo(100);
        assertThat(metrics.outputTokens()).isEqualTo(50);
        assertThat(metrics.estimatedCostUsd()).isCloseTo(100 * 0.15 / 1e6 + 50 * 0.60 / 1e6, within(1e-12));
    }

    @Test
    @DisplayName("a rewrite of two short sentences replaces a long French sentence")
    void french_scenario() {
        String sentence = "Le chat noir dormait paisiblement sur le canapé confortable près de la fenêtre.";
        ScriptedOracle oracle = new ScriptedOracle()
                .answer(sentence, "Le chat noir dormait paisiblement.", "Le canapé confortable était près de la fenêtre.");

        RewriteReport report = orchestrator().run(RewriteCommand.of(List.of(sentence, SHORT), 8), oracle);

        assertThat(report.totalFragments()).isEqualTo(3);
        assertThat(report.allFragments()).containsExactly(
                "Le chat noir dormait paisiblement.",
                "Le canapé confortable était près de la fenêtre.",
                SHORT);
        assertThat(report.results().get(0).provenance()).isEqualTo(Provenance.ORACLE);
        assertThat(report.results().get(0).accepted()).isTrue();
        assertThat(report.toExportRows()).hasSize(3);
    }

    @Test
    void empty_input() {
        ScriptedOracle oracle = frenchOracle();

        RewriteReport report = orchestrator().run(RewriteCommand.of(List.of(), 8), oracle);

        assertThat(report.results()).isEmpty();
        assertThat(report.cancelled()).isFalse();
        assertThat(oracle.callCount()).isZero();
    }

    @Nested
    @DisplayName("Validation failures")
    class ValidationFailureTests {

        @Test
        @DisplayName("an answer above the limit is retried once, then chunked")
        void over_limit_then_fallback() {
            ScriptedOracle oracle = new ScriptedOracle()
                    .answer(A, "Le vieux pêcheur réparait ses filets sur le port.", "Il faisait beau.");

            RewriteReport report = orchestrator().run(RewriteCommand.of(List.of(A), 8), oracle);

            SentenceRewrite result = report.results().get(0);
            assertThat(result.status()).isEqualTo(TaskStatus.FALLBACK);
            assertThat(result.provenance()).isEqualTo(Provenance.MECHANICAL);
            assertThat(result.flaggedForReview()).isTrue();
            assertThat(result.accepted()).isFalse();
            assertThat(result.outputFragments()).containsExactly(
                    "Le vieux pêcheur réparait ses filets sur le", "port ensoleillé.");
            assertThat(result.note()).contains("OVER_LIMIT");
            assertWithinLimit(report, 8);

            assertThat(oracle.callCount()).isEqualTo(2);
            assertThat(report.metrics().rejections()).containsEntry(RejectionReason.OVER_LIMIT, 2L);
            assertThat(report.metrics().validationRetries()).isEqualTo(1);
            assertThat(report.metrics().mechanicalFallbacks()).isEqualTo(1);
            assertThat(cache.size()).isZero();
        }

        @Test
        @DisplayName("a translated answer triggers one strict request citing the language")
        void wrong_language_retry_then_fallback() {
            ScriptedOracle oracle = new ScriptedOracle().answer(A, A_ENGLISH);

            RewriteReport report = orchestrator().run(RewriteCommand.of(List.of(A), 8), oracle);

            assertThat(oracle.requests()).hasSize(2);
            OracleRequest strict = oracle.requests().get(1);
            assertThat(strict.isStrict()).isTrue();
            assertThat(strict.previousRejection()).isEqualTo(RejectionReason.WRONG_LANGUAGE);
            assertThat(strict.sentences()).containsExactly(A);

            assertThat(report.results().get(0).status()).isEqualTo(TaskStatus.FALLBACK);
            assertThat(report.results().get(0).note()).contains("WRONG_LANGUAGE");
            assertThat(report.metrics().rejections()).containsEntry(RejectionReason.WRONG_LANGUAGE, 2L);
        }

        @Test
        @DisplayName("a missing entry is re-requested and can still succeed")
        void malformed_then_strict_success() {
            ScriptedOracle oracle = frenchOracle()
                    .then(request -> ScriptedOracle.respond(List.of(OracleItem.malformed("no entry for sentence 1"))));

            RewriteReport report = orchestrator().run(RewriteCommand.of(List.of(A), 8), oracle);

            assertThat(report.results().get(0).status()).isEqualTo(TaskStatus.VALIDATED);
            assertThat(report.results().get(0).outputFragments()).containsExactly(A_REWRITE);
            assertThat(report.metrics().rejections()).containsEntry(RejectionReason.MALFORMED_RESPONSE, 1L);
            assertThat(report.metrics().validationRetries()).isEqualTo(1);
            assertThat(oracle.callCount()).isEqualTo(2);
            assertThat(cache.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("one bad answer in a batch does not affect the others")
        void partial_failure_isolation() {
            ScriptedOracle oracle = frenchOracle()
                    .answer(D, "The snow was falling gently.", "It covered the roofs of the old town.");

            RewriteReport report = orchestrator().run(RewriteCommand.of(List.of(A, B, C, D, E), 8), oracle);

            assertThat(statuses(report)).containsExactly(
                    TaskStatus.VALIDATED, TaskStatus.VALIDATED, TaskStatus.VALIDATED,
                    TaskStatus.FALLBACK, TaskStatus.VALIDATED);
            assertThat(oracle.callCount()).isEqualTo(2);
            assertThat(oracle.requests().get(0).sentences()).hasSize(5);
            assertThat(oracle.requests().get(1).sentences()).containsExactly(D);
            assertThat(report.metrics().oracleSuccesses()).isEqualTo(4);
            assertThat(report.metrics().mechanicalFallbacks()).isEqualTo(1);
            assertWithinLimit(report, 8);
        }
    }

    @Nested
    @DisplayName("Cache")
    class CacheTests {

        @Test
        @DisplayName("duplicates within a run cost one rewrite")
        void duplicate_within_run() {
            ScriptedOracle oracle = frenchOracle();

            RewriteReport report = orchestrator().run(RewriteCommand.of(List.of(A, A, B), 8), oracle);

            assertThat(statuses(report)).containsExactly(TaskStatus.VALIDATED, TaskStatus.CACHED, TaskStatus.VALIDATED);
            assertThat(report.results().get(1).outputFragments()).isEqualTo(report.results().get(0).outputFragments());
            assertThat(oracle.callCount()).isEqualTo(1);
            assertThat(oracle.requests().get(0).sentences()).containsExactly(A, B);
            assertThat(report.metrics().cacheMisses()).isEqualTo(2);
            assertThat(report.metrics().cacheHits()).isEqualTo(1);
        }

        @Test
        @DisplayName("a second run with the same input makes no oracle call")
        void idempotent_across_runs() {
            ScriptedOracle oracle = frenchOracle();
            RewriteOrchestrator orchestrator = orchestrator();

            RewriteReport first = orchestrator.run(RewriteCommand.of(List.of(A, A, B), 8), oracle);
            RewriteReport second = orchestrator.run(RewriteCommand.of(List.of(A, A, B), 8), oracle);

            assertThat(oracle.callCount()).isEqualTo(1);
            assertThat(statuses(second)).containsOnly(TaskStatus.CACHED);
            assertThat(second.allFragments()).isEqualTo(first.allFragments());
            assertThat(second.metrics().cacheHits()).isEqualTo(3);
            assertThat(second.metrics().cacheHitRate()).isEqualTo(100.0);
        }

        @Test
        @DisplayName("a rewrite made for a looser limit is not reused under a tighter one")
        void limit_sensitive() {
            String sentence = "Le vieux pêcheur réparait ses filets sur le port ensoleillé chaque matin.";
            ScriptedOracle oracle = new ScriptedOracle().always(request -> ScriptedOracle.respond(List.of(
                    request.wordLimit() >= 8
                            ? OracleItem.of(List.of("Le vieux pêcheur réparait ses filets.",
                                    "Il était sur le port ensoleillé chaque matin."))
                            : OracleItem.of(List.of("Le pêcheur réparait ses filets.", "Il était sur le port.",
                                    "Le port était ensoleillé.", "C'était chaque matin.")))));
            RewriteOrchestrator orchestrator = orchestrator();

            RewriteReport loose = orchestrator.run(RewriteCommand.of(List.of(sentence), 8), oracle);
            RewriteReport tight = orchestrator.run(RewriteCommand.of(List.of(sentence), 5), oracle);

            assertThat(loose.results().get(0).status()).isEqualTo(TaskStatus.VALIDATED);
            assertThat(tight.results().get(0).status()).isEqualTo(TaskStatus.VALIDATED);
            assertThat(oracle.callCount()).isEqualTo(2);
            assertThat(oracle.requests().get(1).wordLimit()).isEqualTo(5);
            assertWithinLimit(tight, 5);

            // the tighter rewrite also satisfies the looser limit
            RewriteReport again = orchestrator.run(RewriteCommand.of(List.of(sentence), 8), oracle);
            assertThat(again.results().get(0).status()).isEqualTo(TaskStatus.CACHED);
            assertThat(oracle.callCount()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Oracle failures")
    class OracleFailureTests {

        @Test
        @DisplayName("rejected credentials disable the oracle and produce one warning")
        void fatal_error() {
            ScriptedOracle oracle = new ScriptedOracle().alwaysThrow(new FatalOracleException("invalid api key"));

            RewriteReport report = orchestrator(1).run(RewriteCommand.of(List.of(SHORT, A, M, X), 8), oracle);

            assertThat(statuses(report)).containsExactly(
                    TaskStatus.ROUTED_DIRECT, TaskStatus.FALLBACK, TaskStatus.FALLBACK, TaskStatus.FALLBACK);
            assertWithinLimit(report, 8);
            assertThat(oracle.callCount()).isEqualTo(1);
            assertThat(report.warnings()).singleElement().asString().contains("openai").contains("invalid api key");
            assertThat(report.metrics().fatalErrorWarnings()).isEqualTo(1);
            assertThat(report.metrics().successfulOracleCalls()).isZero();
            assertThat(report.cancelled()).isFalse();
        }

        @Test
        @DisplayName("with concurrent batches a fatal error is still reported once")
        void fatal_error_concurrent() {
            ScriptedOracle oracle = new ScriptedOracle().alwaysThrow(new FatalOracleException("invalid api key"));

            RewriteReport report = orchestrator(4).run(RewriteCommand.of(List.of(A, M, X), 8), oracle);

            assertThat(statuses(report)).containsOnly(TaskStatus.FALLBACK);
            assertThat(oracle.callCount()).isBetween(1, 3);
            assertThat(report.warnings()).hasSize(1);
            assertThat(report.metrics().fatalErrorWarnings()).isEqualTo(1);
        }

        @Test
        @DisplayName("a persistently unavailable oracle falls back once retries run out")
        void transient_exhausted() {
            ScriptedOracle oracle = new ScriptedOracle().alwaysThrow(new TransientOracleException("HTTP 503"));

            RewriteReport report = orchestrator().run(RewriteCommand.of(List.of(A), 8), oracle);

            assertThat(report.results().get(0).status()).isEqualTo(TaskStatus.FALLBACK);
            assertThat(report.results().get(0).note()).contains("HTTP 503");
            assertThat(oracle.callCount()).isEqualTo(3);
            assertThat(report.metrics().failedOracleCalls()).isEqualTo(3);
            assertThat(report.warnings()).isEmpty();
        }

        @Test
        @DisplayName("a transient failure followed by success is invisible in the output")
        void transient_then_success() {
            ScriptedOracle oracle = frenchOracle().thenThrow(new TransientOracleException("HTTP 429"));

            RewriteReport report = orchestrator().run(RewriteCommand.of(List.of(A), 8), oracle);

            assertThat(report.results().get(0).status()).isEqualTo(TaskStatus.VALIDATED);
            assertThat(report.metrics().oracleCalls()).isEqualTo(2);
            assertThat(report.metrics().failedOracleCalls()).isEqualTo(1);
            assertThat(report.metrics().successfulOracleCalls()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Cancellation and progress")
    class CancellationAndProgressTests {

        @Test
        @DisplayName("a run cancelled up front only returns what routing resolved")
        void cancelled_before_start() {
            ScriptedOracle oracle = frenchOracle();
            CancellationToken token = new CancellationToken();
            token.cancel();

            RewriteReport report = orchestrator().run(RewriteCommand.of(List.of(SHORT, A), 8), oracle,
                    ProgressChannel.discarding(), token);

            assertThat(report.cancelled()).isTrue();
            assertThat(report.results()).extracting(SentenceRewrite::index).containsExactly(0);
            assertThat(oracle.callCount()).isZero();
        }

        @Test
        @DisplayName("cancelling during a run stops further batch submissions")
        void cancelled_mid_run() {
            CancellationToken token = new CancellationToken();
            ScriptedOracle oracle = frenchOracle();
            oracle.then(request -> {
                token.cancel();
                return oracle.answerFromTable(request);
            });

            RewriteReport report = orchestrator(1).run(RewriteCommand.of(List.of(A, M, X), 8), oracle,
                    ProgressChannel.discarding(), token);

            assertThat(report.cancelled()).isTrue();
            assertThat(oracle.callCount()).isEqualTo(1);
            assertThat(report.results()).hasSize(1);
            assertThat(report.results().get(0).status()).isEqualTo(TaskStatus.VALIDATED);
            assertWithinLimit(report, 8);
        }

        @Test
        @DisplayName("an interrupted run still records the batch already in flight")
        void interrupted_mid_run() throws Exception {
            CountDownLatch called = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            ScriptedOracle oracle = frenchOracle();
            oracle.then(request -> {
                called.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return oracle.answerFromTable(request);
            });
            RewriteOrchestrator orchestrator = orchestrator(1);
            AtomicReference<RewriteReport> result = new AtomicReference<>();
            AtomicBoolean interruptKept = new AtomicBoolean();

            Thread runner = new Thread(() -> {
                result.set(orchestrator.run(RewriteCommand.of(List.of(A, M, X), 8), oracle,
                        ProgressChannel.discarding(), CancellationToken.none()));
                interruptKept.set(Thread.currentThread().isInterrupted());
            });
            runner.start();
            assertThat(called.await(5, TimeUnit.SECONDS)).isTrue();
            runner.interrupt();
            release.countDown();
            runner.join(5000);

            RewriteReport report = result.get();
            assertThat(report).isNotNull();
            assertThat(report.cancelled()).isTrue();
            assertThat(oracle.callCount()).isEqualTo(1);
            assertThat(report.results()).hasSize(1);
            assertThat(report.results().get(0).status()).isEqualTo(TaskStatus.VALIDATED);
            assertThat(report.metrics().oracleCalls()).isEqualTo(1);
            assertThat(report.metrics().inputTokens()).isEqualTo(ScriptedOracle.USAGE.inputTokens());
            assertThat(report.metrics().outputTokens()).isEqualTo(ScriptedOracle.USAGE.outputTokens());
            assertThat(interruptKept).isTrue();
        }

        @Test
        @DisplayName("progress is published after routing, after each batch and at the end")
        void progress_events() {
            QueueProgressChannel channel = new QueueProgressChannel();

            orchestrator().run(RewriteCommand.of(List.of(SHORT, A, B), 8), frenchOracle(),
                    channel, CancellationToken.none());

            List<RewriteProgressEvent> events = channel.drain();
            assertThat(events).hasSizeGreaterThanOrEqualTo(3);
            assertThat(events.get(0).completed()).isEqualTo(1);
            assertThat(events.get(0).total()).isEqualTo(3);
            assertThat(events.get(0).finished()).isFalse();
            assertThat(events).extracting(RewriteProgressEvent::completed).isSorted();

            RewriteProgressEvent last = events.get(events.size() - 1);
            assertThat(last.finished()).isTrue();
            assertThat(last.completed()).isEqualTo(3);
            assertThat(last.percent()).isEqualTo(100.0);
            assertThat(last.metrics().oracleSuccesses()).isEqualTo(2);
            assertThat(events).filteredOn(RewriteProgressEvent::finished).hasSize(1);
        }

        @Test
        @DisplayName("a failing progress channel does not stop the run")
        void failing_channel() {
            ProgressChannel broken = event -> {
                throw new IllegalStateException("listener gone");
            };

            RewriteReport report = orchestrator().run(RewriteCommand.of(List.of(SHORT, A), 8), frenchOracle(),
                    broken, CancellationToken.none());

            assertThat(statuses(report)).containsExactly(TaskStatus.ROUTED_DIRECT, TaskStatus.VALIDATED);
        }
    }

    @Nested
    @DisplayName("Input handling")
    class InputTests {

        @Test
        void rejects_invalid_commands() {
            RewriteOrchestrator orchestrator = orchestrator();
            ScriptedOracle oracle = frenchOracle();

            assertThatThrownBy(() -> orchestrator.run(RewriteCommand.of(List.of(A), 0), oracle))
                    .isInstanceOf(InvalidRewriteRequestException.class)
                    .hasMessageContaining("positive");
            assertThatThrownBy(() -> orchestrator.run(RewriteCommand.of(Arrays.asList(A, null), 8), oracle))
                    .isInstanceOf(InvalidRewriteRequestException.class)
                    .hasMessageContaining("Sentence 1");
            assertThatThrownBy(() -> orchestrator.run(new RewriteCommand(null, 8, ProcessingMode.ORACLE_REWRITE), oracle))
                    .isInstanceOf(InvalidRewriteRequestException.class);
            assertThatThrownBy(() -> orchestrator.run(RewriteCommand.of(List.of(A), 8), null))
                    .isInstanceOf(InvalidRewriteRequestException.class);
            assertThat(oracle.callCount()).isZero();
        }

        @Test
        @DisplayName("mechanical-only mode needs no oracle")
        void mechanical_only() {
            RewriteReport report = orchestrator().run(
                    new RewriteCommand(List.of(SHORT, A), 8, ProcessingMode.MECHANICAL_ONLY), null);

            assertThat(statuses(report)).containsExactly(TaskStatus.ROUTED_DIRECT, TaskStatus.ROUTED_MECHANICAL);
            assertThat(report.results().get(1).outputFragments()).containsExactly(
                    "Le vieux pêcheur réparait ses filets sur le", "port ensoleillé.");
            assertThat(report.results().get(1).note()).isNull();
            assertThat(report.metrics().oracleCalls()).isZero();
        }

        @Test
        @DisplayName("cleaning affects the output but the original is reported as supplied")
        void input_cleaning() {
            String raw = "  Il   faisait\u00A0beau.\u200B ";

            RewriteReport report = orchestrator().run(RewriteCommand.of(List.of(raw), 8), frenchOracle());

            SentenceRewrite result = report.results().get(0);
            assertThat(result.originalSentence()).isEqualTo(raw);
            assertThat(result.outputFragments()).containsExactly("Il faisait beau.");
            assertThat(result.wordCount()).isEqualTo(3);
        }
    }
}
