package dev.grafcet.engine;

import dev.grafcet.model.IoVocabulary;
import dev.grafcet.model.Issue;
import dev.grafcet.model.IssueKind;
import dev.grafcet.model.ModeResult;
import dev.grafcet.model.ModeVerification;
import dev.grafcet.model.Severity;
import dev.grafcet.model.ValidationSummary;
import dev.grafcet.model.VerificationReport;
import dev.grafcet.model.VerificationRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Verifies every job of a {@link ModeVerificationPlan}. Jobs are independent and run on a
 * fixed pool; results come back in plan order.
 */
public final class ModeVerificationRunner {

    private static final Logger log = LoggerFactory.getLogger(ModeVerificationRunner.class);
    private static final AtomicInteger THREAD_SEQ = new AtomicInteger(1);

    private final int threads;
    private final VerificationRules rules;

    public ModeVerificationRunner() {
        this(Math.max(2, Runtime.getRuntime().availableProcessors()), VerificationRules.defaults());
    }

    public ModeVerificationRunner(int threads, VerificationRules rules) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, got " + threads);
        }
        this.threads = threads;
        this.rules = rules;
    }

    public ValidationSummary run(ModeVerificationPlan plan, IoVocabulary vocabulary) {
        log.info("Starting verification of {} modes", plan.size());
        if (plan.jobs().isEmpty()) {
            return new ValidationSummary(List.of());
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, plan.size()), runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("mode-verifier-" + THREAD_SEQ.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
        try {
            var futures = new ArrayList<Future<ModeResult>>();
            for (ModeVerification job : plan.jobs()) {
                futures.add(executor.submit(() -> verify(job, vocabulary)));
            }

            var results = new ArrayList<ModeResult>();
            for (Future<ModeResult> future : futures) {
                ModeResult result = future.get();
                logResult(result);
                results.add(result);
            }

            var summary = new ValidationSummary(results);
            if (summary.allPassed()) {
                log.info("All {} modes passed verification", summary.totalModes());
            } else {
                log.warn("Verification complete: {}/{} passed, {} failed",
                    summary.passed(), summary.totalModes(), summary.failed());
            }
            return summary;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Mode verification interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Mode verification failed", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private ModeResult verify(ModeVerification job, IoVocabulary vocabulary) {
        List<Issue> issues;
        if (job.program() == null) {
            issues = List.of(Issue.of(IssueKind.INCORRECT_SEQUENCING, Severity.ERROR,
                "Compiled program not found for mode " + job.modeId(),
                "Compile the mode's SFC program before verifying it"));
        } else {
            issues = StaticVerifier.verify(job.program(), vocabulary, job.category(), rules);
        }
        return new ModeResult(job.modeId(), job.modeName(), new VerificationReport(issues));
    }

    private static void logResult(ModeResult result) {
        if (result.passed()) {
            log.info("Mode {} PASSED", result.modeId());
        } else {
            log.warn("Mode {} FAILED ({} errors, {} warnings)", result.modeId(),
                result.report().errorCount(), result.report().warningCount());
        }
    }
}
