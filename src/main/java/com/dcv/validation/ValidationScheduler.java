package com.dcv.validation;

import com.dcv.api.ApiException;
import com.dcv.domain.Domain;
import com.dcv.domain.ValidationResult;
import com.dcv.ultradns.DnsProviderClient;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.IntFunction;

/**
 * Runs the validation workflow across many domains.
 *
 * <p>A run goes through distinct phases:
 * <ol>
 *     <li>DNS provider login. Failure aborts the run before anything is dispatched.</li>
 *     <li>Candidate resolution from one source, see {@link DomainSource}.</li>
 *     <li>Operator confirmation. Declining ends the run without side effects.</li>
 *     <li>Concurrent dispatch of one workflow per domain behind a {@link RateGate}.</li>
 * </ol>
 * <p>Workflows share the certificate authority and DNS provider sessions; the rate gate is the only
 * synchronized state. A failing domain never aborts its siblings.
 * <p>Results are collected in completion order.
 */
public class ValidationScheduler {

    private final DnsProviderClient dns;
    private final DomainSource source;
    private final DomainValidationWorkflow workflow;
    private final int rateGateThreshold;
    private final int rateGatePermits;
    private final Logger log;
    private final IntFunction<ExecutorService> executors;

    /**
     * Constructs a new ValidationScheduler with default rate gate settings.
     *
     * @param dns      DNS provider client, authenticated by {@link #run(RunRequest, Confirmation)}.
     * @param source   DomainSource instance.
     * @param workflow DomainValidationWorkflow instance.
     */
    public ValidationScheduler(DnsProviderClient dns, DomainSource source, DomainValidationWorkflow workflow) {
        this(dns, source, workflow, RateGate.DEFAULT_THRESHOLD, RateGate.DEFAULT_PERMITS,
                LogManager.getLogger(ValidationScheduler.class));
    }

    /**
     * Constructs a new ValidationScheduler.
     *
     * @param dns               DNS provider client.
     * @param source            DomainSource instance.
     * @param workflow          DomainValidationWorkflow instance.
     * @param rateGateThreshold Domain count from which concurrency is limited.
     * @param rateGatePermits   Concurrent workflows once limited.
     * @param log               Logger for the run.
     */
    public ValidationScheduler(DnsProviderClient dns, DomainSource source, DomainValidationWorkflow workflow,
                               int rateGateThreshold, int rateGatePermits, Logger log) {
        this(dns, source, workflow, rateGateThreshold, rateGatePermits, log, Executors::newFixedThreadPool);
    }

    /**
     * Constructs a new ValidationScheduler with given executor factory.
     *
     * @param executors Executor factory, receives the pool size.
     */
    ValidationScheduler(DnsProviderClient dns, DomainSource source, DomainValidationWorkflow workflow,
                        int rateGateThreshold, int rateGatePermits, Logger log, IntFunction<ExecutorService> executors) {
        this.executors = executors;
        this.dns = dns;
        this.source = source;
        this.workflow = workflow;
        this.rateGateThreshold = rateGateThreshold;
        this.rateGatePermits = rateGatePermits;
        this.log = log;
    }

    /**
     * Runs a full validation pass.
     *
     * @param request      RunRequest instance.
     * @param confirmation Operator confirmation.
     * @return ValidationReport.
     * @throws ApiException On DNS login failure or candidate resolution failure.
     * @throws IOException  Unable to read the domain file.
     */
    public ValidationReport run(RunRequest request, Confirmation confirmation) throws ApiException, IOException {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        Instant started = Instant.now();

        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put("run", runId)) {
            log.info("-------- DCV: Beginning new run {} --------", runId);

            dns.authenticate();

            Candidates candidates = source.resolve(request);
            if (candidates.isEmpty()) {
                log.info("No domains to validate");
                return finish(runId, started, List.of(), candidates.skipped(), false);
            }

            if (!confirmation.confirm(candidates.domains())) {
                log.info("Aborting validation steps, {} domains not dispatched", candidates.domains().size());
                return finish(runId, started, List.of(), candidates.skipped(), true);
            }

            List<ValidationResult> results = runAll(runId, candidates.domains(), request.timeoutSeconds());
            return finish(runId, started, results, candidates.skipped(), false);
        }
    }

    /**
     * Validates all domains concurrently.
     *
     * @param domains        Domains to validate.
     * @param timeoutSeconds Seconds to wait for validation per domain.
     * @return List of ValidationResult in completion order.
     */
    public List<ValidationResult> runAll(List<Domain> domains, int timeoutSeconds) {
        return runAll(UUID.randomUUID().toString().substring(0, 8), domains, timeoutSeconds);
    }

    private List<ValidationResult> runAll(String runId, List<Domain> domains, int timeoutSeconds) {
        if (domains.isEmpty()) {
            return new ArrayList<>();
        }

        RateGate gate = RateGate.forDomainCount(domains.size(), rateGateThreshold, rateGatePermits);
        log.info("Validating {} domains", domains.size());

        Queue<ValidationResult> results = new ConcurrentLinkedQueue<>();
        ExecutorService executor = executors.apply(gate.isLimited()
                ? Math.min(gate.getPermits(), domains.size())
                : domains.size());
        try {
            List<CompletableFuture<Void>> futures = new ArrayList<>();
            for (Domain domain : domains) {
                futures.add(CompletableFuture.runAsync(
                        () -> results.add(dispatch(runId, domain, timeoutSeconds, gate)),
                        executor));
            }

            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } finally {
            executor.shutdown();
        }

        return new ArrayList<>(results);
    }

    /**
     * Runs one workflow behind the rate gate.
     * <p>Never throws; unexpected failures become a failed result.
     */
    private ValidationResult dispatch(String runId, Domain domain, int timeoutSeconds, RateGate gate) {
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext
                .put("run", runId)
                .put("domain", domain.getName())) {

            try {
                gate.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted before validating {}", domain.getName());
                return ValidationResult.failed(domain.getName(), "Interrupted before validation started.");
            }

            try {
                return workflow.validate(domain, timeoutSeconds);
            } catch (RuntimeException e) {
                log.error("Validation of {} failed unexpectedly: {}", domain.getName(), e.getMessage(), e);
                return ValidationResult.failed(domain.getName(), "Unexpected error: " + e.getMessage());
            } finally {
                gate.release();
            }
        }
    }

    private ValidationReport finish(String runId, Instant started, List<ValidationResult> results,
                                    Map<String, String> skipped, boolean aborted) {
        ValidationReport report = new ValidationReport(runId, started, Instant.now(), results, skipped, aborted);
        log.info("-------- DCV: Finished run {}: {} of {} validated --------",
                runId, report.getValidatedCount(), results.size());
        return report;
    }
}
