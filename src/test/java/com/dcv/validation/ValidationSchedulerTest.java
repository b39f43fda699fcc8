package com.dcv.validation;

import com.dcv.api.AuthenticationException;
import com.dcv.digicert.CertificateAuthorityClient;
import com.dcv.domain.DcvMethod;
import com.dcv.domain.Domain;
import com.dcv.domain.ValidationResult;
import com.dcv.ultradns.DnsProviderClient;
import org.apache.logging.log4j.LogManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ValidationSchedulerTest {

    @Mock
    private CertificateAuthorityClient ca;

    @Mock
    private DnsProviderClient dns;

    @Mock
    private DomainValidationWorkflow workflow;

    private ValidationScheduler scheduler;
    private AutoCloseable closeable;

    @BeforeEach
    void setUp() {
        closeable = MockitoAnnotations.openMocks(this);
        scheduler = new ValidationScheduler(dns, new DomainSource(ca, dns, new ExpirationSelector()), workflow,
                RateGate.DEFAULT_THRESHOLD, RateGate.DEFAULT_PERMITS, LogManager.getLogger(ValidationSchedulerTest.class));
    }

    @AfterEach
    void tearDown() throws Exception {
        closeable.close();
    }

    private static List<Domain> domains(int count) {
        List<Domain> domains = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            domains.add(new Domain(String.valueOf(i), "d" + i + ".example.com", DcvMethod.DNS_CNAME_TOKEN, null));
        }
        return domains;
    }

    private static ValidationResult success(Domain domain) {
        return ValidationResult.builder(domain.getName()).valid(true).cleanedUp(true).build();
    }

    @Test
    void rateGateCapsConcurrency() {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        AtomicInteger poolSize = new AtomicInteger();

        // Pool as wide as the run, so only the gate bounds concurrency.
        scheduler = new ValidationScheduler(dns, new DomainSource(ca, dns, new ExpirationSelector()), workflow,
                RateGate.DEFAULT_THRESHOLD, RateGate.DEFAULT_PERMITS, LogManager.getLogger(ValidationSchedulerTest.class),
                size -> {
                    poolSize.set(size);
                    return Executors.newFixedThreadPool(45);
                });

        when(workflow.validate(any(Domain.class), anyInt())).thenAnswer(invocation -> {
            int now = running.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            Thread.sleep(50);
            running.decrementAndGet();
            return success(invocation.getArgument(0));
        });

        List<ValidationResult> results = scheduler.runAll(domains(45), 60);

        assertEquals(45, results.size());
        assertEquals(RateGate.DEFAULT_PERMITS, poolSize.get());
        assertTrue(peak.get() <= RateGate.DEFAULT_PERMITS, "Peak concurrency was " + peak.get());
        assertTrue(peak.get() > 1, "Workflows should overlap, peak was " + peak.get());
        assertTrue(results.stream().allMatch(ValidationResult::isValid));
    }

    @Test
    void belowThresholdRunsAllAtOnce() {
        int count = 39;
        CountDownLatch latch = new CountDownLatch(count);

        when(workflow.validate(any(Domain.class), anyInt())).thenAnswer(invocation -> {
            latch.countDown();
            boolean together = latch.await(5, TimeUnit.SECONDS);
            return ValidationResult.builder(((Domain) invocation.getArgument(0)).getName()).valid(together).build();
        });

        List<ValidationResult> results = scheduler.runAll(domains(count), 60);

        assertEquals(count, results.size());
        assertTrue(results.stream().allMatch(ValidationResult::isValid), "All workflows should run concurrently");
    }

    @Test
    void failureIsolatedToOneDomain() {
        List<Domain> domains = domains(3);
        when(workflow.validate(any(Domain.class), anyInt())).thenAnswer(invocation -> {
            Domain domain = invocation.getArgument(0);
            if (domain.getId().equals("1")) {
                throw new IllegalStateException("boom");
            }
            return success(domain);
        });

        List<ValidationResult> results = scheduler.runAll(domains, 60);

        assertEquals(3, results.size());
        Set<String> names = results.stream().map(ValidationResult::getDomainName).collect(Collectors.toSet());
        assertEquals(Set.of("d0.example.com", "d1.example.com", "d2.example.com"), names);

        ValidationResult failed = results.stream()
                .filter(result -> result.getDomainName().equals("d1.example.com"))
                .findFirst()
                .orElseThrow();
        assertFalse(failed.isValid());
        assertFalse(failed.isCleanedUp());
        assertEquals("Unexpected error: boom", failed.getMessage());
        assertEquals(2, results.stream().filter(ValidationResult::isValid).count());
    }

    @Test
    void authenticationFailureAbortsBeforeDispatch() throws Exception {
        doThrow(new AuthenticationException("UltraDNS login failed: HTTP 401", 401)).when(dns).authenticate();

        assertThrows(AuthenticationException.class,
                () -> scheduler.run(RunRequest.expiring(90, 60), Confirmation.ASSUME_YES));

        verifyNoInteractions(ca, workflow);
    }

    @Test
    void declinedConfirmationHasNoSideEffects() throws Exception {
        when(ca.listDomains()).thenReturn(domains(2));

        ValidationReport report = scheduler.run(RunRequest.expiring(90, 60), candidates -> false);

        assertTrue(report.isAborted());
        assertTrue(report.getResults().isEmpty());
        verifyNoInteractions(workflow);
        verify(dns, never()).createCname(anyString(), anyString(), anyString());
    }

    @Test
    void noCandidates() throws Exception {
        when(ca.listDomains()).thenReturn(List.of());
        Confirmation confirmation = mock(Confirmation.class);

        ValidationReport report = scheduler.run(RunRequest.expiring(90, 60), confirmation);

        assertFalse(report.isAborted());
        assertTrue(report.getResults().isEmpty());
        verifyNoInteractions(confirmation, workflow);
    }

    @Test
    void runReportsEveryDomain() throws Exception {
        List<Domain> domains = domains(3);
        when(ca.findDomains(anyString())).thenAnswer(invocation -> domains.stream()
                .filter(domain -> domain.getName().equals(invocation.getArgument(0)))
                .collect(Collectors.toList()));
        when(dns.zoneExists(anyString())).thenReturn(true);
        when(workflow.validate(any(Domain.class), anyInt())).thenAnswer(invocation -> success(invocation.getArgument(0)));

        ValidationReport report = scheduler.run(
                RunRequest.explicit(List.of("d0.example.com", "d2.example.com", "missing.example.com"), 60),
                Confirmation.ASSUME_YES);

        verify(dns).authenticate();
        assertEquals(2, report.getResults().size());
        assertEquals(2, report.getValidatedCount());
        assertEquals(2, report.getCleanedUpCount());
        assertEquals("Domain not found in DigiCert.", report.getSkipped().get("missing.example.com"));
        assertNotNull(report.getRunId());
        assertFalse(report.getFinished().isBefore(report.getStarted()));
    }
}
