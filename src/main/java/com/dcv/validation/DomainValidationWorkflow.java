package com.dcv.validation;

import com.dcv.api.ApiException;
import com.dcv.digicert.CertificateAuthorityClient;
import com.dcv.domain.DcvMethod;
import com.dcv.domain.DnsRecord;
import com.dcv.domain.Domain;
import com.dcv.domain.ValidationResult;
import com.dcv.domain.ValidationStatus;
import com.dcv.domain.ValidationToken;
import com.dcv.ultradns.DnsProviderClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Validates a single domain.
 *
 * <p>Phases run strictly in order:
 * <ol>
 *     <li>Switch the DCV method to <i>dns-cname-token</i> if needed.</li>
 *     <li>Submit for OV and EV validation and obtain a token pair.</li>
 *     <li>Create the CNAME record <i>token.domain</i> pointing to the verification value.</li>
 *     <li>Poll the certificate authority until validated or the polling budget is spent.</li>
 *     <li>Delete the CNAME record.</li>
 * </ol>
 * <p>Failures before the record exists end the run without DNS side effects.
 * <br>Once the record exists its deletion is always attempted exactly once, whatever the polling outcome.
 * <p>API calls are never retried. Every run ends with exactly one {@link ValidationResult}.
 *
 * @see PollingPolicy
 */
public class DomainValidationWorkflow {

    static final String ZERO_TIMEOUT_MESSAGE = "Timeout is 0, not checking statuses, verify validation and clean up DNS manually.";

    private final CertificateAuthorityClient ca;
    private final DnsProviderClient dns;
    private final int pollIntervalSeconds;
    private final Sleeper sleeper;
    private final Logger log;

    /**
     * Constructs a new DomainValidationWorkflow instance.
     *
     * @param ca                  Certificate authority client.
     * @param dns                 Authenticated DNS provider client.
     * @param pollIntervalSeconds Seconds between status checks.
     */
    public DomainValidationWorkflow(CertificateAuthorityClient ca, DnsProviderClient dns, int pollIntervalSeconds) {
        this(ca, dns, pollIntervalSeconds, Sleeper.SYSTEM, LogManager.getLogger(DomainValidationWorkflow.class));
    }

    /**
     * Constructs a new DomainValidationWorkflow instance.
     *
     * @param ca                  Certificate authority client.
     * @param dns                 Authenticated DNS provider client.
     * @param pollIntervalSeconds Seconds between status checks.
     * @param sleeper             Sleeper between status checks.
     * @param log                 Logger for the run.
     */
    public DomainValidationWorkflow(CertificateAuthorityClient ca, DnsProviderClient dns, int pollIntervalSeconds,
                                    Sleeper sleeper, Logger log) {
        this.ca = ca;
        this.dns = dns;
        this.pollIntervalSeconds = pollIntervalSeconds;
        this.sleeper = sleeper;
        this.log = log;
    }

    /**
     * Validates domain.
     *
     * @param domain         Domain instance.
     * @param timeoutSeconds Total seconds to wait for validation, 0 to skip checking.
     * @return ValidationResult.
     */
    public ValidationResult validate(Domain domain, int timeoutSeconds) {
        PollingPolicy policy = new PollingPolicy(timeoutSeconds, pollIntervalSeconds);
        ValidationResult.Builder result = ValidationResult.builder(domain.getName());

        // Method check.
        if (domain.getDcvMethod() != DcvMethod.DNS_CNAME_TOKEN) {
            log.info("Changing DCV method to {} for domain {}", DcvMethod.DNS_CNAME_TOKEN.getValue(), domain.getName());
            try {
                ca.changeValidationMethod(domain.getId(), DcvMethod.DNS_CNAME_TOKEN);
            } catch (ApiException e) {
                log.error("DCV method change failed for {}: {}", domain.getName(), e.getMessage());
                return result.message(e.getMessage()).build();
            }
            log.info("DCV method updated for domain {}", domain.getName());
        }

        // Token submit.
        ValidationToken token;
        try {
            token = ca.submitForValidation(domain.getId());
        } catch (ApiException e) {
            log.error("Submit for validation failed for {}: {}", domain.getName(), e.getMessage());
            return result.message(e.getMessage()).build();
        }
        log.info("Submitted {} for validation", domain.getName());

        // Record create.
        DnsRecord record = DnsRecord.forToken(domain.getName(), token);
        try {
            dns.createCname(record.zone(), record.label(), record.target());
        } catch (ApiException e) {
            log.error("CNAME creation failed for {}: {}", domain.getName(), e.getMessage());
            return result.message(e.getMessage()).build();
        }
        log.info("CNAME: {} created", record.fqdn());

        // Polling.
        boolean valid = false;
        try {
            valid = poll(domain, policy, result);
        } catch (RuntimeException e) {
            log.error("Polling failed for {}: {}", domain.getName(), e.getMessage(), e);
            result.message("Polling failed: " + e.getMessage());
        }
        result.valid(valid);

        if (valid) {
            log.info("Domain {} successfully validated!", domain.getName());
        } else {
            log.error("Error, {} was not validated", domain.getName());
        }

        // Cleanup.
        cleanup(record, result);

        return result.build();
    }

    /**
     * Polls the certificate authority for validation.
     *
     * @param domain Domain instance.
     * @param policy PollingPolicy instance.
     * @param result Result builder, receives the outcome message.
     * @return True if both OV and EV are validated.
     */
    private boolean poll(Domain domain, PollingPolicy policy, ValidationResult.Builder result) {
        if (policy.isDisabled()) {
            log.warn("Not checking validation status of {}", domain.getName());
            result.message(ZERO_TIMEOUT_MESSAGE);
            return false;
        }

        log.info("Beginning check validation period for {}: {} checks over {}s",
                domain.getName(), policy.getMaxAttempts(), policy.getTimeoutSeconds());

        String lastError = null;
        for (int attempt = 1; attempt <= policy.getMaxAttempts(); attempt++) {
            try {
                sleeper.sleep(policy.getWaitBefore(attempt));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting on {}", domain.getName());
                result.message("Interrupted while waiting for validation.");
                return false;
            }

            log.info("Checking {} for validation, attempt #{}", domain.getName(), attempt);
            try {
                List<ValidationStatus> validations = ca.checkValidationStatus(domain.getId());
                if (ValidationStatus.isValidated(validations)) {
                    return true;
                }
                log.debug("Domain {} not validated yet: {}", domain.getName(), validations);
            } catch (ApiException e) {
                // DigiCert may briefly report no validations right after a submit.
                log.warn("Check for validation failed on domain {}, treating as not validated: {}", domain.getName(), e.getMessage());
                lastError = e.getMessage();
            }
        }

        log.warn("Giving up on {} after {} checks", domain.getName(), policy.getMaxAttempts());
        String message = "Not validated after " + policy.getMaxAttempts() + " check(s) within " + policy.getTimeoutSeconds() + "s.";
        result.message(lastError != null ? message + " Last error: " + lastError : message);
        return false;
    }

    /**
     * Deletes the CNAME record.
     * <p>A record already absent counts as cleaned up.
     *
     * @param record DnsRecord instance.
     * @param result Result builder.
     */
    private void cleanup(DnsRecord record, ValidationResult.Builder result) {
        try {
            dns.deleteCname(record.zone(), record.label());
            result.cleanedUp(true);
            log.info("DNS for {} cleaned up", record.zone());
        } catch (ApiException e) {
            if (e.getKind() == ApiException.Kind.NOT_FOUND) {
                result.cleanedUp(true);
                log.warn("CNAME {} was already absent", record.fqdn());
                return;
            }

            log.error("Error, {} was not cleaned up: {}", record.fqdn(), e.getMessage());
            appendMessage(result, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Error, {} was not cleaned up: {}", record.fqdn(), e.getMessage(), e);
            appendMessage(result, "Cleanup failed: " + e.getMessage());
        }
    }

    /**
     * Records a cleanup failure without losing an earlier outcome message.
     *
     * @param result  Result builder.
     * @param message Failure message.
     */
    private static void appendMessage(ValidationResult.Builder result, String message) {
        String current = result.getMessage();
        result.message(ValidationResult.SUCCESS.equals(current) ? message : current + " " + message);
    }
}
