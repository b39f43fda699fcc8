package com.dcv.main;

import com.dcv.api.ApiException;
import com.dcv.api.AuthenticationException;
import com.dcv.config.DcvConfig;
import com.dcv.digicert.CertificateAuthorityClient;
import com.dcv.domain.Domain;
import com.dcv.domain.DomainStatus;
import com.dcv.ultradns.DnsProviderClient;
import com.dcv.validation.Confirmation;
import com.dcv.validation.DomainChecker;
import com.dcv.validation.DomainSource;
import com.dcv.validation.DomainValidationWorkflow;
import com.dcv.validation.ExpirationSelector;
import com.dcv.validation.PollingPolicy;
import com.dcv.validation.RunRequest;
import com.dcv.validation.Sleeper;
import com.dcv.validation.ValidationReport;
import com.dcv.validation.ValidationScheduler;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Runs one configured mode.
 *
 * <p>Modes:
 * <ul>
 *     <li><b>check</b> - list domains expiring within <i>numDays</i>.</li>
 *     <li><b>status</b> - show validation state of <i>domain</i>.</li>
 *     <li><b>validate</b> - validate <i>domain</i> regardless of expiration.</li>
 *     <li><b>runall</b> - validate <i>domains</i>, the domains in <i>file</i>, or every expiring domain.</li>
 * </ul>
 * <p>Exit codes are {@link #OK}, {@link #FAILURE} and {@link #AUTH_FAILURE}.
 */
public class Runner {

    /**
     * Run completed or was aborted by the operator.
     */
    public static final int OK = 0;

    /**
     * Invalid configuration or fatal certificate authority failure.
     */
    public static final int FAILURE = 1;

    /**
     * DNS provider login failed.
     */
    public static final int AUTH_FAILURE = 2;

    private final DcvConfig config;
    private final CertificateAuthorityClient ca;
    private final DnsProviderClient dns;
    private final Confirmation confirmation;
    private final ExpirationSelector selector;
    private final Sleeper sleeper;
    private final Logger log;

    /**
     * Constructs a new Runner instance.
     *
     * @param config       DcvConfig instance.
     * @param ca           Certificate authority client.
     * @param dns          DNS provider client, not yet authenticated.
     * @param confirmation Operator confirmation.
     */
    public Runner(DcvConfig config, CertificateAuthorityClient ca, DnsProviderClient dns, Confirmation confirmation) {
        this(config, ca, dns, confirmation, new ExpirationSelector(), Sleeper.SYSTEM);
    }

    /**
     * Constructs a new Runner instance.
     *
     * @param config       DcvConfig instance.
     * @param ca           Certificate authority client.
     * @param dns          DNS provider client, not yet authenticated.
     * @param confirmation Operator confirmation.
     * @param selector     ExpirationSelector instance.
     * @param sleeper      Sleeper between status checks.
     */
    public Runner(DcvConfig config, CertificateAuthorityClient ca, DnsProviderClient dns, Confirmation confirmation,
                  ExpirationSelector selector, Sleeper sleeper) {
        this(config, ca, dns, confirmation, selector, sleeper, LogManager.getLogger(Runner.class));
    }

    /**
     * Constructs a new Runner instance.
     *
     * @param config       DcvConfig instance.
     * @param ca           Certificate authority client.
     * @param dns          DNS provider client, not yet authenticated.
     * @param confirmation Operator confirmation.
     * @param selector     ExpirationSelector instance.
     * @param sleeper      Sleeper between status checks.
     * @param log          Logger for the run.
     */
    public Runner(DcvConfig config, CertificateAuthorityClient ca, DnsProviderClient dns, Confirmation confirmation,
                  ExpirationSelector selector, Sleeper sleeper, Logger log) {
        this.log = log;
        this.config = config;
        this.ca = ca;
        this.dns = dns;
        this.confirmation = confirmation;
        this.selector = selector;
        this.sleeper = sleeper;
    }

    /**
     * Runs the configured mode.
     *
     * @return Exit code.
     */
    public int run() {
        try {
            DcvConfig.Mode mode = config.getMode();
            log.info("Running mode {}", mode.name().toLowerCase(Locale.ROOT));

            return switch (mode) {
                case CHECK -> check();
                case STATUS -> status();
                case VALIDATE -> validate();
                case RUNALL -> runAll();
            };
        } catch (AuthenticationException e) {
            log.error("Authentication failed: {}", e.getMessage());
            return AUTH_FAILURE;
        } catch (ApiException e) {
            log.error("API failure: {}", e.getMessage());
            return FAILURE;
        } catch (IOException e) {
            log.error("Unable to read input: {}", e.getMessage());
            return FAILURE;
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return FAILURE;
        }
    }

    private int check() throws ApiException {
        List<Domain> expiring = new DomainChecker(ca, selector).checkExpiring(config.getNumDays());
        log.info("Check complete, {} domains expiring", expiring.size());
        return OK;
    }

    private int status() throws ApiException {
        String domain = requireDomain();
        Optional<DomainStatus> status;
        try {
            status = new DomainChecker(ca, selector).status(domain);
        } catch (ApiException e) {
            if (e.getKind() != ApiException.Kind.NOT_FOUND) {
                throw e;
            }
            log.info("Domain {} not found in DigiCert", domain);
            return FAILURE;
        }
        if (status.isEmpty()) {
            log.info("Domain {} has no validation status", domain);
        }
        return OK;
    }

    private int validate() throws ApiException, IOException {
        String domain = requireDomain();
        checkRunSettings();
        return report(scheduler().run(RunRequest.explicit(List.of(domain), config.getTimeout()), confirmation));
    }

    private int runAll() throws ApiException, IOException {
        checkRunSettings();
        String file = config.getFile();
        RunRequest request = new RunRequest(
                config.getDomains(),
                StringUtils.isNotBlank(file) ? Path.of(file) : null,
                config.getNumDays(),
                config.getTimeout(),
                false);

        return report(scheduler().run(request, confirmation));
    }

    private ValidationScheduler scheduler() {
        DomainValidationWorkflow workflow = new DomainValidationWorkflow(ca, dns, config.getPollInterval(), sleeper,
                LogManager.getLogger(DomainValidationWorkflow.class));

        return new ValidationScheduler(dns, new DomainSource(ca, dns, selector), workflow,
                config.getRateGateThreshold(), config.getRateGatePermits(),
                LogManager.getLogger(ValidationScheduler.class));
    }

    private int report(ValidationReport report) throws IOException {
        report.log(log);

        String reportFile = config.getReportFile();
        if (StringUtils.isNotBlank(reportFile) && !report.isAborted()) {
            report.writeJson(Path.of(reportFile));
            log.info("Report written to {}", reportFile);
        }
        return OK;
    }

    /**
     * Rejects polling and rate gate settings before anything is dispatched.
     *
     * @throws IllegalArgumentException On invalid settings.
     */
    private void checkRunSettings() {
        new PollingPolicy(config.getTimeout(), config.getPollInterval());
        if (config.getRateGatePermits() <= 0) {
            throw new IllegalArgumentException("rateGate.permits must be positive: " + config.getRateGatePermits());
        }
    }

    private String requireDomain() {
        String domain = config.getDomain();
        if (StringUtils.isBlank(domain)) {
            throw new IllegalArgumentException("domain is required for mode " + config.getMode().name().toLowerCase(Locale.ROOT));
        }
        return domain.trim();
    }
}
