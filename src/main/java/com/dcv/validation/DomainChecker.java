package com.dcv.validation;

import com.dcv.api.ApiException;
import com.dcv.digicert.CertificateAuthorityClient;
import com.dcv.domain.Domain;
import com.dcv.domain.DomainDetail;
import com.dcv.domain.DomainStatus;
import com.dcv.domain.ValidationStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Optional;

/**
 * Read-only queries against the certificate authority.
 */
public class DomainChecker {
    private static final Logger log = LogManager.getLogger(DomainChecker.class);

    private final CertificateAuthorityClient ca;
    private final ExpirationSelector selector;

    /**
     * Constructs a new DomainChecker instance.
     *
     * @param ca       Certificate authority client.
     * @param selector ExpirationSelector instance.
     */
    public DomainChecker(CertificateAuthorityClient ca, ExpirationSelector selector) {
        this.ca = ca;
        this.selector = selector;
    }

    /**
     * Lists domains expiring within given days.
     *
     * @param horizonDays Days from now.
     * @return List of Domain.
     * @throws ApiException On certificate authority failure.
     */
    public List<Domain> checkExpiring(int horizonDays) throws ApiException {
        List<Domain> expiring = selector.selectExpiring(ca.listDomains(), horizonDays);

        log.info("{} domains expiring in the next {} days", expiring.size(), horizonDays);
        for (Domain domain : expiring) {
            log.info("Domain: {}, Expiration: {}", domain.getName(), domain.getEarliestExpiration()
                    .map(String::valueOf)
                    .orElse("none, must be a new domain"));
        }

        return expiring;
    }

    /**
     * Gets current validation state of a domain.
     *
     * @param name FQDN.
     * @return Optional of DomainStatus, empty if the domain was never validated.
     * @throws ApiException NOT_FOUND if the domain is unknown, DATA if no validation tracks are reported.
     */
    public Optional<DomainStatus> status(String name) throws ApiException {
        List<Domain> found = ca.findDomains(name);
        if (found.isEmpty()) {
            throw new ApiException(ApiException.Kind.NOT_FOUND, "Domain " + name + " not found in DigiCert");
        }

        DomainDetail detail = ca.getDomainDetail(found.get(0).getId());
        Domain domain = detail.domain();
        if (domain.getExpiration().isEmpty()) {
            log.info("Domain {} has no expiration, it has likely never been validated", name);
            return Optional.empty();
        }
        if (detail.validations() == null) {
            throw new ApiException(ApiException.Kind.DATA, "No validations returned for domain " + name);
        }

        ValidationStatus ov = ValidationStatus.find(detail.validations(), ValidationStatus.OV);
        ValidationStatus ev = ValidationStatus.find(detail.validations(), ValidationStatus.EV);
        DomainStatus status = new DomainStatus(
                domain.getName(),
                ov != null ? ov.status() : null,
                ev != null ? ev.status() : null,
                domain.getExpiration().get().ov());

        log.info("Domain: {}, DCV status: {}, OV expiration: {}",
                status.name(), status.getDcvStatus(), status.ovExpiration());
        return Optional.of(status);
    }
}
