package com.dcv.validation;

import java.nio.file.Path;
import java.util.List;

/**
 * Parameters of one scheduler run.
 *
 * <p>The domain set comes from exactly one source with precedence:
 * explicit names, then file, then the expiration query.
 *
 * @param domainNames    Explicit FQDN list, validated regardless of expiration.
 * @param file           Domain list file or null.
 * @param horizonDays    Days till a validation is considered expiring soon.
 * @param timeoutSeconds Seconds to wait for validation per domain.
 * @param checkZones     Skip explicit domains whose DNS zone is not hosted by the provider.
 */
public record RunRequest(List<String> domainNames, Path file, int horizonDays, int timeoutSeconds, boolean checkZones) {

    public RunRequest {
        domainNames = domainNames != null ? List.copyOf(domainNames) : List.of();
    }

    /**
     * Request validating all domains expiring within horizon.
     *
     * @param horizonDays    Days.
     * @param timeoutSeconds Seconds.
     * @return RunRequest.
     */
    public static RunRequest expiring(int horizonDays, int timeoutSeconds) {
        return new RunRequest(List.of(), null, horizonDays, timeoutSeconds, false);
    }

    /**
     * Request validating given domains regardless of expiration.
     *
     * @param domainNames    FQDN list.
     * @param timeoutSeconds Seconds.
     * @return RunRequest.
     */
    public static RunRequest explicit(List<String> domainNames, int timeoutSeconds) {
        return new RunRequest(domainNames, null, 0, timeoutSeconds, true);
    }
}
