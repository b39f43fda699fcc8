package com.dcv.validation;

import com.dcv.api.ApiException;
import com.dcv.digicert.CertificateAuthorityClient;
import com.dcv.domain.Domain;
import com.dcv.ultradns.DnsProviderClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Resolves the domains of a run.
 *
 * <p>Exactly one source is used per run:
 * <ul>
 *     <li>Explicit names: looked up individually, validated regardless of expiration.</li>
 *     <li>File: matched against the full domain list, unmatched names are warned and skipped,
 *     the rest filtered by expiration.</li>
 *     <li>Expiration query: all domains filtered by expiration.</li>
 * </ul>
 */
public class DomainSource {
    private static final Logger log = LogManager.getLogger(DomainSource.class);

    private final CertificateAuthorityClient ca;
    private final DnsProviderClient dns;
    private final ExpirationSelector selector;

    /**
     * Constructs a new DomainSource instance.
     *
     * @param ca       Certificate authority client.
     * @param dns      Authenticated DNS provider client.
     * @param selector ExpirationSelector instance.
     */
    public DomainSource(CertificateAuthorityClient ca, DnsProviderClient dns, ExpirationSelector selector) {
        this.ca = ca;
        this.dns = dns;
        this.selector = selector;
    }

    /**
     * Resolves candidates for given request.
     *
     * @param request RunRequest instance.
     * @return Candidates.
     * @throws ApiException On certificate authority or DNS provider failure.
     * @throws IOException  Unable to read the domain file.
     */
    public Candidates resolve(RunRequest request) throws ApiException, IOException {
        if (!request.domainNames().isEmpty()) {
            return fromNames(request.domainNames(), request.checkZones());
        }
        if (request.file() != null) {
            return fromFile(request);
        }

        List<Domain> expiring = selector.selectExpiring(ca.listDomains(), request.horizonDays());
        return new Candidates(expiring, Map.of());
    }

    private Candidates fromNames(List<String> names, boolean checkZones) throws ApiException {
        List<Domain> domains = new ArrayList<>();
        Map<String, String> skipped = new LinkedHashMap<>();

        for (String name : names) {
            List<Domain> found = ca.findDomains(name);
            if (found.isEmpty()) {
                log.warn("Domain {} not found in DigiCert", name);
                skipped.put(name, "Domain not found in DigiCert.");
                continue;
            }

            Domain domain = found.get(0);
            if (checkZones && !dns.zoneExists(domain.getName())) {
                log.warn("DNS zone {} not found in UltraDNS", domain.getName());
                skipped.put(name, "DNS zone not found in UltraDNS.");
                continue;
            }

            domains.add(domain);
        }

        return new Candidates(domains, skipped);
    }

    private Candidates fromFile(RunRequest request) throws ApiException, IOException {
        Set<String> names = DomainFile.read(request.file());
        log.info("Read {} domain names from {}", names.size(), request.file());

        List<Domain> matched = new ArrayList<>();
        for (Domain domain : ca.listDomains()) {
            if (names.remove(domain.getName().toLowerCase(Locale.ROOT))) {
                matched.add(domain);
            }
        }

        Map<String, String> skipped = new LinkedHashMap<>();
        for (String name : names) {
            log.warn("Warning: domain {} not found! Check spelling.", name);
            skipped.put(name, "Domain not found in DigiCert, check spelling.");
        }

        return new Candidates(selector.selectExpiring(matched, request.horizonDays()), skipped);
    }
}
