package com.dcv.validation;

import com.dcv.domain.Domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Domains selected for a run, with names that were skipped and why.
 *
 * @param domains Domains to validate.
 * @param skipped Name to reason for entries that will not be validated.
 */
public record Candidates(List<Domain> domains, Map<String, String> skipped) {

    public Candidates {
        domains = List.copyOf(domains);
        skipped = Collections.unmodifiableMap(new LinkedHashMap<>(skipped));
    }

    public boolean isEmpty() {
        return domains.isEmpty();
    }
}
