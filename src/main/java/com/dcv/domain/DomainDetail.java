package com.dcv.domain;

import java.util.List;

/**
 * Domain snapshot with its current validation tracks.
 *
 * @param domain      Domain instance.
 * @param validations Validation tracks, null when the certificate authority reported none.
 */
public record DomainDetail(Domain domain, List<ValidationStatus> validations) {
}
