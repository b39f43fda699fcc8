package com.dcv.domain;

import java.time.LocalDate;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * OV and EV validation expiration dates of a domain.
 * <p>Either date may be absent.
 */
public record DcvExpiration(LocalDate ov, LocalDate ev) {

    /**
     * Gets the earliest of the two dates.
     *
     * @return Optional of LocalDate, empty when neither date is known.
     */
    public Optional<LocalDate> earliest() {
        return Stream.of(ov, ev)
                .filter(date -> date != null)
                .min(LocalDate::compareTo);
    }
}
