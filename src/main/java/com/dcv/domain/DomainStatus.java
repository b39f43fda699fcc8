package com.dcv.domain;

import java.time.LocalDate;

/**
 * Current validation state of a single domain.
 *
 * @param name          FQDN.
 * @param ovStatus      OV validation status.
 * @param evStatus      EV validation status.
 * @param ovExpiration  OV validation expiration.
 */
public record DomainStatus(String name, String ovStatus, String evStatus, LocalDate ovExpiration) {

    /**
     * Gets combined status string.
     *
     * @return String as <i>ov/ev</i>.
     */
    public String getDcvStatus() {
        return ovStatus + "/" + evStatus;
    }
}
