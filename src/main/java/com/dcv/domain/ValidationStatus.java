package com.dcv.domain;

import java.util.List;

/**
 * One validation track (OV or EV) as reported by the certificate authority.
 *
 * @param type      Validation type, <i>ov</i> or <i>ev</i>.
 * @param status    Validation status, <i>active</i> once validated.
 * @param dcvStatus Domain control validation status, <i>complete</i> once validated.
 */
public record ValidationStatus(String type, String status, String dcvStatus) {
    public static final String OV = "ov";
    public static final String EV = "ev";

    /**
     * Checks if this track is validated.
     *
     * @return Boolean.
     */
    public boolean isComplete() {
        return "active".equals(status) && "complete".equals(dcvStatus);
    }

    /**
     * Checks if both OV and EV tracks are present and validated.
     *
     * @param validations List of ValidationStatus, may be null.
     * @return Boolean.
     */
    public static boolean isValidated(List<ValidationStatus> validations) {
        ValidationStatus ov = find(validations, OV);
        ValidationStatus ev = find(validations, EV);
        return ov != null && ov.isComplete() && ev != null && ev.isComplete();
    }

    /**
     * Finds the track of given type.
     *
     * @param validations List of ValidationStatus, may be null.
     * @param type        Validation type.
     * @return ValidationStatus or null.
     */
    public static ValidationStatus find(List<ValidationStatus> validations, String type) {
        if (validations == null) {
            return null;
        }
        for (ValidationStatus validation : validations) {
            if (type.equalsIgnoreCase(validation.type())) {
                return validation;
            }
        }
        return null;
    }
}
