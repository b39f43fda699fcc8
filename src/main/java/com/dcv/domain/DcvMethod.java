package com.dcv.domain;

import java.util.Locale;

/**
 * Domain control validation methods known to the certificate authority.
 */
public enum DcvMethod {
    EMAIL("email"),
    DNS_CNAME_TOKEN("dns-cname-token"),
    DNS_TXT_TOKEN("dns-txt-token"),
    HTTP_TOKEN("http-token"),
    OTHER("other");

    private final String value;

    DcvMethod(String value) {
        this.value = value;
    }

    /**
     * Gets wire value.
     *
     * @return String.
     */
    public String getValue() {
        return value;
    }

    /**
     * Maps a wire value to a method.
     * <p>Unknown or missing values map to {@link #OTHER}.
     *
     * @param value Wire value.
     * @return DcvMethod.
     */
    public static DcvMethod fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (DcvMethod method : values()) {
                if (method.value.equals(normalized)) {
                    return method;
                }
            }
        }
        return OTHER;
    }
}
