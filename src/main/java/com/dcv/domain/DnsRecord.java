package com.dcv.domain;

/**
 * Temporary CNAME record proving domain control.
 *
 * @param zone   Zone name.
 * @param label  Record label.
 * @param target Record target, always dot terminated.
 */
public record DnsRecord(String zone, String label, String target) {

    /**
     * Builds the record for a token issued for a domain.
     *
     * @param domain Domain name.
     * @param token  ValidationToken instance.
     * @return DnsRecord.
     */
    public static DnsRecord forToken(String domain, ValidationToken token) {
        return new DnsRecord(domain, token.token(), absolute(token.verificationValue()));
    }

    /**
     * Gets the fully qualified record name.
     *
     * @return String.
     */
    public String fqdn() {
        return label + "." + zone;
    }

    /**
     * Appends the trailing root dot if missing.
     *
     * @param name Host name.
     * @return Dot terminated host name.
     */
    public static String absolute(String name) {
        return name.endsWith(".") ? name : name + ".";
    }
}
