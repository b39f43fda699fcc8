package com.dcv.domain;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * Domain registered with the certificate authority.
 *
 * <p>Read-only snapshot as returned by the certificate authority.
 * <br>A domain without expiration has never been validated.
 */
public class Domain {
    private final String id;
    private final String name;
    private final DcvMethod dcvMethod;
    private final DcvExpiration expiration;

    /**
     * Constructs a new Domain instance.
     *
     * @param id         Certificate authority identifier.
     * @param name       FQDN.
     * @param dcvMethod  Current validation method.
     * @param expiration Expiration dates or null if never validated.
     */
    public Domain(String id, String name, DcvMethod dcvMethod, DcvExpiration expiration) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.dcvMethod = dcvMethod != null ? dcvMethod : DcvMethod.OTHER;
        this.expiration = expiration != null && expiration.earliest().isPresent() ? expiration : null;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public DcvMethod getDcvMethod() {
        return dcvMethod;
    }

    /**
     * Gets expiration dates.
     *
     * @return Optional of DcvExpiration, empty if the domain was never validated.
     */
    public Optional<DcvExpiration> getExpiration() {
        return Optional.ofNullable(expiration);
    }

    /**
     * Gets the earliest of the OV and EV expiration dates.
     *
     * @return Optional of LocalDate.
     */
    public Optional<LocalDate> getEarliestExpiration() {
        return getExpiration().flatMap(DcvExpiration::earliest);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Domain)) return false;
        Domain domain = (Domain) o;
        return id.equals(domain.id) && name.equals(domain.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name);
    }

    @Override
    public String toString() {
        return "Domain{id=" + id + ", name=" + name + ", dcvMethod=" + dcvMethod.getValue() + ", expiration=" + expiration + "}";
    }
}
