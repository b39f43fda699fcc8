package com.dcv.domain;

/**
 * Outcome of one domain validation workflow run.
 *
 * <p>Immutable, assembled through {@link Builder} while the workflow advances.
 * <p><i>valid</i> is true only when the certificate authority confirmed both OV and EV tracks.
 * <br><i>cleanedUp</i> reflects removal of the temporary DNS record, independent of <i>valid</i>.
 */
public class ValidationResult {
    public static final String SUCCESS = "Success";

    private final String domainName;
    private final boolean valid;
    private final boolean cleanedUp;
    private final String message;

    private ValidationResult(Builder builder) {
        this.domainName = builder.domainName;
        this.valid = builder.valid;
        this.cleanedUp = builder.cleanedUp;
        this.message = builder.message;
    }

    /**
     * Constructs a failed result with given message.
     *
     * @param domainName FQDN.
     * @param message    Failure message.
     * @return ValidationResult.
     */
    public static ValidationResult failed(String domainName, String message) {
        return builder(domainName).message(message).build();
    }

    /**
     * Gets a builder initialized with the workflow defaults.
     *
     * @param domainName FQDN.
     * @return Builder.
     */
    public static Builder builder(String domainName) {
        return new Builder(domainName);
    }

    public String getDomainName() {
        return domainName;
    }

    public boolean isValid() {
        return valid;
    }

    public boolean isCleanedUp() {
        return cleanedUp;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "ValidationResult{domainName=" + domainName + ", valid=" + valid + ", cleanedUp=" + cleanedUp + ", message=" + message + "}";
    }

    /**
     * Builder for ValidationResult.
     * <p>Defaults are <i>valid=false, cleanedUp=false, message=Success</i>.
     */
    public static class Builder {
        private final String domainName;
        private boolean valid = false;
        private boolean cleanedUp = false;
        private String message = SUCCESS;

        private Builder(String domainName) {
            this.domainName = domainName;
        }

        public Builder valid(boolean valid) {
            this.valid = valid;
            return this;
        }

        public Builder cleanedUp(boolean cleanedUp) {
            this.cleanedUp = cleanedUp;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public String getMessage() {
            return message;
        }

        public ValidationResult build() {
            return new ValidationResult(this);
        }
    }
}
