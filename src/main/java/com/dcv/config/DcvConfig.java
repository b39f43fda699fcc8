package com.dcv.config;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Run configuration.
 *
 * <p>This class provides type safe access to <i>dcv.json5</i>.
 * <p>It also maps the certificate authority and DNS provider sections to their own config objects.
 *
 * @see DigiCertConfig
 * @see UltraDnsConfig
 */
public class DcvConfig extends ConfigFoundation {

    /**
     * Run modes.
     */
    public enum Mode {
        CHECK,
        STATUS,
        VALIDATE,
        RUNALL
    }

    /**
     * Constructs a new empty DcvConfig instance.
     */
    public DcvConfig() {
        super();
    }

    /**
     * Constructs a new DcvConfig instance.
     *
     * @param map Configuration map.
     */
    public DcvConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new DcvConfig instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public DcvConfig(String path) throws IOException {
        super(path);
    }

    /**
     * Gets run mode.
     *
     * @return Mode.
     */
    public Mode getMode() {
        return Mode.valueOf(getStringProperty("mode", "runall").trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Gets number of days till a validation is considered expiring soon.
     *
     * @return Days.
     */
    public int getNumDays() {
        return Math.toIntExact(getLongProperty("numDays", 90L));
    }

    /**
     * Gets total seconds to wait for the certificate authority to confirm a validation.
     *
     * @return Seconds.
     */
    public int getTimeout() {
        return Math.toIntExact(getLongProperty("timeout", 180L));
    }

    /**
     * Gets seconds between validation status checks.
     *
     * @return Seconds.
     */
    public int getPollInterval() {
        return Math.toIntExact(getLongProperty("pollInterval", 60L));
    }

    /**
     * Gets single domain name for status and validate modes.
     *
     * @return FQDN or null.
     */
    public String getDomain() {
        return getStringProperty("domain");
    }

    /**
     * Gets explicit domain names to validate.
     *
     * @return List of FQDN.
     */
    public List<String> getDomains() {
        List<String> domains = new ArrayList<>();
        for (Object entry : getListProperty("domains")) {
            if (entry != null) {
                domains.add(String.valueOf(entry).trim());
            }
        }
        return domains;
    }

    /**
     * Gets path to file listing domains, one per line.
     *
     * @return Path or null.
     */
    public String getFile() {
        return getStringProperty("file");
    }

    /**
     * Skip the confirmation prompt.
     *
     * @return Boolean.
     */
    public boolean isAssumeYes() {
        return getBooleanProperty("assumeYes", false);
    }

    /**
     * Gets path to write the JSON run report to.
     *
     * @return Path or null.
     */
    public String getReportFile() {
        return getStringProperty("reportFile");
    }

    /**
     * Gets domain count from which the rate gate is engaged.
     *
     * @return Threshold.
     */
    public int getRateGateThreshold() {
        return Math.toIntExact(getLongProperty("rateGate.threshold", 40L));
    }

    /**
     * Gets maximum concurrent workflows once the rate gate is engaged.
     *
     * @return Permits.
     */
    public int getRateGatePermits() {
        return Math.toIntExact(getLongProperty("rateGate.permits", 20L));
    }

    /**
     * Gets certificate authority configuration.
     *
     * @return DigiCertConfig.
     */
    public DigiCertConfig getDigiCert() {
        return new DigiCertConfig(getMapProperty("digicert"));
    }

    /**
     * Gets DNS provider configuration.
     *
     * @return UltraDnsConfig.
     */
    public UltraDnsConfig getUltraDns() {
        return new UltraDnsConfig(getMapProperty("ultradns"));
    }
}
