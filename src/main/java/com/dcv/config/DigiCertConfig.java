package com.dcv.config;

import org.apache.commons.lang3.StringUtils;

import java.util.Map;

/**
 * DigiCert Services API configuration.
 *
 * <p>This class provides type safe access to the certificate authority client configuration.
 * <p>The API key is read from the <i>DIGICERT_KEY</i> environment variable when set.
 */
public class DigiCertConfig extends ConfigFoundation {

    /**
     * Environment variable holding the API key.
     */
    public static final String KEY_ENV = "DIGICERT_KEY";

    /**
     * Constructs a new DigiCertConfig instance.
     *
     * @param map Configuration map.
     */
    public DigiCertConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets API base URL.
     *
     * @return Base URL without trailing slash.
     */
    public String getBaseUrl() {
        return StringUtils.removeEnd(getStringProperty("baseUrl", "https://www.digicert.com/services/v2"), "/");
    }

    /**
     * Gets API key.
     *
     * @return API key or empty string.
     */
    public String getKey() {
        String env = System.getenv(KEY_ENV);
        return StringUtils.isNotBlank(env) ? env : getStringProperty("key", "");
    }

    /**
     * Gets connection timeout in seconds.
     *
     * @return Timeout in seconds.
     */
    public int getConnectTimeout() {
        return Math.toIntExact(getLongProperty("connectTimeout", 30L));
    }

    /**
     * Gets read timeout in seconds.
     *
     * @return Timeout in seconds.
     */
    public int getReadTimeout() {
        return Math.toIntExact(getLongProperty("readTimeout", 30L));
    }
}
