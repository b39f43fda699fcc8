package com.dcv.config;

import org.apache.commons.lang3.StringUtils;

import java.util.Map;

/**
 * UltraDNS REST API configuration.
 *
 * <p>This class provides type safe access to the DNS provider client configuration.
 * <p>Credentials are read from <i>NEU_USERNAME</i> and <i>NEU_PASSWORD</i> when set.
 */
public class UltraDnsConfig extends ConfigFoundation {

    public static final String USERNAME_ENV = "NEU_USERNAME";
    public static final String PASSWORD_ENV = "NEU_PASSWORD";

    /**
     * Constructs a new UltraDnsConfig instance.
     *
     * @param map Configuration map.
     */
    public UltraDnsConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets API base URL.
     *
     * @return Base URL without trailing slash.
     */
    public String getBaseUrl() {
        return StringUtils.removeEnd(getStringProperty("baseUrl", "https://api.ultradns.com"), "/");
    }

    /**
     * Gets username.
     *
     * @return Username or empty string.
     */
    public String getUsername() {
        String env = System.getenv(USERNAME_ENV);
        return StringUtils.isNotBlank(env) ? env : getStringProperty("username", "");
    }

    /**
     * Gets password.
     *
     * @return Password or empty string.
     */
    public String getPassword() {
        String env = System.getenv(PASSWORD_ENV);
        return StringUtils.isNotBlank(env) ? env : getStringProperty("password", "");
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
