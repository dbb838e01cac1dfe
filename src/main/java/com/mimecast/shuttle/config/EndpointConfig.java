package com.mimecast.shuttle.config;

import org.apache.commons.lang3.StringUtils;

import javax.naming.ConfigurationException;
import java.util.Map;

/**
 * IMAP endpoint configuration.
 *
 * <p>This class provides type safe access to one mail account, source or destination.
 * <p>The backing map is copied on construction and never mutated afterward,
 * <br>so an instance can be handed to every session opened during a run.
 *
 * <p>Keys:
 * <ul>
 *     <li><b>host</b> - IMAP server host name (required).</li>
 *     <li><b>user</b> - Login name.</li>
 *     <li><b>pass</b> - Login password.</li>
 *     <li><b>port</b> - Port, defaults to 993 with TLS and 143 without.</li>
 *     <li><b>ssl</b> - Implicit TLS, default true.</li>
 *     <li><b>trustAll</b> - Accept any server certificate, default false.</li>
 *     <li><b>connectTimeout</b> - Connect timeout in seconds, default 10.</li>
 *     <li><b>timeout</b> - Socket read timeout in seconds, default 20.</li>
 * </ul>
 */
public class EndpointConfig extends ConfigFoundation {

    /**
     * Constructs a new EndpointConfig instance.
     *
     * @param map Configuration map.
     */
    public EndpointConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Validates required keys and numeric bounds.
     *
     * @param role Endpoint role used in the error message, e.g. "source".
     * @return Self.
     * @throws ConfigurationException Host missing, or port or timeouts invalid.
     */
    public EndpointConfig validate(String role) throws ConfigurationException {
        if (StringUtils.isBlank(getHost())) {
            throw new ConfigurationException("Missing " + role + ".host in configuration");
        }
        try {
            getIntProperty("port", isSsl() ? 993 : 143, 1, 65535);
            getIntProperty("connectTimeout", 10, 0, Integer.MAX_VALUE);
            getIntProperty("timeout", 20, 0, Integer.MAX_VALUE);
        } catch (ConfigurationException e) {
            throw new ConfigurationException("Invalid " + role + " endpoint: " + e.getExplanation());
        }
        return this;
    }

    /**
     * Gets host.
     *
     * @return Host string.
     */
    public String getHost() {
        return getStringProperty("host");
    }

    /**
     * Gets username.
     *
     * @return Username string.
     */
    public String getUser() {
        return getStringProperty("user", "");
    }

    /**
     * Gets password.
     *
     * @return Password string.
     */
    public String getPass() {
        return getStringProperty("pass", "");
    }

    /**
     * Checks if implicit TLS is enabled.
     *
     * @return Boolean.
     */
    public boolean isSsl() {
        return getBooleanProperty("ssl", true);
    }

    /**
     * Checks if any server certificate should be accepted.
     *
     * @return Boolean.
     */
    public boolean isTrustAll() {
        return getBooleanProperty("trustAll", false);
    }

    /**
     * Checks if a port was configured explicitly.
     *
     * @return Boolean.
     */
    public boolean hasPort() {
        return hasProperty("port");
    }

    /**
     * Gets port, falling back to the protocol default.
     *
     * @return Port number.
     */
    public int getPort() {
        return Math.toIntExact(getLongProperty("port", isSsl() ? 993L : 143L));
    }

    /**
     * Gets connect timeout in seconds.
     *
     * @return Timeout in seconds.
     */
    public int getConnectTimeout() {
        return Math.toIntExact(getLongProperty("connectTimeout", 10L));
    }

    /**
     * Gets socket read timeout in seconds.
     *
     * @return Timeout in seconds.
     */
    public int getTimeout() {
        return Math.toIntExact(getLongProperty("timeout", 20L));
    }

    /**
     * Printable form without credentials.
     *
     * @return String.
     */
    @Override
    public String toString() {
        return getUser() + "@" + getHost() + ":" + (hasPort() ? String.valueOf(getPort()) : "default")
                + (isSsl() ? " (ssl)" : "");
    }
}
