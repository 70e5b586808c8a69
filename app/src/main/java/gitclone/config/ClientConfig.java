package gitclone.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Properties;

/**
 * Settings for the transport and pack decoder.
 *
 * Values come from {@code git-clone.properties} on the classpath; a JVM system
 * property with the same key takes precedence. Command line options are
 * applied on top through the {@code with*} methods.
 */
public final class ClientConfig {
    public static final String RESOURCE = "/git-clone.properties";

    public static final String USER_AGENT = "gitclone.http.userAgent";
    public static final String CONNECT_TIMEOUT = "gitclone.http.connectTimeoutSeconds";
    public static final String REQUEST_TIMEOUT = "gitclone.http.requestTimeoutSeconds";
    public static final String VERIFY_CHECKSUM = "gitclone.pack.verifyChecksum";

    private final String userAgent;
    private final Duration connectTimeout;
    private final Duration requestTimeout;
    private final boolean verifyPackChecksum;

    public ClientConfig(String userAgent, Duration connectTimeout, Duration requestTimeout,
            boolean verifyPackChecksum) {
        this.userAgent = userAgent;
        this.connectTimeout = connectTimeout;
        this.requestTimeout = requestTimeout;
        this.verifyPackChecksum = verifyPackChecksum;
    }

    public static ClientConfig defaults() {
        return new ClientConfig("git-clone/1.0", Duration.ofSeconds(30), Duration.ofMinutes(5), true);
    }

    /**
     * Loads the bundled properties and applies system property overrides.
     */
    public static ClientConfig load() {
        Properties props = new Properties();
        try (InputStream is = ClientConfig.class.getResourceAsStream(RESOURCE)) {
            if (is != null) {
                props.load(is);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        return fromProperties(props);
    }

    static ClientConfig fromProperties(Properties props) {
        ClientConfig defaults = defaults();
        return new ClientConfig(
                lookup(props, USER_AGENT, defaults.userAgent),
                Duration.ofSeconds(parseLong(props, CONNECT_TIMEOUT, defaults.connectTimeout.getSeconds())),
                Duration.ofSeconds(parseLong(props, REQUEST_TIMEOUT, defaults.requestTimeout.getSeconds())),
                Boolean.parseBoolean(lookup(props, VERIFY_CHECKSUM, String.valueOf(defaults.verifyPackChecksum))));
    }

    private static String lookup(Properties props, String key, String fallback) {
        String value = System.getProperty(key);
        if (value == null) {
            value = props.getProperty(key);
        }
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static long parseLong(Properties props, String key, long fallback) {
        String value = lookup(props, key, String.valueOf(fallback));
        try {
            long parsed = Long.parseLong(value);
            if (parsed <= 0) {
                throw new IllegalArgumentException(key + " must be positive: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }

    public String getUserAgent() {
        return userAgent;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public boolean isVerifyPackChecksum() {
        return verifyPackChecksum;
    }

    public ClientConfig withRequestTimeout(Duration timeout) {
        return new ClientConfig(userAgent, connectTimeout, timeout, verifyPackChecksum);
    }

    public ClientConfig withVerifyPackChecksum(boolean verify) {
        return new ClientConfig(userAgent, connectTimeout, requestTimeout, verify);
    }

    @Override
    public String toString() {
        return "ClientConfig{userAgent=" + userAgent + ", connectTimeout=" + connectTimeout
                + ", requestTimeout=" + requestTimeout + ", verifyPackChecksum=" + verifyPackChecksum + "}";
    }
}
