package com.repotimeline.collector.config;

import com.repotimeline.collector.client.Platform;
import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration management class that reads environment variables
 * and .env file settings using dotenv-java. Environment variables win over the .env file.
 *
 * <p>Credentials are optional: a platform without one is queried anonymously.</p>
 */
public class AppConfig {

    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);

    static final String HTTP_TIMEOUT_SECONDS = "TIMELINE_HTTP_TIMEOUT_SECONDS";
    static final String CONCURRENCY = "TIMELINE_CONCURRENCY";

    static final int DEFAULT_HTTP_TIMEOUT_SECONDS = 30;
    static final int DEFAULT_CONCURRENCY = 1;
    static final int MAX_CONCURRENCY = 16;

    private final Map<Platform, String> credentials;
    private final Duration httpTimeout;
    private final int concurrency;

    public AppConfig() {
        this(loadFromEnvironment());
    }

    /**
     * Constructor for testing. Accepts values directly, keyed by variable name.
     */
    public AppConfig(Map<String, String> values) {
        Map<Platform, String> resolved = new EnumMap<>(Platform.class);
        for (Platform platform : Platform.values()) {
            String credential = values.get(platform.credentialVariable());
            if (!isBlank(credential)) {
                resolved.put(platform, credential.trim());
            }
        }
        this.credentials = Collections.unmodifiableMap(resolved);

        List<String> invalid = new ArrayList<>();
        int timeoutSeconds = parseInt(values, HTTP_TIMEOUT_SECONDS, DEFAULT_HTTP_TIMEOUT_SECONDS, invalid);
        int workers = parseInt(values, CONCURRENCY, DEFAULT_CONCURRENCY, invalid);

        if (timeoutSeconds <= 0 && !invalid.contains(HTTP_TIMEOUT_SECONDS)) {
            invalid.add(HTTP_TIMEOUT_SECONDS);
        }
        if ((workers < 1 || workers > MAX_CONCURRENCY) && !invalid.contains(CONCURRENCY)) {
            invalid.add(CONCURRENCY);
        }
        if (!invalid.isEmpty()) {
            throw new IllegalStateException("Invalid configuration values: " + String.join(" ", invalid));
        }

        this.httpTimeout = Duration.ofSeconds(timeoutSeconds);
        this.concurrency = workers;

        logger.debug("Configuration loaded: credentials for {}, httpTimeout={}, concurrency={}",
                credentials.keySet(), httpTimeout, concurrency);
    }

    private static Map<String, String> loadFromEnvironment() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();

        Map<String, String> values = new HashMap<>();
        for (Platform platform : Platform.values()) {
            putIfPresent(values, dotenv, platform.credentialVariable());
        }
        putIfPresent(values, dotenv, HTTP_TIMEOUT_SECONDS);
        putIfPresent(values, dotenv, CONCURRENCY);
        return values;
    }

    private static void putIfPresent(Map<String, String> values, Dotenv dotenv, String key) {
        String value = resolveOptional(dotenv, key);
        if (value != null) {
            values.put(key, value);
        }
    }

    private static String resolveOptional(Dotenv dotenv, String key) {
        String envValue = System.getenv(key);
        if (envValue != null && !envValue.isBlank()) {
            return envValue;
        }
        return dotenv.get(key);
    }

    private static int parseInt(Map<String, String> values, String key, int defaultValue, List<String> invalid) {
        String raw = values.get(key);
        if (isBlank(raw)) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            invalid.add(key);
            return defaultValue;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * @return the configured credential per platform; platforms without one are absent
     */
    public Map<Platform, String> getCredentials() {
        return credentials;
    }

    public String getCredential(Platform platform) {
        return credentials.get(platform);
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public int getConcurrency() {
        return concurrency;
    }
}
