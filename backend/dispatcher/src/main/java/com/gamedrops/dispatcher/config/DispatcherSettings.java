package com.gamedrops.dispatcher.config;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.regex.Pattern;

public record DispatcherSettings(URI baseUrl, String apiKey, Duration requestTimeout, Duration tickTimeout) {
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_TICK_TIMEOUT = Duration.ofSeconds(55);

    private static final Pattern JOB_NAME = Pattern.compile("[A-Za-z0-9_-]+");

    public DispatcherSettings {
        Objects.requireNonNull(baseUrl, "baseUrl is required");
        Objects.requireNonNull(apiKey, "apiKey is required");
        Objects.requireNonNull(requestTimeout, "requestTimeout is required");
        Objects.requireNonNull(tickTimeout, "tickTimeout is required");
        String scheme = baseUrl.getScheme();
        if (!baseUrl.isAbsolute() || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
            throw new IllegalArgumentException("baseUrl must be an absolute http(s) URL: " + baseUrl);
        }
        if (apiKey.isBlank()) {
            throw new IllegalArgumentException("apiKey must not be blank");
        }
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
        if (tickTimeout.isNegative() || tickTimeout.isZero()) {
            throw new IllegalArgumentException("tickTimeout must be positive");
        }
        baseUrl = stripTrailingSlashes(baseUrl);
    }

    public static DispatcherSettings withDefaults(URI baseUrl, String apiKey) {
        return new DispatcherSettings(baseUrl, apiKey, DEFAULT_REQUEST_TIMEOUT, DEFAULT_TICK_TIMEOUT);
    }

    public URI jobEndpoint(String job) {
        if (job == null || !JOB_NAME.matcher(job).matches()) {
            throw new IllegalArgumentException("Invalid job name: " + job);
        }
        return URI.create(baseUrl + "/run/" + job);
    }

    @Override
    public String toString() {
        return "DispatcherSettings[baseUrl=" + baseUrl
                + ", requestTimeout=" + requestTimeout
                + ", tickTimeout=" + tickTimeout + "]";
    }

    private static URI stripTrailingSlashes(URI uri) {
        String text = uri.toString();
        int end = text.length();
        while (end > 0 && text.charAt(end - 1) == '/') {
            end--;
        }
        return end == text.length() ? uri : URI.create(text.substring(0, end));
    }
}
