package com.gamedrops.core.model;

import java.net.URI;
import java.util.Objects;

public record JobSpec(String group, String name, URI endpoint, String method, String authToken) {
    public static final String POST = "POST";

    public JobSpec {
        Objects.requireNonNull(group, "group is required");
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(endpoint, "endpoint is required");
        Objects.requireNonNull(method, "method is required");
        Objects.requireNonNull(authToken, "authToken is required");
        if (!endpoint.isAbsolute()) {
            throw new IllegalArgumentException("Job endpoint must be absolute: " + endpoint);
        }
    }

    public static JobSpec post(String group, String name, URI endpoint, String authToken) {
        return new JobSpec(group, name, endpoint, POST, authToken);
    }

    public String endpointPath() {
        return endpoint.getRawPath();
    }

    @Override
    public String toString() {
        return "JobSpec[group=" + group + ", name=" + name + ", " + method + " " + endpoint + "]";
    }
}
