package com.gamedrops.dispatcher.dispatch;

import com.gamedrops.core.model.DispatchOutcome;
import com.gamedrops.core.model.JobSpec;
import com.gamedrops.dispatcher.api.JobTrigger;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

public class HttpJobTrigger implements JobTrigger {
    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final Clock clock;

    public HttpJobTrigger(HttpClient httpClient, Duration requestTimeout, Clock clock) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    @Override
    public CompletableFuture<DispatchOutcome> trigger(JobSpec job) {
        HttpRequest request = HttpRequest.newBuilder(job.endpoint())
                .method(job.method(), HttpRequest.BodyPublishers.noBody())
                .timeout(requestTimeout)
                .header("Authorization", "Bearer " + job.authToken())
                .header("Content-Type", "application/json")
                .build();
        Instant startedAt = clock.instant();

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .orTimeout(requestTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((response, error) -> {
                    long durationMillis = Duration.between(startedAt, clock.instant()).toMillis();
                    if (error != null) {
                        return DispatchOutcome.failed(job.group(), job.name(), FailureReasons.describe(error), 0, durationMillis);
                    }
                    int status = response.statusCode();
                    if (status < 200 || status > 299) {
                        return DispatchOutcome.failed(
                                job.group(),
                                job.name(),
                                FailureReasons.httpStatus(status),
                                status,
                                durationMillis
                        );
                    }
                    return DispatchOutcome.succeeded(job.group(), job.name(), status, durationMillis);
                });
    }
}
