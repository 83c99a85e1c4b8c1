package com.gamedrops.dispatcher.api;

import com.gamedrops.core.model.DispatchOutcome;
import com.gamedrops.core.model.JobSpec;

import java.util.concurrent.CompletableFuture;

public interface JobTrigger {
    CompletableFuture<DispatchOutcome> trigger(JobSpec job);
}
