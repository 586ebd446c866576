package com.digitalgroup.scheduler.job.dispatch;

import java.util.concurrent.CompletableFuture;

/**
 * Performs the callback of a fired task off the scheduler clock thread.
 */
public interface TaskDispatcher {

    /**
     * Hands the request to a worker and returns immediately. The future always completes normally,
     * failures are reported as a non-successful {@link DispatchResult}. No retry is attempted.
     */
    CompletableFuture<DispatchResult> enqueue(DispatchRequest request);
}
