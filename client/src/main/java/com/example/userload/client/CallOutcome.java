package com.example.userload.client;

import io.grpc.Status;

/**
 * What a single remote call ended as, from the load test's point of view.
 */
public enum CallOutcome {
    SUCCESS,
    FAILED,
    RATE_LIMITED;

    /**
     * RESOURCE_EXHAUSTED is the user service's rate-limit signal; every other code is a plain failure.
     */
    public static CallOutcome classify(Status.Code code) {
        return code == Status.Code.RESOURCE_EXHAUSTED ? RATE_LIMITED : FAILED;
    }

    /**
     * Classifies a failed call. Throwables that carry no gRPC status map to UNKNOWN and count as failures.
     */
    public static CallOutcome classify(Throwable t) {
        return classify(Status.fromThrowable(t).getCode());
    }
}
