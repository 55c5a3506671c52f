package com.example.userload.client;

import java.util.Optional;

public final class RegistrationResult {

    private final CallOutcome outcome;
    private final CreatedUser user;
    private final String error;

    private RegistrationResult(CallOutcome outcome, CreatedUser user, String error) {
        this.outcome = outcome;
        this.user = user;
        this.error = error;
    }

    public static RegistrationResult success(CreatedUser user) {
        return new RegistrationResult(CallOutcome.SUCCESS, user, null);
    }

    public static RegistrationResult failure(CallOutcome outcome, String error) {
        if (outcome == CallOutcome.SUCCESS) {
            throw new IllegalArgumentException("failure outcome expected, got " + outcome);
        }
        return new RegistrationResult(outcome, null, error);
    }

    public CallOutcome getOutcome() {
        return outcome;
    }

    public boolean isSuccess() {
        return outcome == CallOutcome.SUCCESS;
    }

    public boolean isRateLimited() {
        return outcome == CallOutcome.RATE_LIMITED;
    }

    public Optional<CreatedUser> getUser() {
        return Optional.ofNullable(user);
    }

    public String getError() {
        return error;
    }
}
