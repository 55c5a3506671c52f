package com.example.userload.client;

public final class LoginResult {

    private final CallOutcome outcome;
    private final String accessToken;
    private final String error;

    private LoginResult(CallOutcome outcome, String accessToken, String error) {
        this.outcome = outcome;
        this.accessToken = accessToken;
        this.error = error;
    }

    public static LoginResult success(String accessToken) {
        return new LoginResult(CallOutcome.SUCCESS, accessToken, null);
    }

    public static LoginResult failure(CallOutcome outcome, String error) {
        if (outcome == CallOutcome.SUCCESS) {
            throw new IllegalArgumentException("failure outcome expected, got " + outcome);
        }
        return new LoginResult(outcome, null, error);
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

    public String getAccessToken() {
        return accessToken;
    }

    public String getError() {
        return error;
    }
}
