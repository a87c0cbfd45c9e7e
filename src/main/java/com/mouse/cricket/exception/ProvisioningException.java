package com.mouse.cricket.exception;

import lombok.Getter;

/**
 * Raised when a tracker could not open its session and pull the static match content
 * within the configured number of attempts.
 */
@Getter
public class ProvisioningException extends RuntimeException {

    private final String matchId;
    private final int attempts;

    public ProvisioningException(String matchId, int attempts, Throwable cause) {
        super("Provisioning failed for match " + matchId + " after " + attempts + " attempt(s)", cause);
        this.matchId = matchId;
        this.attempts = attempts;
    }
}
