package com.mouse.cricket.lifecycle;

import com.mouse.cricket.enums.MatchStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Transition function of a tracked match. Pure: no clock, no I/O.
 *
 * <ul>
 *   <li>UPCOMING without a tracker, start within the pre-roll window (or already past) → provision, stay UPCOMING</li>
 *   <li>UPCOMING with a tracker, start reached → LIVE</li>
 *   <li>LIVE with a tracker that reports the match ended → COMPLETED</li>
 * </ul>
 * Everything else keeps its status. COMPLETED is terminal.
 */
public final class MatchLifecycle {

    private final Duration preroll;

    public MatchLifecycle(Duration preroll) {
        this.preroll = Objects.requireNonNull(preroll, "preroll");
    }

    public LifecycleDecision decide(MatchStatus status,
                                    Instant now,
                                    Instant scheduledStart,
                                    boolean hasTracker,
                                    boolean ended) {
        switch (status) {
            case UPCOMING -> {
                if (!hasTracker) {
                    return withinPreroll(now, scheduledStart)
                            ? new LifecycleDecision(MatchStatus.UPCOMING, LifecycleAction.PROVISION)
                            : LifecycleDecision.stay(status);
                }
                if (!now.isBefore(scheduledStart)) {
                    return new LifecycleDecision(MatchStatus.LIVE, LifecycleAction.GO_LIVE);
                }
                return LifecycleDecision.stay(status);
            }
            case LIVE -> {
                if (hasTracker && ended) {
                    return new LifecycleDecision(MatchStatus.COMPLETED, LifecycleAction.COMPLETE);
                }
                return LifecycleDecision.stay(status);
            }
            default -> {
                return LifecycleDecision.stay(status);
            }
        }
    }

    // A start already in the past counts as inside the window: late matches get provisioned too.
    private boolean withinPreroll(Instant now, Instant scheduledStart) {
        return Duration.between(now, scheduledStart).compareTo(preroll) <= 0;
    }
}
