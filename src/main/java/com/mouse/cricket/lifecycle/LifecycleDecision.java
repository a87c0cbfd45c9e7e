package com.mouse.cricket.lifecycle;

import com.mouse.cricket.enums.MatchStatus;

public record LifecycleDecision(MatchStatus nextStatus, LifecycleAction action) {

    public static LifecycleDecision stay(MatchStatus status) {
        return new LifecycleDecision(status, LifecycleAction.NONE);
    }
}
