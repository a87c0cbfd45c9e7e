package com.mouse.cricket.enums;

public enum MatchStatus {
    UPCOMING,
    LIVE,
    COMPLETED;

    public boolean isTerminal() {
        return this == COMPLETED;
    }
}
