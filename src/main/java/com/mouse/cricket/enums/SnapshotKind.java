package com.mouse.cricket.enums;

import lombok.Getter;

/**
 * Kinds of per-match payloads pulled from a match page.
 * Historical kinds keep a timestamped copy next to the overwritten latest one.
 */
@Getter
public enum SnapshotKind {
    INFO("info", "Info", "[class*='info']", false),
    SQUADS("squads", "Squad", "[class*='squad']", false),
    LIVE("live", "Live", "[class*='live']", true),
    SCORECARD("scorecard", "Scorecard", "[class*='scorecard']", true);

    private final String key;
    private final String tabLabel;
    private final String containerSelector;
    private final boolean historical;

    SnapshotKind(String key, String tabLabel, String containerSelector, boolean historical) {
        this.key = key;
        this.tabLabel = tabLabel;
        this.containerSelector = containerSelector;
        this.historical = historical;
    }
}
