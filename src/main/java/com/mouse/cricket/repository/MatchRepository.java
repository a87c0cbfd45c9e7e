package com.mouse.cricket.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.mouse.cricket.enums.MatchStatus;
import com.mouse.cricket.enums.SnapshotKind;
import com.mouse.cricket.model.Match;
import com.mouse.cricket.model.MatchData;
import com.mouse.cricket.model.StorageStats;

import java.util.List;

public interface MatchRepository {

    void putMatchList(List<Match> matches);

    /** Persisted match list; empty when nothing was stored yet or the file cannot be read. */
    List<Match> getMatchList();

    void putMatchStatus(String matchId, MatchStatus status);

    /**
     * Stores one payload. LIVE and SCORECARD keep a timestamped copy plus an overwritten latest copy;
     * INFO and SQUADS are overwritten.
     */
    void putSnapshot(String matchId, SnapshotKind kind, JsonNode payload);

    MatchData getMatchData(String matchId);

    StorageStats getStorageStats();
}
