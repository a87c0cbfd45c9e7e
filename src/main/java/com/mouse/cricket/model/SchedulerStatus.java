package com.mouse.cricket.model;

import com.mouse.cricket.enums.MatchStatus;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of the scheduler, built from in-memory state only.
 */
@Data
@Builder
public class SchedulerStatus {
    private boolean running;
    private int matchCount;
    private List<String> activeIds;
    private Map<MatchStatus, Integer> countsByStatus;

    public int getUpcomingMatches() {
        return countsByStatus.getOrDefault(MatchStatus.UPCOMING, 0);
    }

    public int getLiveMatches() {
        return countsByStatus.getOrDefault(MatchStatus.LIVE, 0);
    }

    public int getCompletedMatches() {
        return countsByStatus.getOrDefault(MatchStatus.COMPLETED, 0);
    }
}
