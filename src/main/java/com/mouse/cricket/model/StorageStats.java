package com.mouse.cricket.model;

import com.mouse.cricket.enums.MatchStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StorageStats {
    private int totalMatches;
    private Map<MatchStatus, Integer> matchesByStatus;
    private long totalStorageBytes;
    private double totalStorageMb;
    private Instant lastUpdated;
}
