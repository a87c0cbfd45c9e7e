package com.mouse.cricket.controller;

import com.mouse.cricket.manager.MatchScheduler;
import com.mouse.cricket.model.Match;
import com.mouse.cricket.model.MatchData;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API exposing scheduler status and the stored match data
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ScraperController {

    private final MatchScheduler matchScheduler;

    /**
     * Scheduler and data store status
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getStatus() {
        try {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("scheduler", matchScheduler.getStatus());
            data.put("dataStore", matchScheduler.getStorageStats());
            data.put("timestamp", Instant.now().toString());
            return ResponseEntity.ok(Map.of(
                    "status", "success",
                    "data", data
            ));
        } catch (Exception e) {
            log.error("Failed to get status: {}", e.getMessage(), e);
            return error(e);
        }
    }

    /**
     * Persisted match list
     */
    @GetMapping("/matches")
    public ResponseEntity<Map<String, Object>> getMatches() {
        try {
            List<Match> matches = matchScheduler.getPersistedMatches();
            return ResponseEntity.ok(Map.of(
                    "status", "success",
                    "data", Map.of(
                            "matches", matches,
                            "count", matches.size()
                    )
            ));
        } catch (Exception e) {
            log.error("Failed to get matches: {}", e.getMessage(), e);
            return error(e);
        }
    }

    @GetMapping("/matches/{matchId}")
    public ResponseEntity<Map<String, Object>> getMatchData(@PathVariable String matchId) {
        try {
            MatchData matchData = matchScheduler.getMatchData(matchId);
            return ResponseEntity.ok(Map.of(
                    "status", "success",
                    "data", matchData
            ));
        } catch (Exception e) {
            log.error("Failed to get data for match {}: {}", matchId, e.getMessage(), e);
            return error(e);
        }
    }

    @PostMapping("/scheduler/start")
    public ResponseEntity<Map<String, Object>> startScheduler() {
        try {
            matchScheduler.start();
            return ResponseEntity.ok(Map.of(
                    "status", "success",
                    "message", "Scheduler started"
            ));
        } catch (Exception e) {
            log.error("Failed to start scheduler: {}", e.getMessage(), e);
            return error(e);
        }
    }

    @PostMapping("/scheduler/stop")
    public ResponseEntity<Map<String, Object>> stopScheduler() {
        try {
            matchScheduler.stop();
            return ResponseEntity.ok(Map.of(
                    "status", "success",
                    "message", "Scheduler stopped"
            ));
        } catch (Exception e) {
            log.error("Failed to stop scheduler: {}", e.getMessage(), e);
            return error(e);
        }
    }

    private ResponseEntity<Map<String, Object>> error(Exception e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "error");
        body.put("message", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        return ResponseEntity.internalServerError().body(body);
    }
}
