package com.mouse.cricket.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.cricket.config.ScraperConfig;
import com.mouse.cricket.enums.MatchStatus;
import com.mouse.cricket.enums.SnapshotKind;
import com.mouse.cricket.exception.StoreException;
import com.mouse.cricket.model.Match;
import com.mouse.cricket.model.MatchData;
import com.mouse.cricket.model.StorageStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.*;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.stream.Stream;

/**
 * JSON files under the data directory:
 * <pre>
 * match-list.json
 * matches/&lt;id&gt;/info.json, squads.json
 * matches/&lt;id&gt;/live/&lt;timestamp&gt;.json, latest.json
 * matches/&lt;id&gt;/scorecard/&lt;timestamp&gt;.json, latest.json
 * </pre>
 * Writes are serialized on this instance.
 */
@Slf4j
@Repository
public class FileMatchRepository implements MatchRepository {

    private static final String MATCH_LIST_FILE = "match-list.json";
    private static final String MATCHES_DIR = "matches";
    private static final String LATEST_FILE = "latest.json";
    private static final DateTimeFormatter SNAPSHOT_STAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd-HH-mm-ss-SSS").withZone(ZoneOffset.UTC);

    private final Path baseDir;
    private final Path matchListFile;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public FileMatchRepository(ScraperConfig scraperConfig, ObjectMapper objectMapper, Clock clock) {
        this(Paths.get(scraperConfig.getDataDir()), objectMapper, clock);
    }

    public FileMatchRepository(Path baseDir, ObjectMapper objectMapper, Clock clock) {
        this.baseDir = baseDir;
        this.matchListFile = baseDir.resolve(MATCH_LIST_FILE);
        this.objectMapper = objectMapper;
        this.clock = clock;
        try {
            Files.createDirectories(baseDir.resolve(MATCHES_DIR));
        } catch (IOException e) {
            throw new StoreException("Cannot create data directory " + baseDir, e);
        }
    }

    @Override
    public synchronized void putMatchList(List<Match> matches) {
        writeJson(matchListFile, matches);
        log.info("Stored {} matches in match list", matches.size());
    }

    @Override
    public synchronized List<Match> getMatchList() {
        if (!Files.exists(matchListFile)) {
            return new ArrayList<>();
        }
        try {
            return objectMapper.readValue(matchListFile.toFile(), new TypeReference<List<Match>>() {});
        } catch (IOException e) {
            log.error("Failed to read match list: {}", e.getMessage(), e);
            return new ArrayList<>();
        }
    }

    @Override
    public synchronized void putMatchStatus(String matchId, MatchStatus status) {
        List<Match> matches = getMatchList();
        boolean found = false;
        for (Match match : matches) {
            if (Objects.equals(match.getId(), matchId)) {
                match.setStatus(status);
                found = true;
                break;
            }
        }
        if (!found) {
            log.warn("Match {} not in stored list, status {} not persisted", matchId, status);
            return;
        }
        writeJson(matchListFile, matches);
        log.info("Updated status of match {} to {}", matchId, status);
    }

    @Override
    public synchronized void putSnapshot(String matchId, SnapshotKind kind, JsonNode payload) {
        Path matchDir = matchDir(matchId);
        if (kind.isHistorical()) {
            Path kindDir = matchDir.resolve(kind.getKey());
            writeJson(snapshotFile(kindDir), payload);
            writeJson(kindDir.resolve(LATEST_FILE), payload);
        } else {
            writeJson(matchDir.resolve(kind.getKey() + ".json"), payload);
        }
        log.debug("Stored {} for match {}", kind.getKey(), matchId);
    }

    @Override
    public synchronized MatchData getMatchData(String matchId) {
        Path matchDir = matchDir(matchId);
        return MatchData.builder()
                .info(readNode(matchDir.resolve(SnapshotKind.INFO.getKey() + ".json")))
                .squads(readNode(matchDir.resolve(SnapshotKind.SQUADS.getKey() + ".json")))
                .live(readNode(matchDir.resolve(SnapshotKind.LIVE.getKey()).resolve(LATEST_FILE)))
                .scorecard(readNode(matchDir.resolve(SnapshotKind.SCORECARD.getKey()).resolve(LATEST_FILE)))
                .build();
    }

    @Override
    public synchronized StorageStats getStorageStats() {
        List<Match> matches = getMatchList();
        Map<MatchStatus, Integer> byStatus = new EnumMap<>(MatchStatus.class);
        for (MatchStatus status : MatchStatus.values()) {
            byStatus.put(status, 0);
        }
        matches.stream()
                .map(Match::getStatus)
                .filter(Objects::nonNull)
                .forEach(status -> byStatus.merge(status, 1, Integer::sum));

        long bytes = directorySize(baseDir);
        return StorageStats.builder()
                .totalMatches(matches.size())
                .matchesByStatus(byStatus)
                .totalStorageBytes(bytes)
                .totalStorageMb(Math.round(bytes / (1024.0 * 1024.0) * 100.0) / 100.0)
                .lastUpdated(clock.instant())
                .build();
    }

    // Same-millisecond writes get a -1, -2, ... suffix instead of replacing each other.
    private Path snapshotFile(Path kindDir) {
        String stamp = SNAPSHOT_STAMP.format(clock.instant());
        Path candidate = kindDir.resolve(stamp + ".json");
        for (int seq = 1; Files.exists(candidate); seq++) {
            candidate = kindDir.resolve(stamp + "-" + seq + ".json");
        }
        return candidate;
    }

    Path matchDir(String matchId) {
        return baseDir.resolve(MATCHES_DIR).resolve(safeId(matchId));
    }

    static String safeId(String matchId) {
        if (matchId == null || matchId.isBlank()) {
            throw new StoreException("Match id must not be blank");
        }
        String cleaned = matchId.replaceAll("[^A-Za-z0-9._-]", "_");
        if (cleaned.equals(".") || cleaned.equals("..")) {
            cleaned = cleaned.replace('.', '_');
        }
        return cleaned;
    }

    private void writeJson(Path target, Object value) {
        try {
            Files.createDirectories(target.getParent());
            Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), value);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.error("Failed to write {}: {}", target, e.getMessage(), e);
            throw new StoreException("Failed to write " + target, e);
        }
    }

    private JsonNode readNode(Path file) {
        if (!Files.exists(file)) {
            return null;
        }
        try {
            return objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            log.error("Failed to read {}: {}", file, e.getMessage(), e);
            return null;
        }
    }

    private long directorySize(Path dir) {
        if (!Files.exists(dir)) {
            return 0L;
        }
        try (Stream<Path> files = Files.walk(dir)) {
            return files.filter(Files::isRegularFile)
                    .mapToLong(this::sizeOf)
                    .sum();
        } catch (IOException e) {
            log.error("Failed to compute storage size: {}", e.getMessage(), e);
            return 0L;
        }
    }

    private long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            log.debug("Skipping size of {}: {}", file, e.getMessage());
            return 0L;
        }
    }
}
