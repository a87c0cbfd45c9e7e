package com.mouse.cricket.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mouse.cricket.enums.MatchStatus;
import com.mouse.cricket.enums.SnapshotKind;
import com.mouse.cricket.exception.StoreException;
import com.mouse.cricket.model.Match;
import com.mouse.cricket.model.MatchData;
import com.mouse.cricket.model.StorageStats;
import com.mouse.cricket.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileMatchRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-10-19T14:30:00Z");

    @TempDir
    Path dataDir;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private MutableClock clock;
    private FileMatchRepository repository;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        repository = new FileMatchRepository(dataDir, objectMapper, clock);
    }

    @Test
    void getMatchList_nothingStored_returnsEmpty() {
        assertThat(repository.getMatchList()).isEmpty();
    }

    @Test
    void putMatchList_thenGet_returnsSameMatches() {
        repository.putMatchList(List.of(match("m1"), match("m2")));

        List<Match> stored = repository.getMatchList();

        assertThat(stored).extracting(Match::getId).containsExactly("m1", "m2");
        assertThat(stored.get(0).getScheduledStart()).isEqualTo(NOW);
        assertThat(stored.get(0).getStatus()).isEqualTo(MatchStatus.UPCOMING);
        assertThat(dataDir.resolve("match-list.json")).exists();
    }

    @Test
    void getMatchList_corruptFile_returnsEmpty() throws IOException {
        Files.writeString(dataDir.resolve("match-list.json"), "{not json");

        assertThat(repository.getMatchList()).isEmpty();
    }

    @Test
    void putMatchStatus_knownMatch_updatesStoredStatus() {
        repository.putMatchList(List.of(match("m1"), match("m2")));

        repository.putMatchStatus("m2", MatchStatus.LIVE);

        assertThat(repository.getMatchList())
                .extracting(Match::getStatus)
                .containsExactly(MatchStatus.UPCOMING, MatchStatus.LIVE);
    }

    @Test
    void putMatchStatus_unknownMatch_leavesListUntouched() {
        repository.putMatchList(List.of(match("m1")));

        repository.putMatchStatus("ghost", MatchStatus.COMPLETED);

        assertThat(repository.getMatchList())
                .extracting(Match::getStatus)
                .containsExactly(MatchStatus.UPCOMING);
    }

    @Test
    void putSnapshot_staticKind_overwritesSingleFile() {
        repository.putSnapshot("m1", SnapshotKind.INFO, payload("venue", "Lord's"));
        repository.putSnapshot("m1", SnapshotKind.INFO, payload("venue", "The Oval"));

        assertThat(dataDir.resolve("matches/m1/info.json")).exists();
        assertThat(repository.getMatchData("m1").getInfo().get("venue").asText()).isEqualTo("The Oval");
    }

    @Test
    void putSnapshot_historicalKind_keepsTimestampedCopiesAndLatest() throws IOException {
        repository.putSnapshot("m1", SnapshotKind.LIVE, payload("score", "10/0"));
        clock.advance(Duration.ofSeconds(30));
        repository.putSnapshot("m1", SnapshotKind.LIVE, payload("score", "24/1"));

        Path liveDir = dataDir.resolve("matches/m1/live");
        List<String> files;
        try (Stream<Path> listing = Files.list(liveDir)) {
            files = listing.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
        }

        assertThat(files).containsExactly(
                "2026-10-19-14-30-00-000.json",
                "2026-10-19-14-30-30-000.json",
                "latest.json");
        assertThat(repository.getMatchData("m1").getLive().get("score").asText()).isEqualTo("24/1");
    }

    @Test
    void putSnapshot_sameMillisecond_keepsEveryHistoricalCopy() throws IOException {
        repository.putSnapshot("m1", SnapshotKind.SCORECARD, payload("over", "12.1"));
        repository.putSnapshot("m1", SnapshotKind.SCORECARD, payload("over", "12.2"));
        repository.putSnapshot("m1", SnapshotKind.SCORECARD, payload("over", "12.3"));

        List<String> files;
        try (Stream<Path> listing = Files.list(dataDir.resolve("matches/m1/scorecard"))) {
            files = listing.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
        }

        assertThat(files).containsExactly(
                "2026-10-19-14-30-00-000-1.json",
                "2026-10-19-14-30-00-000-2.json",
                "2026-10-19-14-30-00-000.json",
                "latest.json");
        assertThat(objectMapper.readTree(dataDir.resolve("matches/m1/scorecard/2026-10-19-14-30-00-000.json").toFile())
                .get("over").asText()).isEqualTo("12.1");
        assertThat(repository.getMatchData("m1").getScorecard().get("over").asText()).isEqualTo("12.3");
    }

    @Test
    void getMatchData_unknownMatch_returnsAllNull() {
        MatchData data = repository.getMatchData("nothing-here");

        assertThat(data.getInfo()).isNull();
        assertThat(data.getSquads()).isNull();
        assertThat(data.getLive()).isNull();
        assertThat(data.getScorecard()).isNull();
    }

    @Test
    void getMatchData_partialData_fillsOnlyStoredParts() {
        repository.putSnapshot("m1", SnapshotKind.SQUADS, payload("team1", "IND"));
        repository.putSnapshot("m1", SnapshotKind.SCORECARD, payload("innings", "1"));

        MatchData data = repository.getMatchData("m1");

        assertThat(data.getSquads().get("team1").asText()).isEqualTo("IND");
        assertThat(data.getScorecard().get("innings").asText()).isEqualTo("1");
        assertThat(data.getInfo()).isNull();
        assertThat(data.getLive()).isNull();
    }

    @Test
    void putSnapshot_unsafeId_staysInsideDataDir() {
        repository.putSnapshot("../escape/m1", SnapshotKind.INFO, payload("k", "v"));

        assertThat(dataDir.resolve("matches/.._escape_m1/info.json")).exists();
        assertThat(dataDir.getParent().resolve("escape")).doesNotExist();
    }

    @Test
    void safeId_replacesCharactersOutsideAllowedSet() {
        assertThat(FileMatchRepository.safeId("ind-vs-aus_2026.t20")).isEqualTo("ind-vs-aus_2026.t20");
        assertThat(FileMatchRepository.safeId("a/b c?d")).isEqualTo("a_b_c_d");
        assertThat(FileMatchRepository.safeId("..")).isEqualTo("__");
    }

    @Test
    void safeId_blank_throwsStoreException() {
        assertThatThrownBy(() -> FileMatchRepository.safeId(" ")).isInstanceOf(StoreException.class);
        assertThatThrownBy(() -> FileMatchRepository.safeId(null)).isInstanceOf(StoreException.class);
    }

    @Test
    void getStorageStats_countsMatchesByStatusAndBytes() {
        repository.putMatchList(List.of(match("m1"), match("m2"), match("m3")));
        repository.putMatchStatus("m2", MatchStatus.LIVE);
        repository.putMatchStatus("m3", MatchStatus.COMPLETED);
        repository.putSnapshot("m2", SnapshotKind.LIVE, payload("score", "1/0"));

        StorageStats stats = repository.getStorageStats();

        assertThat(stats.getTotalMatches()).isEqualTo(3);
        assertThat(stats.getMatchesByStatus())
                .containsEntry(MatchStatus.UPCOMING, 1)
                .containsEntry(MatchStatus.LIVE, 1)
                .containsEntry(MatchStatus.COMPLETED, 1);
        assertThat(stats.getTotalStorageBytes()).isPositive();
        assertThat(stats.getLastUpdated()).isEqualTo(NOW);
    }

    @Test
    void getStorageStats_emptyStore_reportsAllStatusesAtZero() {
        StorageStats stats = repository.getStorageStats();

        assertThat(stats.getTotalMatches()).isZero();
        assertThat(stats.getMatchesByStatus()).containsOnlyKeys(MatchStatus.values());
        assertThat(stats.getMatchesByStatus().values()).containsOnly(0);
    }

    private static Match match(String id) {
        return Match.builder()
                .id(id)
                .teams("IND vs AUS")
                .format("T20")
                .url("https://example.test/" + id)
                .scheduledStart(NOW)
                .build();
    }

    private JsonNode payload(String key, String value) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put(key, value);
        return node;
    }
}
