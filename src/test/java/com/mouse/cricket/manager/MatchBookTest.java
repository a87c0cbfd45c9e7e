package com.mouse.cricket.manager;

import com.mouse.cricket.enums.MatchStatus;
import com.mouse.cricket.model.Match;
import com.mouse.cricket.tasks.MatchTracker;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class MatchBookTest {

    private final MatchBook book = new MatchBook();

    private static Match match(String id, MatchStatus status) {
        return Match.builder()
                .id(id)
                .url("https://example.test/live/" + id)
                .scheduledStart(Instant.parse("2026-10-19T14:30:00Z"))
                .status(status)
                .build();
    }

    @Test
    void closeAndDrain_liveMatches_fallBackToUpcoming() {
        Match live = match("live", MatchStatus.UPCOMING);
        Match done = match("done", MatchStatus.COMPLETED);
        book.reconcile(List.of(live, done));
        MatchTracker tracker = mock(MatchTracker.class);
        assertThat(book.register(live, tracker)).isTrue();
        assertThat(book.markLive(live, tracker)).isTrue();

        List<MatchTracker> drained = book.closeAndDrain();

        assertThat(drained).containsExactly(tracker);
        assertThat(book.snapshot()).extracting(Match::getStatus)
                .containsExactly(MatchStatus.UPCOMING, MatchStatus.COMPLETED);
        assertThat(book.status(false).getActiveIds()).isEmpty();
    }

    @Test
    void register_afterClose_isRefusedUntilReopened() {
        Match m1 = match("m1", MatchStatus.UPCOMING);
        book.reconcile(List.of(m1));
        book.closeAndDrain();

        assertThat(book.register(m1, mock(MatchTracker.class))).isFalse();

        book.reopen();
        assertThat(book.register(m1, mock(MatchTracker.class))).isTrue();
    }

    @Test
    void markLive_trackerDrainedMeanwhile_keepsMatchUpcoming() {
        Match m1 = match("m1", MatchStatus.UPCOMING);
        book.reconcile(List.of(m1));
        MatchTracker tracker = mock(MatchTracker.class);
        book.register(m1, tracker);
        book.closeAndDrain();

        assertThat(book.markLive(m1, tracker)).isFalse();
        assertThat(book.snapshot()).extracting(Match::getStatus).containsExactly(MatchStatus.UPCOMING);
    }
}
