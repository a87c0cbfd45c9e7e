package com.mouse.cricket.tasks;

import com.fasterxml.jackson.databind.JsonNode;
import com.mouse.cricket.config.ScraperConfig;
import com.mouse.cricket.enums.SnapshotKind;
import com.mouse.cricket.exception.ExtractionException;
import com.mouse.cricket.exception.ProvisioningException;
import com.mouse.cricket.extractor.ExtractorSession;
import com.mouse.cricket.extractor.PageExtractor;
import com.mouse.cricket.model.Match;
import com.mouse.cricket.repository.MatchRepository;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lifecycle agent of one match. Owns exactly one extractor session and, once the match
 * is live, one polling loop on its own thread.
 *
 * <p>Every call into the session goes through {@code sessionLock}; the loop and
 * {@link #stop()} only coordinate through the stop signal.
 */
@Slf4j
public class MatchTracker {

    private static final String EMOJI_INIT = "🚀";
    private static final String EMOJI_SUCCESS = "✅";
    private static final String EMOJI_ERROR = "❌";
    private static final String EMOJI_WARNING = "⚠️";
    private static final String EMOJI_LIVE = "🏏";
    private static final String EMOJI_SHUTDOWN = "🛑";

    private static final List<SnapshotKind> STATIC_KINDS = List.of(SnapshotKind.INFO, SnapshotKind.SQUADS);
    private static final List<SnapshotKind> LIVE_KINDS = List.of(SnapshotKind.LIVE, SnapshotKind.SCORECARD);

    @Getter
    private final String matchId;
    private final String matchUrl;
    private final PageExtractor extractor;
    private final MatchRepository matchRepository;
    private final ScraperConfig config;

    private final ReentrantLock sessionLock = new ReentrantLock();
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final AtomicBoolean pollingActive = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicReference<ExtractorSession> session = new AtomicReference<>();
    private final ExecutorService pollExecutor;
    private volatile Future<?> pollingTask;

    public MatchTracker(Match match, PageExtractor extractor, MatchRepository matchRepository, ScraperConfig config) {
        this.matchId = match.getId();
        this.matchUrl = match.getUrl();
        this.extractor = extractor;
        this.matchRepository = matchRepository;
        this.config = config;
        this.pollExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "tracker-" + matchId);
            t.setDaemon(true);
            return t;
        });
    }

    // ==================== PROVISIONING ====================

    /**
     * Opens the session and stores match info and squads. Each attempt starts from a fresh
     * session; a failed attempt closes its session before backing off.
     *
     * @throws ProvisioningException when every attempt failed; no session is left open
     * @throws IllegalStateException if the tracker was already stopped
     */
    public void provision() {
        if (stopped.get()) {
            throw new IllegalStateException("Tracker for match " + matchId + " is stopped");
        }
        int maxAttempts = Math.max(1, config.getMaxRetryAttempts());
        int attempt = 0;
        RuntimeException lastFailure = null;

        while (attempt < maxAttempts && !stopped.get()) {
            attempt++;
            try {
                log.info("{} Provisioning tracker for match {} (attempt {}/{})", EMOJI_INIT, matchId, attempt, maxAttempts);
                initializeSession();
                log.info("{} Tracker ready for match {}", EMOJI_SUCCESS, matchId);
                return;
            } catch (RuntimeException e) {
                lastFailure = e;
                log.error("{} Provisioning attempt {}/{} failed for match {}: {}",
                        EMOJI_ERROR, attempt, maxAttempts, matchId, e.getMessage());
                releaseSession();
                if (attempt < maxAttempts && awaitStop(config.getRetryDelayMs())) {
                    log.info("Provisioning of match {} cancelled during backoff", matchId);
                    break;
                }
            }
        }
        releaseSession();
        throw new ProvisioningException(matchId, attempt, lastFailure);
    }

    private void initializeSession() {
        sessionLock.lock();
        try {
            ExtractorSession opened = extractor.open(matchUrl);
            session.set(opened);
            if (stopped.get()) {
                throw new ExtractionException("Tracker for match " + matchId + " stopped while provisioning");
            }
            for (SnapshotKind kind : STATIC_KINDS) {
                JsonNode payload = extractor.fetch(opened, kind);
                if (payload == null) {
                    throw new ExtractionException("Failed to extract " + kind.getKey() + " for match " + matchId);
                }
                matchRepository.putSnapshot(matchId, kind, payload);
            }
        } finally {
            sessionLock.unlock();
        }
    }

    // ==================== LIVE TRACKING ====================

    /**
     * Starts the polling loop. Does nothing if it is already running.
     *
     * @throws IllegalStateException if the tracker is stopped or was never provisioned
     */
    public synchronized void startLiveTracking() {
        if (stopped.get()) {
            throw new IllegalStateException("Tracker for match " + matchId + " is stopped");
        }
        if (session.get() == null) {
            throw new IllegalStateException("Tracker for match " + matchId + " has no session");
        }
        if (!pollingActive.compareAndSet(false, true)) {
            return;
        }
        log.info("{} Starting live tracking for match {} every {}ms", EMOJI_LIVE, matchId, config.getLivePollIntervalMs());
        pollingTask = pollExecutor.submit(this::pollLoop);
    }

    private void pollLoop() {
        try {
            do {
                pollOnce();
            } while (!awaitStop(config.getLivePollIntervalMs()));
        } finally {
            pollingActive.set(false);
            log.info("Live tracking loop exited for match {}", matchId);
        }
    }

    private void pollOnce() {
        ExtractorSession current = session.get();
        if (current == null) {
            return;
        }
        try {
            sessionLock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        try {
            for (SnapshotKind kind : LIVE_KINDS) {
                if (stopped.get()) {
                    return;
                }
                pull(current, kind);
            }
        } finally {
            sessionLock.unlock();
        }
    }

    private void pull(ExtractorSession current, SnapshotKind kind) {
        try {
            JsonNode payload = extractor.fetch(current, kind);
            if (payload == null) {
                log.warn("{} No {} data on page for match {}", EMOJI_WARNING, kind.getKey(), matchId);
                return;
            }
            matchRepository.putSnapshot(matchId, kind, payload);
        } catch (RuntimeException e) {
            log.error("{} Error pulling {} for match {}: {}", EMOJI_ERROR, kind.getKey(), matchId, e.getMessage());
        }
    }

    // ==================== END DETECTION ====================

    /**
     * Whether the page reports the match as finished. Any failure, a missing session or a
     * session busy beyond the lock timeout answers {@code false}.
     */
    public boolean checkIfEnded() {
        ExtractorSession current = session.get();
        if (stopped.get() || current == null) {
            return false;
        }
        boolean locked = false;
        try {
            locked = sessionLock.tryLock(config.getSessionLockTimeoutMs(), TimeUnit.MILLISECONDS);
            if (!locked) {
                log.warn("{} Session of match {} busy, skipping end check", EMOJI_WARNING, matchId);
                return false;
            }
            return extractor.isEnded(current);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (RuntimeException e) {
            log.error("{} Error checking if match {} has ended: {}", EMOJI_ERROR, matchId, e.getMessage());
            return false;
        } finally {
            if (locked) {
                sessionLock.unlock();
            }
        }
    }

    // ==================== SHUTDOWN ====================

    /**
     * Signals the loop, waits briefly for it, then releases the session whatever state the
     * loop is in. Idempotent.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        log.info("{} Stopping tracker for match {}", EMOJI_SHUTDOWN, matchId);
        stopSignal.countDown();

        Future<?> task = pollingTask;
        if (task != null) {
            try {
                task.get(config.getTrackerStopTimeoutMs(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.warn("{} Polling loop of match {} did not stop within {}ms, interrupting",
                        EMOJI_WARNING, matchId, config.getTrackerStopTimeoutMs());
                task.cancel(true);
            } catch (ExecutionException | CancellationException e) {
                log.warn("Polling loop of match {} ended abnormally: {}", matchId, e.getMessage());
            } catch (InterruptedException e) {
                task.cancel(true);
                Thread.currentThread().interrupt();
            }
        }
        pollExecutor.shutdownNow();
        pollingActive.set(false);
        releaseSession();
        log.info("{} Tracker stopped for match {}", EMOJI_SUCCESS, matchId);
    }

    private void releaseSession() {
        ExtractorSession current = session.getAndSet(null);
        if (current == null) {
            return;
        }
        try {
            extractor.close(current);
        } catch (RuntimeException e) {
            log.warn("Closing session of match {} failed: {}", matchId, e.getMessage());
        }
    }

    /** Waits up to {@code millis}; true when stop was signalled (or the wait was interrupted). */
    private boolean awaitStop(long millis) {
        try {
            return stopSignal.await(millis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    public boolean isPollingActive() {
        return pollingActive.get();
    }

    public boolean isStopped() {
        return stopped.get();
    }

    public boolean hasOpenSession() {
        return session.get() != null;
    }
}
