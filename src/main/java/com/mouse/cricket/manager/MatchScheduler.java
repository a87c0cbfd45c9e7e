package com.mouse.cricket.manager;

import com.mouse.cricket.config.ScraperConfig;
import com.mouse.cricket.enums.MatchStatus;
import com.mouse.cricket.exception.ExtractionException;
import com.mouse.cricket.exception.ProvisioningException;
import com.mouse.cricket.exception.SchedulerInitializationException;
import com.mouse.cricket.exception.StoreException;
import com.mouse.cricket.extractor.ExtractorSession;
import com.mouse.cricket.extractor.PageExtractor;
import com.mouse.cricket.lifecycle.LifecycleDecision;
import com.mouse.cricket.lifecycle.MatchLifecycle;
import com.mouse.cricket.model.*;
import com.mouse.cricket.repository.MatchRepository;
import com.mouse.cricket.tasks.MatchTracker;
import com.mouse.cricket.tasks.MatchTrackerFactory;
import com.mouse.cricket.utils.MatchTimeParser;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps the match list fresh and walks every match through UPCOMING → LIVE → COMPLETED,
 * provisioning and retiring one {@link MatchTracker} per match on the way.
 *
 * <p>Discovery and ticks run on their own timer threads. The in-memory state lives in a
 * {@link MatchBook}; browser work always happens outside its lock, so status reads never
 * wait on a page.
 */
@Slf4j
@Component
public class MatchScheduler {

    private static final String EMOJI_INIT = "🚀";
    private static final String EMOJI_SUCCESS = "✅";
    private static final String EMOJI_ERROR = "❌";
    private static final String EMOJI_WARNING = "⚠️";
    private static final String EMOJI_SEARCH = "🔍";
    private static final String EMOJI_LIVE = "🏏";
    private static final String EMOJI_FINISH = "🏁";
    private static final String EMOJI_SHUTDOWN = "🛑";

    private final PageExtractor pageExtractor;
    private final MatchRepository matchRepository;
    private final MatchTrackerFactory trackerFactory;
    private final ScraperConfig config;
    private final Clock clock;
    private final MatchLifecycle lifecycle;

    private final MatchBook book = new MatchBook();
    private final ReentrantLock tickLock = new ReentrantLock();
    private final ReentrantLock refreshLock = new ReentrantLock();
    private final Set<MatchTracker> provisioning = ConcurrentHashMap.newKeySet();

    private volatile boolean running = false;
    private volatile boolean stopped = false;
    private volatile ExtractorSession discoverySession;
    private ScheduledExecutorService discoveryTimer;
    private ScheduledExecutorService tickTimer;

    public MatchScheduler(PageExtractor pageExtractor,
                          MatchRepository matchRepository,
                          MatchTrackerFactory trackerFactory,
                          ScraperConfig config,
                          Clock clock) {
        this.pageExtractor = pageExtractor;
        this.matchRepository = matchRepository;
        this.trackerFactory = trackerFactory;
        this.config = config;
        this.clock = clock;
        this.lifecycle = new MatchLifecycle(config.prerollWindow());
    }

    @PostConstruct
    public void init() {
        if (config.isAutoStart()) {
            start();
        } else {
            log.info("Auto-start disabled, scheduler waits for a manual start");
        }
    }

    // ==================== START ====================

    /**
     * Opens the discovery browser and schedules discovery (immediately, then every
     * discovery interval) and ticks.
     *
     * @throws SchedulerInitializationException if the discovery browser cannot be opened
     */
    public synchronized void start() {
        if (running) {
            log.warn("{} Scheduler already running", EMOJI_WARNING);
            return;
        }
        log.info("{} Starting match scheduler (discovery every {}ms, tick every {}ms)",
                EMOJI_INIT, config.getDiscoveryIntervalMs(), config.getTickIntervalMs());

        stopped = false;
        book.reopen();
        try {
            discoverySession = pageExtractor.open(config.getFixturesUrl());
        } catch (RuntimeException e) {
            log.error("{} Could not open discovery browser: {}", EMOJI_ERROR, e.getMessage());
            throw new SchedulerInitializationException("Failed to open discovery browser", e);
        }

        running = true;
        discoveryTimer = Executors.newSingleThreadScheduledExecutor(timerThread("match-discovery"));
        tickTimer = Executors.newSingleThreadScheduledExecutor(timerThread("match-tick"));
        discoveryTimer.scheduleAtFixedRate(() -> safeWrapper("Discovery", this::refreshMatches),
                0, config.getDiscoveryIntervalMs(), TimeUnit.MILLISECONDS);
        tickTimer.scheduleAtFixedRate(() -> safeWrapper("Tick", this::tick),
                config.getTickIntervalMs(), config.getTickIntervalMs(), TimeUnit.MILLISECONDS);

        log.info("{} Match scheduler started", EMOJI_SUCCESS);
    }

    private ThreadFactory timerThread(String name) {
        return r -> {
            Thread thread = new Thread(r, name);
            thread.setDaemon(true);
            thread.setUncaughtExceptionHandler((t, e) ->
                    log.error("{} Uncaught exception in thread {}: {}", EMOJI_ERROR, t.getName(), e.getMessage(), e));
            return thread;
        };
    }

    // ==================== DISCOVERY ====================

    /**
     * Re-reads the fixtures page and reconciles it with the in-memory list. Never throws:
     * any failure is logged and the previous list stays in place.
     */
    public void refreshMatches() {
        refreshLock.lock();
        try {
            if (stopped) {
                log.debug("Scheduler stopped, skipping discovery");
                return;
            }
            List<DiscoveredMatch> discovered = pageExtractor.listMatches(discoverySession());
            List<Match> parsed = toMatches(discovered);
            List<Match> reconciled = book.reconcile(parsed);
            matchRepository.putMatchList(reconciled);
            reapplyStatusChanges(reconciled);
            log.info("{} Discovery: {} cards, {} usable, {} matches tracked in list",
                    EMOJI_SEARCH, discovered.size(), parsed.size(), reconciled.size());
        } catch (ExtractionException e) {
            log.error("{} Match discovery failed, discarding fixtures session: {}", EMOJI_ERROR, e.getMessage(), e);
            closeDiscoverySession();
        } catch (RuntimeException e) {
            log.error("{} Match discovery failed: {}", EMOJI_ERROR, e.getMessage(), e);
        } finally {
            refreshLock.unlock();
        }
    }

    // A tick may have persisted a transition between reconcile and the list write above.
    private void reapplyStatusChanges(List<Match> written) {
        Map<String, MatchStatus> current = new HashMap<>();
        book.snapshot().forEach(m -> current.put(m.getId(), m.getStatus()));
        for (Match match : written) {
            MatchStatus now = current.get(match.getId());
            if (now != null && now != match.getStatus()) {
                persistStatus(match.getId(), now);
            }
        }
    }

    private ExtractorSession discoverySession() {
        ExtractorSession current = discoverySession;
        if (current == null || !current.isOpen()) {
            log.info("Opening discovery session on {}", config.getFixturesUrl());
            current = pageExtractor.open(config.getFixturesUrl());
            discoverySession = current;
        }
        return current;
    }

    private List<Match> toMatches(List<DiscoveredMatch> discovered) {
        ZoneId zone = config.defaultZoneId();
        Map<String, Match> byId = new LinkedHashMap<>();
        for (DiscoveredMatch card : discovered) {
            String id = card.getId();
            if (id == null || id.isBlank()) {
                log.warn("{} Dropping fixture without id: {}", EMOJI_WARNING, card.getTeams());
                continue;
            }
            if (byId.containsKey(id)) {
                log.debug("Duplicate fixture {} ignored", id);
                continue;
            }
            Optional<Instant> start = MatchTimeParser.parse(card.getDateTime(), zone);
            if (start.isEmpty()) {
                log.warn("{} Dropping fixture {}: cannot parse start time '{}'", EMOJI_WARNING, id, card.getDateTime());
                continue;
            }
            byId.put(id, Match.builder()
                    .id(id)
                    .teams(card.getTeams())
                    .format(card.getFormat())
                    .url(card.getUrl())
                    .scheduledStart(start.get())
                    .status(MatchStatus.UPCOMING)
                    .build());
        }
        return new ArrayList<>(byId.values());
    }

    // ==================== TICK ====================

    /**
     * Evaluates every match once against the lifecycle rules.
     *
     * @return false if another tick was already running and this one was skipped
     */
    public boolean tick() {
        if (!tickLock.tryLock()) {
            log.debug("Tick already in progress, skipping");
            return false;
        }
        try {
            evaluateTransitions();
            return true;
        } finally {
            tickLock.unlock();
        }
    }

    private void evaluateTransitions() {
        Instant now = clock.instant();
        List<Match> snapshot = book.snapshot();
        Map<String, MatchTracker> trackers = book.trackers();
        int provisioned = 0;
        int wentLive = 0;
        int completed = 0;

        for (Match match : snapshot) {
            try {
                MatchTracker tracker = trackers.get(match.getId());
                boolean ended = match.getStatus() == MatchStatus.LIVE && tracker != null && tracker.checkIfEnded();
                LifecycleDecision decision = lifecycle.decide(
                        match.getStatus(), now, match.getScheduledStart(), tracker != null, ended);

                switch (decision.action()) {
                    case PROVISION -> {
                        if (provision(match)) {
                            provisioned++;
                        }
                    }
                    case GO_LIVE -> {
                        goLive(match, tracker);
                        wentLive++;
                    }
                    case COMPLETE -> {
                        complete(match, tracker);
                        completed++;
                    }
                    case NONE -> {
                    }
                }
            } catch (RuntimeException e) {
                log.error("{} Error evaluating match {}: {}", EMOJI_ERROR, match.getId(), e.getMessage(), e);
            }
        }

        if (provisioned + wentLive + completed > 0) {
            log.info("Tick: {} provisioned, {} went live, {} completed", provisioned, wentLive, completed);
        } else {
            log.debug("Tick: no transitions across {} matches", snapshot.size());
        }
    }

    private boolean provision(Match match) {
        log.info("{} Match {} starts at {}, provisioning tracker", EMOJI_INIT, match.getId(), match.getScheduledStart());
        MatchTracker tracker = trackerFactory.create(match);
        provisioning.add(tracker);
        try {
            tracker.provision();
        } catch (ProvisioningException e) {
            log.error("{} Could not provision match {} after {} attempts, retrying next tick",
                    EMOJI_ERROR, e.getMatchId(), e.getAttempts());
            return false;
        } finally {
            provisioning.remove(tracker);
        }

        if (!book.register(match, tracker)) {
            log.warn("{} Tracker for match {} not registered, releasing it", EMOJI_WARNING, match.getId());
            tracker.stop();
            return false;
        }
        return true;
    }

    private void goLive(Match match, MatchTracker tracker) {
        tracker.startLiveTracking();
        if (!book.markLive(match, tracker)) {
            log.warn("{} Tracker of match {} was released before going live", EMOJI_WARNING, match.getId());
            return;
        }
        log.info("{} Match {} is LIVE ({})", EMOJI_LIVE, match.getId(), match.getTeams());
        persistStatus(match.getId(), MatchStatus.LIVE);
    }

    private void complete(Match match, MatchTracker tracker) {
        tracker.stop();
        book.markCompleted(match);
        log.info("{} Match {} COMPLETED ({})", EMOJI_FINISH, match.getId(), match.getTeams());
        persistStatus(match.getId(), MatchStatus.COMPLETED);
    }

    private void persistStatus(String matchId, MatchStatus status) {
        try {
            matchRepository.putMatchStatus(matchId, status);
        } catch (StoreException e) {
            log.error("{} Failed to persist status {} for match {}: {}", EMOJI_ERROR, status, matchId, e.getMessage());
        }
    }

    // ==================== SHUTDOWN ====================

    /**
     * Cancels both timers, stops every tracker in parallel within the shutdown timeout and
     * closes the discovery browser. Idempotent.
     */
    public synchronized void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        running = false;
        log.info("{} Stopping match scheduler", EMOJI_SHUTDOWN);

        shutdownTimer(discoveryTimer);
        shutdownTimer(tickTimer);
        discoveryTimer = null;
        tickTimer = null;

        List<MatchTracker> trackers = book.closeAndDrain();
        trackers.addAll(provisioning);
        stopTrackers(trackers);
        closeDiscoverySession();

        log.info("{} Match scheduler stopped", EMOJI_SUCCESS);
    }

    @PreDestroy
    public void destroy() {
        stop();
    }

    private void shutdownTimer(ScheduledExecutorService timer) {
        if (timer == null) {
            return;
        }
        timer.shutdownNow();
        try {
            if (!timer.awaitTermination(config.getTrackerStopTimeoutMs(), TimeUnit.MILLISECONDS)) {
                log.warn("{} Timer did not terminate in time", EMOJI_WARNING);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void stopTrackers(List<MatchTracker> trackers) {
        if (trackers.isEmpty()) {
            return;
        }
        log.info("Stopping {} trackers", trackers.size());
        ExecutorService stopper = Executors.newFixedThreadPool(trackers.size(), r -> {
            Thread thread = new Thread(r, "tracker-stop");
            thread.setDaemon(true);
            return thread;
        });
        List<Future<?>> pending = new ArrayList<>();
        for (MatchTracker tracker : trackers) {
            pending.add(stopper.submit(tracker::stop));
        }

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.getShutdownTimeoutMs());
        for (Future<?> future : pending) {
            long remaining = deadline - System.nanoTime();
            try {
                future.get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                log.warn("{} Trackers did not stop within {}ms", EMOJI_WARNING, config.getShutdownTimeoutMs());
                break;
            } catch (ExecutionException e) {
                log.error("{} Tracker stop failed: {}", EMOJI_ERROR, e.getCause().getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        stopper.shutdownNow();
    }

    private void closeDiscoverySession() {
        ExtractorSession current = discoverySession;
        discoverySession = null;
        if (current == null) {
            return;
        }
        try {
            pageExtractor.close(current);
        } catch (RuntimeException e) {
            log.warn("{} Closing discovery session failed: {}", EMOJI_WARNING, e.getMessage());
        }
    }

    // ==================== STATUS ====================

    public SchedulerStatus getStatus() {
        return book.status(running);
    }

    /** In-memory match list, copies only. */
    public List<Match> getMatches() {
        return book.snapshot();
    }

    public List<Match> getPersistedMatches() {
        return matchRepository.getMatchList();
    }

    public MatchData getMatchData(String matchId) {
        return matchRepository.getMatchData(matchId);
    }

    public StorageStats getStorageStats() {
        return matchRepository.getStorageStats();
    }

    public boolean isRunning() {
        return running;
    }

    private void safeWrapper(String name, Runnable r) {
        try {
            r.run();
        } catch (Throwable t) {
            log.error("{} {} error: {}", EMOJI_ERROR, name, t.getMessage());
        }
    }
}
