package com.mouse.cricket.manager;

import com.mouse.cricket.enums.MatchStatus;
import com.mouse.cricket.model.Match;
import com.mouse.cricket.model.SchedulerStatus;
import com.mouse.cricket.tasks.MatchTracker;

import java.util.*;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * In-memory match list plus the trackers registered against it. A tracker is registered
 * exactly while its match is UPCOMING (provisioned) or LIVE; the mutators below keep both
 * maps consistent under one lock. Nothing in here performs I/O.
 */
public class MatchBook {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Match> matches = new LinkedHashMap<>();
    private final Map<String, MatchTracker> trackers = new HashMap<>();
    private boolean closed;

    public List<Match> snapshot() {
        lock.lock();
        try {
            return matches.values().stream()
                    .map(m -> m.toBuilder().build())
                    .collect(Collectors.toList());
        } finally {
            lock.unlock();
        }
    }

    public Map<String, MatchTracker> trackers() {
        lock.lock();
        try {
            return new HashMap<>(trackers);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces membership with {@code discovered}. Known ids keep their current record and
     * status; tracked ids missing from {@code discovered} are carried forward.
     *
     * @return the reconciled list, in discovery order followed by carried-forward matches
     */
    public List<Match> reconcile(List<Match> discovered) {
        lock.lock();
        try {
            Map<String, Match> next = new LinkedHashMap<>();
            for (Match match : discovered) {
                Match known = matches.get(match.getId());
                next.put(match.getId(), known != null ? known : match);
            }
            for (String trackedId : trackers.keySet()) {
                if (!next.containsKey(trackedId) && matches.containsKey(trackedId)) {
                    next.put(trackedId, matches.get(trackedId));
                }
            }
            matches.clear();
            matches.putAll(next);
            return next.values().stream()
                    .map(m -> m.toBuilder().build())
                    .collect(Collectors.toList());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Registers a freshly provisioned tracker.
     *
     * @return false when the book is closed or the match already has a tracker; the caller
     *         then owns the tracker and must stop it
     */
    public boolean register(Match match, MatchTracker tracker) {
        lock.lock();
        try {
            if (closed || trackers.containsKey(match.getId())) {
                return false;
            }
            matches.putIfAbsent(match.getId(), match);
            trackers.put(match.getId(), tracker);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sets LIVE, provided {@code tracker} is still the one registered for the match.
     *
     * @return false when the tracker was drained in the meantime
     */
    public boolean markLive(Match match, MatchTracker tracker) {
        lock.lock();
        try {
            if (trackers.get(match.getId()) != tracker) {
                return false;
            }
            current(match).setStatus(MatchStatus.LIVE);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** Sets COMPLETED and unregisters the tracker in one step. */
    public MatchTracker markCompleted(Match match) {
        lock.lock();
        try {
            current(match).setStatus(MatchStatus.COMPLETED);
            return trackers.remove(match.getId());
        } finally {
            lock.unlock();
        }
    }

    // Discovery may have replaced the list while a tick was working on its snapshot.
    private Match current(Match snapshot) {
        return matches.computeIfAbsent(snapshot.getId(), id -> snapshot.toBuilder().build());
    }

    /**
     * Refuses further registrations and hands back every registered tracker. LIVE matches
     * fall back to UPCOMING so the next tick after a restart provisions them again.
     */
    public List<MatchTracker> closeAndDrain() {
        lock.lock();
        try {
            closed = true;
            List<MatchTracker> drained = new ArrayList<>(trackers.values());
            trackers.clear();
            matches.values().stream()
                    .filter(m -> m.getStatus() == MatchStatus.LIVE)
                    .forEach(m -> m.setStatus(MatchStatus.UPCOMING));
            return drained;
        } finally {
            lock.unlock();
        }
    }

    public void reopen() {
        lock.lock();
        try {
            closed = false;
        } finally {
            lock.unlock();
        }
    }

    public SchedulerStatus status(boolean running) {
        lock.lock();
        try {
            Map<MatchStatus, Integer> counts = new EnumMap<>(MatchStatus.class);
            for (MatchStatus status : MatchStatus.values()) {
                counts.put(status, 0);
            }
            for (Match match : matches.values()) {
                counts.merge(match.getStatus(), 1, Integer::sum);
            }
            List<String> activeIds = new ArrayList<>(trackers.keySet());
            Collections.sort(activeIds);
            return SchedulerStatus.builder()
                    .running(running)
                    .matchCount(matches.size())
                    .activeIds(activeIds)
                    .countsByStatus(counts)
                    .build();
        } finally {
            lock.unlock();
        }
    }
}
