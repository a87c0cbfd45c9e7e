package com.mouse.cricket.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.mouse.cricket.enums.SnapshotKind;
import com.mouse.cricket.exception.ExtractionException;
import com.mouse.cricket.extractor.ExtractorSession;
import com.mouse.cricket.extractor.PageExtractor;
import com.mouse.cricket.model.DiscoveredMatch;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory extractor. Counts open sessions so tests can assert that every session gets
 * released, and lets tests script failures and ended pages per url.
 */
public class FakePageExtractor implements PageExtractor {

    private final AtomicInteger sessionCounter = new AtomicInteger();
    private final Set<String> openSessions = ConcurrentHashMap.newKeySet();
    private final Map<String, AtomicInteger> opensByUrl = new ConcurrentHashMap<>();
    private final Map<SnapshotKind, AtomicInteger> fetches = new ConcurrentHashMap<>();
    private final Set<String> failingUrls = ConcurrentHashMap.newKeySet();
    private final Set<String> endedUrls = ConcurrentHashMap.newKeySet();
    private final List<DiscoveredMatch> fixtures = new CopyOnWriteArrayList<>();
    private volatile long openDelayMs = 0;
    private volatile boolean failListing = false;

    public void setFixtures(List<DiscoveredMatch> cards) {
        fixtures.clear();
        fixtures.addAll(cards);
    }

    public void failOpening(String url) {
        failingUrls.add(url);
    }

    public void markEnded(String url) {
        endedUrls.add(url);
    }

    public void setOpenDelayMs(long openDelayMs) {
        this.openDelayMs = openDelayMs;
    }

    public void setFailListing(boolean failListing) {
        this.failListing = failListing;
    }

    public int openSessionCount() {
        return openSessions.size();
    }

    public int opensFor(String url) {
        AtomicInteger count = opensByUrl.get(url);
        return count == null ? 0 : count.get();
    }

    public int fetchCount(SnapshotKind kind) {
        AtomicInteger count = fetches.get(kind);
        return count == null ? 0 : count.get();
    }

    @Override
    public ExtractorSession open(String url) {
        opensByUrl.computeIfAbsent(url, u -> new AtomicInteger()).incrementAndGet();
        if (openDelayMs > 0) {
            try {
                Thread.sleep(openDelayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ExtractionException("Interrupted while opening " + url, e);
            }
        }
        if (failingUrls.contains(url)) {
            throw new ExtractionException("Cannot load " + url);
        }
        FakeSession session = new FakeSession("fake-" + sessionCounter.incrementAndGet(), url);
        openSessions.add(session.sessionId());
        return session;
    }

    @Override
    public JsonNode fetch(ExtractorSession session, SnapshotKind kind) {
        fetches.computeIfAbsent(kind, k -> new AtomicInteger()).incrementAndGet();
        return JsonNodeFactory.instance.objectNode()
                .put("kind", kind.getKey())
                .put("url", session.url());
    }

    @Override
    public boolean isEnded(ExtractorSession session) {
        return endedUrls.contains(session.url());
    }

    @Override
    public List<DiscoveredMatch> listMatches(ExtractorSession session) {
        if (failListing) {
            throw new ExtractionException("Fixtures page did not load");
        }
        return new ArrayList<>(fixtures);
    }

    @Override
    public void close(ExtractorSession session) {
        if (session instanceof FakeSession fake) {
            fake.open = false;
        }
        openSessions.remove(session.sessionId());
    }

    private static final class FakeSession implements ExtractorSession {
        private final String id;
        private final String url;
        private volatile boolean open = true;

        private FakeSession(String id, String url) {
            this.id = id;
            this.url = url;
        }

        @Override
        public String sessionId() {
            return id;
        }

        @Override
        public String url() {
            return url;
        }

        @Override
        public boolean isOpen() {
            return open;
        }
    }
}
