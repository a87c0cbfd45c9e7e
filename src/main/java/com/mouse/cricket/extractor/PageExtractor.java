package com.mouse.cricket.extractor;

import com.fasterxml.jackson.databind.JsonNode;
import com.mouse.cricket.enums.SnapshotKind;
import com.mouse.cricket.exception.ExtractionException;
import com.mouse.cricket.model.DiscoveredMatch;

import java.util.List;

/**
 * Pulls structured content out of match pages. Implementations own the browser
 * automation; callers only see sessions and payloads.
 */
public interface PageExtractor {

    /**
     * Opens a browser session on {@code url}.
     *
     * @throws ExtractionException if the browser cannot be started or the page cannot be loaded; retryable
     */
    ExtractorSession open(String url);

    /**
     * Current payload of the given kind, or {@code null} when the page does not show it.
     *
     * @throws ExtractionException on browser or script failure
     */
    JsonNode fetch(ExtractorSession session, SnapshotKind kind);

    /** Whether the page reports a finished match. */
    boolean isEnded(ExtractorSession session);

    /** Reloads the fixtures page held by {@code session} and reads every match card on it. */
    List<DiscoveredMatch> listMatches(ExtractorSession session);

    /** Releases the session. Safe to call more than once; never throws. */
    void close(ExtractorSession session);
}
