package com.mouse.cricket.extractor;

/**
 * Handle to one open browser session bound to a single page. Owned by exactly one
 * tracker (or by the scheduler for the fixtures page).
 */
public interface ExtractorSession {

    String sessionId();

    String url();

    boolean isOpen();
}
