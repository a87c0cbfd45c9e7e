package com.mouse.cricket.extractor;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.mouse.cricket.exception.ExtractionException;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Playwright objects are confined to the thread that created them, so every call
 * for this session is marshalled onto the session's own single thread.
 */
@Slf4j
public class PlaywrightSession implements ExtractorSession {

    private static final AtomicInteger SEQUENCE = new AtomicInteger(0);

    private final String sessionId;
    private final String url;
    private final ExecutorService sessionThread;
    private final AtomicBoolean open = new AtomicBoolean(true);

    @Getter @Setter private Playwright playwright;
    @Getter @Setter private Browser browser;
    @Getter @Setter private BrowserContext context;
    @Getter @Setter private Page page;

    public PlaywrightSession(String url) {
        this.sessionId = "session-" + SEQUENCE.incrementAndGet();
        this.url = url;
        this.sessionThread = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "playwright-" + sessionId);
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public String sessionId() {
        return sessionId;
    }

    @Override
    public String url() {
        return url;
    }

    @Override
    public boolean isOpen() {
        return open.get();
    }

    /**
     * Runs {@code action} on the session thread and waits for it.
     *
     * @throws ExtractionException if the session is closed, the action fails or it does not finish in time
     */
    public <T> T call(Callable<T> action, long timeoutMs) {
        if (!open.get()) {
            throw new ExtractionException("Session " + sessionId + " is closed");
        }
        Future<T> future;
        try {
            future = sessionThread.submit(action);
        } catch (RejectedExecutionException e) {
            throw new ExtractionException("Session " + sessionId + " is closed", e);
        }
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ExtractionException("Session " + sessionId + " did not answer within " + timeoutMs + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ExtractionException extraction) {
                throw extraction;
            }
            throw new ExtractionException(cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExtractionException("Interrupted while waiting for session " + sessionId, e);
        }
    }

    /**
     * Closes page, context, browser and driver on the session thread, then stops the thread.
     * Idempotent.
     */
    public void close(long timeoutMs) {
        if (!open.compareAndSet(true, false)) {
            return;
        }
        Future<?> closing = sessionThread.submit(() -> {
            safeClose(page);
            safeClose(context);
            safeClose(browser);
            safeClose(playwright);
        });
        try {
            closing.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Session {} did not close within {}ms, abandoning its thread", sessionId, timeoutMs);
        } catch (ExecutionException e) {
            log.warn("Session {} close failed: {}", sessionId, e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            sessionThread.shutdownNow();
        }
    }

    private void safeClose(AutoCloseable c) {
        if (c == null) return;
        try {
            c.close();
        } catch (Exception e) {
            log.debug("Ignoring close failure in {}: {}", sessionId, e.getMessage());
        }
    }
}
