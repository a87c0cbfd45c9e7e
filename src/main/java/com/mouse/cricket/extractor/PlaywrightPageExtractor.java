package com.mouse.cricket.extractor;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.WaitUntilState;
import com.mouse.cricket.config.ScraperConfig;
import com.mouse.cricket.enums.SnapshotKind;
import com.mouse.cricket.exception.ExtractionException;
import com.mouse.cricket.manager.BrowserManager;
import com.mouse.cricket.manager.ProfileManager;
import com.mouse.cricket.model.DiscoveredMatch;
import com.mouse.cricket.model.profile.UserAgentProfile;
import com.mouse.cricket.utils.MatchEndDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.List;
import java.util.Locale;

/**
 * {@link PageExtractor} backed by one headless Chromium per session.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlaywrightPageExtractor implements PageExtractor {

    private static final String TAB_SELECTOR =
            "[role='tab'], li[class*='tab'], li[class*='nav-item'], div[class*='tab'], div[class*='nav-item'], a[class*='nav-link']";
    private static final long CLOSE_TIMEOUT_MS = 10_000;

    private final ScraperConfig scraperConfig;
    private final BrowserManager browserManager;
    private final ProfileManager profileManager;
    private final ObjectMapper objectMapper;

    @Override
    public ExtractorSession open(String url) {
        PlaywrightSession session = new PlaywrightSession(url);
        log.info("🌐 Opening {} on {}", session.sessionId(), url);
        try {
            session.call(() -> {
                UserAgentProfile profile = profileManager.getNextProfile();
                session.setPlaywright(Playwright.create());
                session.setBrowser(browserManager.launchBrowser(session.getPlaywright()));
                session.setContext(session.getBrowser().newContext(browserManager.createContextOptions(profile)));
                session.setPage(session.getContext().newPage());
                navigate(session.getPage(), url);
                return null;
            }, operationTimeoutMs());
            return session;
        } catch (ExtractionException e) {
            session.close(CLOSE_TIMEOUT_MS);
            throw new ExtractionException("Failed to open session on " + url + ": " + e.getMessage(), e);
        }
    }

    @Override
    public JsonNode fetch(ExtractorSession session, SnapshotKind kind) {
        PlaywrightSession pw = playwright(session);
        return pw.call(() -> {
            Page page = pw.getPage();
            clickTab(page, kind);
            Object raw = page.evaluate(ExtractionScripts.forKind(kind));
            return raw == null ? null : objectMapper.valueToTree(raw);
        }, operationTimeoutMs());
    }

    @Override
    public boolean isEnded(ExtractorSession session) {
        PlaywrightSession pw = playwright(session);
        String status = pw.call(() -> {
            Object raw = pw.getPage().evaluate(ExtractionScripts.MATCH_STATUS);
            return raw == null ? "" : raw.toString();
        }, operationTimeoutMs());
        log.debug("Status text on {}: '{}'", session.url(), status);
        return MatchEndDetector.isTerminal(status);
    }

    @Override
    public List<DiscoveredMatch> listMatches(ExtractorSession session) {
        PlaywrightSession pw = playwright(session);
        List<DiscoveredMatch> cards = pw.call(() -> {
            Page page = pw.getPage();
            navigate(page, session.url());
            Object raw = page.evaluate(ExtractionScripts.MATCH_LIST);
            if (raw == null) {
                return List.<DiscoveredMatch>of();
            }
            return objectMapper.convertValue(raw, new TypeReference<List<DiscoveredMatch>>() {});
        }, operationTimeoutMs());

        URI base = URI.create(session.url());
        cards.forEach(card -> card.setUrl(resolve(base, card.getUrl())));
        return cards;
    }

    @Override
    public void close(ExtractorSession session) {
        if (session instanceof PlaywrightSession pw) {
            log.info("🔌 Closing {} ({})", pw.sessionId(), pw.url());
            pw.close(CLOSE_TIMEOUT_MS);
        }
    }

    private void navigate(Page page, String url) {
        page.navigate(url, new Page.NavigateOptions()
                .setTimeout(scraperConfig.getNavigationTimeoutMs())
                .setWaitUntil(WaitUntilState.DOMCONTENTLOADED));
        page.waitForTimeout(scraperConfig.getPageLoadWaitMs());
    }

    // Runs on the session thread.
    private void clickTab(Page page, SnapshotKind kind) {
        String label = kind.getTabLabel().toLowerCase(Locale.ROOT);
        try {
            Locator tabs = page.locator(TAB_SELECTOR);
            int count = tabs.count();
            for (int i = 0; i < count; i++) {
                Locator tab = tabs.nth(i);
                String text = tab.innerText().toLowerCase(Locale.ROOT);
                String classes = tab.getAttribute("class");
                boolean active = classes != null && classes.contains("active");
                if (text.contains(label) && !active) {
                    tab.click();
                    page.waitForSelector(kind.getContainerSelector(), new Page.WaitForSelectorOptions()
                            .setTimeout(scraperConfig.getTabWaitTimeoutMs()));
                    page.waitForTimeout(1000);
                    return;
                }
            }
        } catch (PlaywrightException e) {
            log.warn("Could not click tab '{}': {}", kind.getTabLabel(), e.getMessage());
        }
    }

    private String resolve(URI base, String href) {
        if (href == null || href.isBlank()) {
            return href;
        }
        try {
            return base.resolve(href).toString();
        } catch (IllegalArgumentException e) {
            log.warn("Keeping unresolvable match link '{}': {}", href, e.getMessage());
            return href;
        }
    }

    private PlaywrightSession playwright(ExtractorSession session) {
        if (session instanceof PlaywrightSession pw) {
            return pw;
        }
        throw new ExtractionException("Not a Playwright session: " + session);
    }

    private long operationTimeoutMs() {
        return scraperConfig.getNavigationTimeoutMs()
                + scraperConfig.getPageLoadWaitMs()
                + scraperConfig.getTabWaitTimeoutMs()
                + 5_000;
    }
}
