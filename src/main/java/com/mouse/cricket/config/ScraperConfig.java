package com.mouse.cricket.config;

import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.List;

@Data
@Configuration
public class ScraperConfig {
    private final List<String> BROWSER_FLAGS = Arrays.asList(
            "--no-sandbox",
            "--disable-dev-shm-usage",
            "--disable-gpu",
            "--disable-blink-features=AutomationControlled",
            "--disable-infobars",
            "--disable-extensions",
            "--disable-notifications",
            "--mute-audio",
            "--no-first-run",
            "--lang=en-US"
    );

    // ==================== SOURCE ====================

    @Value("${scraper.fixtures.url:https://crex.live/fixtures/match-list}")
    private String fixturesUrl;

    @Value("${scraper.default-zone:UTC}")
    private String defaultZone;

    @Value("${scraper.auto-start:true}")
    private boolean autoStart;

    @Value("${scraper.data.dir:./data}")
    private String dataDir;

    // ==================== CADENCE ====================

    @Value("${scraper.discovery.interval.ms:900000}")
    private long discoveryIntervalMs;

    @Value("${scraper.tick.interval.ms:60000}")
    private long tickIntervalMs;

    @Value("${scraper.preroll.ms:300000}")
    private long prerollMs;

    @Value("${scraper.live.poll.interval.ms:30000}")
    private long livePollIntervalMs;

    // ==================== RETRY / SHUTDOWN ====================

    @Value("${scraper.retry.max.attempts:3}")
    private int maxRetryAttempts;

    @Value("${scraper.retry.delay.ms:5000}")
    private long retryDelayMs;

    @Value("${scraper.tracker.stop.timeout.ms:5000}")
    private long trackerStopTimeoutMs;

    @Value("${scraper.shutdown.timeout.ms:30000}")
    private long shutdownTimeoutMs;

    @Value("${scraper.session.lock.timeout.ms:10000}")
    private long sessionLockTimeoutMs;

    // ==================== BROWSER ====================

    @Value("${scraper.browser.headless:true}")
    private boolean headless;

    @Value("${scraper.page.load.wait.ms:5000}")
    private long pageLoadWaitMs;

    @Value("${scraper.navigation.timeout.ms:60000}")
    private long navigationTimeoutMs;

    @Value("${scraper.tab.wait.timeout.ms:10000}")
    private long tabWaitTimeoutMs;

    public Duration prerollWindow() {
        return Duration.ofMillis(prerollMs);
    }

    public ZoneId defaultZoneId() {
        return ZoneId.of(defaultZone);
    }
}
