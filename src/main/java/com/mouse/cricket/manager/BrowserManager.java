package com.mouse.cricket.manager;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.options.ServiceWorkerPolicy;
import com.mouse.cricket.config.ScraperConfig;
import com.mouse.cricket.model.profile.UserAgentProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
@RequiredArgsConstructor
public class BrowserManager {

    private final ScraperConfig scraperConfig;

    public Browser launchBrowser(Playwright pw) {
        List<String> args = new ArrayList<>(scraperConfig.getBROWSER_FLAGS());

        if (!args.contains("--disable-dev-shm-usage")) {
            args.add("--disable-dev-shm-usage");
        }
        if (!args.contains("--no-sandbox")) {
            args.add("--no-sandbox");
        }

        return pw.chromium().launch(new BrowserType.LaunchOptions()
                .setHeadless(scraperConfig.isHeadless())
                .setTimeout(scraperConfig.getNavigationTimeoutMs())
                .setArgs(args));
    }

    public Browser.NewContextOptions createContextOptions(UserAgentProfile profile) {
        log.debug("Creating context options for profile {}", profile.getId());
        UserAgentProfile.Viewport viewport = profile.getViewport();
        Map<String, String> headers = profile.getHeaders() == null ? Map.of() : profile.getHeaders();

        Browser.NewContextOptions options = new Browser.NewContextOptions()
                .setUserAgent(profile.getUserAgent())
                .setLocale(profile.getLocale() == null ? "en-US" : profile.getLocale())
                .setExtraHTTPHeaders(headers)
                .setIgnoreHTTPSErrors(true)
                .setServiceWorkers(ServiceWorkerPolicy.BLOCK);

        if (viewport != null && viewport.getWidth() != null && viewport.getHeight() != null) {
            options.setViewportSize(viewport.getWidth(), viewport.getHeight());
        }
        if (profile.getTimeZone() != null) {
            options.setTimezoneId(profile.getTimeZone());
        }
        return options;
    }
}
