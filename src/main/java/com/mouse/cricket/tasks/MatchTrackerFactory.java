package com.mouse.cricket.tasks;

import com.mouse.cricket.config.ScraperConfig;
import com.mouse.cricket.extractor.PageExtractor;
import com.mouse.cricket.model.Match;
import com.mouse.cricket.repository.MatchRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class MatchTrackerFactory {

    private final PageExtractor pageExtractor;
    private final MatchRepository matchRepository;
    private final ScraperConfig scraperConfig;

    public MatchTracker create(Match match) {
        return new MatchTracker(match, pageExtractor, matchRepository, scraperConfig);
    }
}
