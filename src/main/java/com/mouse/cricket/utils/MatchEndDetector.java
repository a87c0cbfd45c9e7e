package com.mouse.cricket.utils;

import java.util.List;
import java.util.Locale;

public final class MatchEndDetector {

    private static final List<String> TERMINAL_KEYWORDS = List.of(
            "match ended",
            "completed",
            "won by",
            "drawn"
    );

    private MatchEndDetector() {}

    /** True when the page status text reports a finished match. */
    public static boolean isTerminal(String statusText) {
        if (statusText == null || statusText.isBlank()) {
            return false;
        }
        String status = statusText.toLowerCase(Locale.ROOT);
        return TERMINAL_KEYWORDS.stream().anyMatch(status::contains);
    }
}
