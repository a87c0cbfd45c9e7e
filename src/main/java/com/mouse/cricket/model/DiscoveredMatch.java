package com.mouse.cricket.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One card of the fixtures page, as read from the page. {@code dateTime} is the
 * human-readable text shown on the card and still has to be parsed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DiscoveredMatch {
    private String id;
    private String teams;
    private String format;
    private String dateTime;
    private String url;
}
