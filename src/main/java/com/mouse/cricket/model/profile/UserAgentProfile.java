package com.mouse.cricket.model.profile;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.*;

import java.util.Map;

/**
 * Browser identity applied to every context a tracker opens.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class UserAgentProfile {
    private String id;
    private String userAgent;
    private Viewport viewport;
    private String locale;
    private String timeZone;
    private Map<String, String> headers;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Viewport {
        private Integer width;
        private Integer height;
    }
}
