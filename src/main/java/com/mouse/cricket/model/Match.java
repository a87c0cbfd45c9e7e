package com.mouse.cricket.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.mouse.cricket.enums.MatchStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Match {
    private String id;
    private String teams;
    private String format;
    private String url;
    private Instant scheduledStart;

    @Builder.Default
    private MatchStatus status = MatchStatus.UPCOMING;
}
