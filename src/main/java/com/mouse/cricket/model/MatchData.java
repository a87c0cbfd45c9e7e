package com.mouse.cricket.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchData {
    private JsonNode info;
    private JsonNode squads;
    private JsonNode live;
    private JsonNode scorecard;
}
