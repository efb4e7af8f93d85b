package com.sfuplan.prereq.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "prereq.suggestions")
public record SuggestionProperties(@DefaultValue("50") int defaultLimit,
                                   @DefaultValue("200") int maxLimit) {

    public int effectiveLimit(Integer requested) {
        if (requested == null || requested <= 0) return Math.min(defaultLimit, maxLimit);
        return Math.min(requested, maxLimit);
    }
}
