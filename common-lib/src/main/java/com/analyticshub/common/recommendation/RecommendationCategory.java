package com.analyticshub.common.recommendation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum RecommendationCategory {

    COST_OPTIMIZATION("cost-optimization"),
    PERFORMANCE_IMPROVEMENT("performance-improvement"),
    RISK_MITIGATION("risk-mitigation"),
    CAPACITY_PLANNING("capacity-planning"),
    GOVERNANCE_COMPLIANCE("governance-compliance"),
    STRATEGIC_INITIATIVE("strategic-initiative");

    private final String wireName;

    RecommendationCategory(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static RecommendationCategory fromWireName(String name) {
        return Arrays.stream(values())
            .filter(c -> c.wireName.equals(name))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown recommendation category: " + name));
    }
}
