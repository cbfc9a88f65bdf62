package com.cataphract.dto;

import com.cataphract.model.MoraleConsequence;

import java.util.Map;

public record MoraleConsequenceReport(MoraleConsequence consequence, int roll, Map<String, Object> details) {

    public MoraleConsequenceReport {
        details = Map.copyOf(details);
    }
}
