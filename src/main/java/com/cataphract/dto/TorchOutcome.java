package com.cataphract.dto;

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
public class TorchOutcome {
    private boolean success;
    private List<Integer> torchedHexes;
    @Builder.Default
    private Map<Integer, String> failedHexes = new LinkedHashMap<>();
    private boolean revoltTriggered;
}
