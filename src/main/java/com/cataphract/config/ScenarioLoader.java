package com.cataphract.config;

import com.cataphract.model.Campaign;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Loads every scenario at startup, first from {@code classpath:scenarios/*.json}
 * and then from a {@code ./scenarios/} folder next to the running jar. A file
 * in the folder replaces a built-in scenario with the same id.
 */
@Component
@Slf4j
public class ScenarioLoader {

    private final ObjectMapper objectMapper;

    private final Map<String, ScenarioDefinition> scenarios = new LinkedHashMap<>();

    public ScenarioLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void loadScenarios() {
        loadClasspathScenarios();
        loadExternalScenarios();

        if (scenarios.isEmpty()) {
            log.warn("No scenario definitions found; campaigns can only be created from scratch");
        } else {
            log.info("Loaded {} scenario(s): {}", scenarios.size(), scenarios.keySet());
        }
    }

    public List<ScenarioDefinition> getAvailableScenarios() {
        return List.copyOf(scenarios.values());
    }

    /**
     * @throws IllegalArgumentException if the scenario id is unknown
     */
    public ScenarioDefinition getScenario(String scenarioId) {
        ScenarioDefinition scenario = scenarios.get(scenarioId);
        if (scenario == null) {
            throw new IllegalArgumentException("Unknown scenario: " + scenarioId
                    + ". Available scenarios: " + scenarios.keySet());
        }
        return scenario;
    }

    /**
     * Fresh, independent copy of a scenario's starting campaign.
     */
    public Campaign newCampaign(String scenarioId) {
        ScenarioDefinition scenario = getScenario(scenarioId);
        byte[] json = objectMapper.writeValueAsBytes(scenario.campaign());
        return objectMapper.readValue(json, Campaign.class);
    }

    // ── classpath scenarios ─────────────────────────────────────────────

    private void loadClasspathScenarios() {
        try {
            var resolver = new PathMatchingResourcePatternResolver();
            for (Resource resource : resolver.getResources("classpath:scenarios/*.json")) {
                try (InputStream is = resource.getInputStream()) {
                    register(objectMapper.readValue(is, ScenarioDefinition.class), resource.getFilename());
                } catch (IOException | JacksonException e) {
                    log.error("Failed to load classpath scenario: {}", resource.getFilename(), e);
                }
            }
        } catch (IOException e) {
            log.warn("Could not scan classpath for scenarios: {}", e.getMessage());
        }
    }

    // ── external scenarios (./scenarios/ folder) ────────────────────────

    private void loadExternalScenarios() {
        Path externalDir = Paths.get("scenarios");
        if (!Files.isDirectory(externalDir)) {
            log.debug("No external scenarios directory found at '{}'", externalDir.toAbsolutePath());
            return;
        }
        try (Stream<Path> files = Files.list(externalDir)) {
            files.filter(p -> p.toString().endsWith(".json"))
                    .sorted()
                    .forEach(this::loadExternalScenario);
        } catch (IOException e) {
            log.error("Error reading external scenarios directory", e);
        }
    }

    private void loadExternalScenario(Path path) {
        try {
            register(objectMapper.readValue(path.toFile(), ScenarioDefinition.class), path.toString());
        } catch (JacksonException e) {
            log.error("Failed to load custom scenario: {}", path, e);
        }
    }

    private void register(ScenarioDefinition scenario, String source) {
        if (scenario.id() == null || scenario.campaign() == null) {
            log.error("Scenario from {} has no id or campaign; skipped", source);
            return;
        }
        scenarios.put(scenario.id(), scenario);
        log.info("Loaded scenario '{}' ({}) from {}", scenario.name(), scenario.id(), source);
    }
}
