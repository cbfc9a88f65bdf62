package com.cataphract.config;

import com.cataphract.model.Campaign;

/**
 * A starting position, loaded from a JSON file.
 *
 * @param id          unique slug, e.g. "border-war"
 * @param name        human-readable name
 * @param description short description of the situation
 * @param campaign    the campaign as it stands on day 0
 */
public record ScenarioDefinition(
        String id,
        String name,
        String description,
        Campaign campaign
) {}
