package com.cataphract.order;

import com.cataphract.config.RulesConfig;
import com.cataphract.model.Campaign;
import com.cataphract.model.DayPart;
import com.cataphract.rng.SeededRng;

/**
 * Shared state handed to every order handler.
 */
public record OrderContext(Campaign campaign, DayPart dayPart, RulesConfig rules) {

    /**
     * Seed for a roll made while resolving an order in this day-part.
     */
    public String seed(SeededRng rng, String label) {
        return rng.seed(campaign.getId(), campaign.getCurrentDay(), dayPart, label);
    }
}
