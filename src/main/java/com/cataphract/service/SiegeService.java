package com.cataphract.service;

import com.cataphract.config.RulesConfig;
import com.cataphract.dto.SiegeAdvanceResult;
import com.cataphract.model.Siege;
import com.cataphract.model.SiegeStatus;
import com.cataphract.rng.SeededRng;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Service responsible for weekly siege progression.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SiegeService {

    private final SeededRng rng;

    /**
     * Lowers the threshold by the weekly modifiers and the engines on site,
     * then rolls 2d6: beating the threshold opens the gates.
     */
    public SiegeAdvanceResult advanceSiege(Siege siege, String seed, RulesConfig rules) {
        RulesConfig.Siege siegeRules = rules.getSiege();
        siege.setWeeksElapsed(siege.getWeeksElapsed() + 1);

        int threshold = siege.getCurrentThreshold() + siegeRules.getDefaultModifier();
        for (String modifier : siege.getThresholdModifiers()) {
            threshold += switch (modifier) {
                case Siege.MODIFIER_DISEASE -> siegeRules.getDiseaseModifier();
                case Siege.MODIFIER_RESUPPLY -> siegeRules.getResupplyModifier();
                case Siege.MODIFIER_ATTACKED -> siegeRules.getAttackedModifier();
                default -> 0;
            };
        }
        threshold -= siege.getSiegeEnginesCount() * siegeRules.getSiegeEngineReductionPerDetachment();
        siege.setCurrentThreshold(Math.max(siegeRules.getStarvationThreshold(), threshold));

        int roll = rng.rollDice(seed, "2d6").total();
        boolean gatesOpened = roll > siege.getCurrentThreshold();
        if (gatesOpened) {
            siege.setStatus(SiegeStatus.GATES_OPENED);
            log.info("Siege {} of stronghold {}: gates opened (roll {} over {})",
                    siege.getId(), siege.getStrongholdId(), roll, siege.getCurrentThreshold());
        }
        return new SiegeAdvanceResult(siege.getId(), siege.getCurrentThreshold(), roll, gatesOpened);
    }
}
