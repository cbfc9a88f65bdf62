package com.cataphract.service;

import com.cataphract.config.RulesConfig;
import com.cataphract.dto.OperationResult;
import com.cataphract.model.Campaign;
import com.cataphract.model.Operation;
import com.cataphract.model.OperationOutcome;
import com.cataphract.model.TerritoryType;
import com.cataphract.rng.SeededRng;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Service responsible for resolving covert operations.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OperationsService {

    private final SeededRng rng;

    /**
     * Rolls 2d6 against {@code clamp(base - modifiers, 2, 12)} and records
     * the outcome on the operation.
     */
    public OperationResult resolve(Campaign campaign, Operation operation, String seed, RulesConfig rules) {
        RulesConfig.Operations ops = rules.getOperations();
        int modifier = operation.getDifficultyModifier();

        String complexity = operation.getComplexity() != null ? operation.getComplexity().toLowerCase() : "standard";
        if ("simple".equals(complexity)) {
            modifier += ops.getSimpleModifier();
        } else if ("complex".equals(complexity)) {
            modifier += ops.getComplexModifier();
        }
        if (operation.getTerritoryType() == TerritoryType.HOSTILE) {
            modifier += ops.getHostileTerritoryModifier();
        }

        int target = Math.max(2, Math.min(12, ops.getBaseSuccessTarget() - modifier));
        int roll = rng.rollDice(seed, "2d6").total();
        boolean success = roll >= target;

        operation.setExecutedOnDay(campaign.getCurrentDay());
        operation.setSuccessTarget(target);
        operation.setRoll(roll);
        operation.setOutcome(success ? OperationOutcome.SUCCESS : OperationOutcome.FAILURE);

        log.debug("Operation {} rolled {} against {}", operation.getId(), roll, target);
        return new OperationResult(success, success ? "operation success" : "operation failed", roll, target);
    }
}
