package com.cataphract.service;

import com.cataphract.config.RulesConfig;
import com.cataphract.dto.MercenaryUpkeepResult;
import com.cataphract.model.Army;
import com.cataphract.model.Campaign;
import com.cataphract.model.DayPart;
import com.cataphract.model.Detachment;
import com.cataphract.model.MercenaryContract;
import com.cataphract.model.MercenaryContractStatus;
import com.cataphract.model.UnitType;
import com.cataphract.rng.SeededRng;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Service responsible for mercenary upkeep.
 * <p>
 * Wages are settled from the army's carried loot for every day since the
 * last settlement. An army that cannot pay loses morale, and once the
 * company has gone unpaid past the grace period it may desert.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MercenaryService {

    private final SeededRng rng;
    private final MoraleService moraleService;

    public List<MercenaryUpkeepResult> processDailyUpkeep(Campaign campaign, RulesConfig rules) {
        List<MercenaryUpkeepResult> results = new ArrayList<>();
        for (MercenaryContract contract : campaign.getMercenaryContracts().values()) {
            if (!contract.getStatus().isPayable() || contract.getArmyId() == null) {
                continue;
            }
            Army army = campaign.getArmies().get(contract.getArmyId());
            if (army == null) {
                continue;
            }
            int daysDue = campaign.getCurrentDay() - contract.getLastUpkeepDay();
            if (daysDue <= 0) {
                continue;
            }
            results.add(settle(campaign, contract, army, daysDue, rules));
        }
        return results;
    }

    /**
     * Loot owed per day: soldiers of each category times the negotiated or default rate.
     */
    public int dailyUpkeepCost(Campaign campaign, MercenaryContract contract, Army army, RulesConfig rules) {
        int infantry = 0;
        int cavalry = 0;
        for (Detachment detachment : army.getDetachments()) {
            UnitType unitType = campaign.getUnitTypes().get(detachment.getUnitTypeId());
            if (unitType != null && unitType.isCavalry()) {
                cavalry += detachment.getSoldiers();
            } else {
                infantry += detachment.getSoldiers();
            }
        }
        RulesConfig.Mercenaries mercenaries = rules.getMercenaries();
        return infantry * rate(contract, MercenaryContract.RATE_INFANTRY, mercenaries.getInfantryUpkeepPerDay())
                + cavalry * rate(contract, MercenaryContract.RATE_CAVALRY, mercenaries.getCavalryUpkeepPerDay());
    }

    private MercenaryUpkeepResult settle(Campaign campaign, MercenaryContract contract, Army army, int daysDue,
                                         RulesConfig rules) {
        RulesConfig.Mercenaries mercenaries = rules.getMercenaries();
        int totalDue = dailyUpkeepCost(campaign, contract, army, rules) * daysDue;
        contract.setLastUpkeepDay(campaign.getCurrentDay());

        if (army.getLootCarried() >= totalDue) {
            army.setLootCarried(army.getLootCarried() - totalDue);
            contract.setDaysUnpaid(0);
            contract.setStatus(MercenaryContractStatus.ACTIVE);
            return new MercenaryUpkeepResult(contract.getId(), army.getId(), totalDue, true, false);
        }

        contract.setDaysUnpaid(contract.getDaysUnpaid() + daysDue);
        contract.setStatus(MercenaryContractStatus.UNPAID);
        moraleService.adjustMorale(army, -mercenaries.getMoralePenaltyUnpaid());
        log.debug("Contract {} unpaid for {} day(s): army {} owes {} loot",
                contract.getId(), contract.getDaysUnpaid(), army.getId(), totalDue);

        boolean deserted = contract.getDaysUnpaid() > mercenaries.getGraceDaysWithoutPay()
                && rollDesertion(campaign, contract, mercenaries);
        if (deserted) {
            contract.setStatus(MercenaryContractStatus.TERMINATED);
            army.putStatusEffect(Army.EFFECT_MERCENARIES_DESERTED,
                    Map.of("contract_id", contract.getId(), "day", campaign.getCurrentDay()));
            moraleService.adjustMorale(army, -mercenaries.getMoralePenaltyUnpaid());
            log.info("Mercenaries of contract {} deserted army {}", contract.getId(), army.getId());
        }
        return new MercenaryUpkeepResult(contract.getId(), army.getId(), totalDue, false, deserted);
    }

    private boolean rollDesertion(Campaign campaign, MercenaryContract contract, RulesConfig.Mercenaries mercenaries) {
        String seed = rng.seed(campaign.getId(), campaign.getCurrentDay(), DayPart.NIGHT,
                "mercenary-desertion:" + contract.getId());
        int roll = rng.rollDice(seed, "1d" + mercenaries.getDesertionChanceDenominator()).total();
        return roll <= mercenaries.getDesertionChanceNumerator();
    }

    private static int rate(MercenaryContract contract, String category, int fallback) {
        Integer negotiated = contract.getNegotiatedRates() != null ? contract.getNegotiatedRates().get(category) : null;
        return negotiated != null && negotiated > 0 ? negotiated : fallback;
    }
}
