package com.cataphract.service;

import com.cataphract.dto.MoraleCheck;
import com.cataphract.dto.MoraleConsequenceReport;
import com.cataphract.model.Army;
import com.cataphract.model.Commander;
import com.cataphract.model.Detachment;
import com.cataphract.model.MoraleConsequence;
import com.cataphract.rng.SeededRng;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Service responsible for morale checks, morale adjustment and the
 * consequences of a failed check.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MoraleService {

    private static final String POET = "poet";
    private static final double MUTINY_DEFECT_CHANCE = 19.0 / 20.0;
    private static final double SPLIT_CHANCE = 3.0 / 6.0;

    private final SeededRng rng;

    public MoraleCheck rollMoraleCheck(int morale, String seed) {
        int roll = rng.rollDice(seed, "2d6").total();
        return new MoraleCheck(roll <= morale, roll, morale);
    }

    /**
     * Shifts morale by {@code delta}, keeping it within {@code [0, moraleMax]}.
     */
    public void adjustMorale(Army army, int delta) {
        int adjusted = army.getMoraleCurrent() + delta;
        army.setMoraleCurrent(Math.max(0, Math.min(army.getMoraleMax(), adjusted)));
    }

    /**
     * Applies the consequence table entry for a failed check. A poet in
     * command shifts the roll two places towards the milder results.
     * Defections and splits always leave at least one detachment behind.
     */
    public MoraleConsequenceReport applyMoraleConsequence(Army army, int roll, Commander commander,
                                                          String seed, int currentDay) {
        boolean poet = commander != null && commander.hasTrait(POET);
        MoraleConsequence consequence = MoraleConsequence.forRoll(poet ? roll + 2 : roll);
        Map<String, Object> details = new LinkedHashMap<>();

        switch (consequence) {
            case MUTINY -> {
                List<Detachment> defecting = new ArrayList<>();
                for (int i = 0; i < army.getDetachments().size(); i++) {
                    if (rng.checkSuccess(seed + ":mutiny-det-" + i, MUTINY_DEFECT_CHANCE, "1d20").success()) {
                        defecting.add(army.getDetachments().get(i));
                    }
                }
                details.put("defecting_detachments", removeKeepingOne(army, defecting));
            }
            case MASS_DESERTION -> desert(army, 0.30, details);
            case DETACHMENTS_DEFECT -> {
                int count = Math.min(rng.rollDice(seed + ":defect-count", "1d6").total(),
                        Math.max(0, army.getDetachments().size() - 1));
                List<Detachment> defecting = pick(army, seed + ":defect-selection", count);
                details.put("defecting_detachments", removeKeepingOne(army, defecting));
            }
            case MAJOR_DESERTION -> desert(army, 0.20, details);
            case ARMY_SPLITS -> {
                List<Detachment> splitting = new ArrayList<>();
                for (int i = 0; i < army.getDetachments().size(); i++) {
                    if (rng.checkSuccess(seed + ":split-det-" + i, SPLIT_CHANCE, "1d6").success()) {
                        splitting.add(army.getDetachments().get(i));
                    }
                }
                details.put("splitting_detachments", removeKeepingOne(army, splitting));
            }
            case RANDOM_DETACHMENT_DEFECTS -> {
                int count = army.getDetachments().size() > 1 ? 1 : 0;
                details.put("defecting_detachments",
                        removeKeepingOne(army, pick(army, seed + ":single-defect", count)));
            }
            case DESERTION -> desert(army, 0.10, details);
            case DETACHMENTS_DEPART -> {
                int count = Math.min(rng.rollDice(seed + ":depart-count", "1d6").total(),
                        Math.max(0, army.getDetachments().size() - 1));
                int daysGone = rng.rollDice(seed + ":depart-days", "2d6").total();
                depart(army, pick(army, seed + ":depart-selection", count), currentDay + daysGone, details);
                details.put("return_in_days", daysGone);
            }
            case CAMP_FOLLOWERS -> {
                int increase = (int) (army.getNoncombatantCount() * 0.05);
                army.setNoncombatantCount(army.getNoncombatantCount() + increase);
                details.put("noncombatant_increase", increase);
            }
            case DETACHMENT_DEPARTS -> {
                int daysGone = rng.rollDice(seed + ":single-depart-days", "2d6").total();
                int count = army.getDetachments().size() > 1 ? 1 : 0;
                depart(army, pick(army, seed + ":single-depart-selection", count), currentDay + daysGone, details);
                details.put("return_in_days", daysGone);
            }
            case NO_CONSEQUENCES -> {
                // the army holds together
            }
        }

        log.debug("Army {} morale consequence {} (roll {})", army.getId(), consequence, roll);
        return new MoraleConsequenceReport(consequence, roll, details);
    }

    // ── helpers ─────────────────────────────────────────────────────────

    private void desert(Army army, double fraction, Map<String, Object> details) {
        army.applyLosses(fraction);
        details.put("loss_percentage", fraction);
    }

    private void depart(Army army, List<Detachment> departing, int returnDay, Map<String, Object> details) {
        if (!departing.isEmpty()) {
            Map<String, Object> effect = new LinkedHashMap<>();
            effect.put("detachment_ids", departing.stream().map(Detachment::getId).toList());
            effect.put("return_day", returnDay);
            army.putStatusEffect(Army.EFFECT_DEPARTED_DETACHMENTS, effect);
        }
        details.put("departing_detachments", departing.size());
    }

    /**
     * Seeded selection of {@code count} distinct detachments.
     */
    private List<Detachment> pick(Army army, String seed, int count) {
        List<Detachment> remaining = new ArrayList<>(army.getDetachments());
        List<Detachment> picked = new ArrayList<>();
        for (int i = 0; i < count && !remaining.isEmpty(); i++) {
            Detachment choice = rng.randomChoice(seed + ":" + i, remaining).choice();
            picked.add(choice);
            remaining.remove(choice);
        }
        return picked;
    }

    private int removeKeepingOne(Army army, List<Detachment> leaving) {
        List<Detachment> removable = new ArrayList<>(leaving);
        if (removable.size() >= army.getDetachments().size() && !removable.isEmpty()) {
            removable.remove(removable.size() - 1);
        }
        army.getDetachments().removeAll(removable);
        return removable.size();
    }
}
