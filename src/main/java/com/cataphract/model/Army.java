package com.cataphract.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An army in the field: detachments plus supply, morale and movement state.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Army {

    public static final String EFFECT_HARRIED = "harried";
    public static final String EFFECT_SICK_OR_EXHAUSTED = "sick_or_exhausted";
    public static final String EFFECT_DEPARTED_DETACHMENTS = "departed_detachments";
    public static final String EFFECT_REVOLT = "revolt";
    public static final String EFFECT_MERCENARIES_DESERTED = "mercenaries_deserted";

    private int id;
    private String name;
    private int commanderId;
    private int currentHexId;

    @Builder.Default
    private List<Detachment> detachments = new ArrayList<>();

    @Builder.Default
    private ArmyStatus status = ArmyStatus.IDLE;

    private double movementPointsRemaining;

    @Builder.Default
    private int moraleCurrent = 9;

    @Builder.Default
    private int moraleResting = 9;

    @Builder.Default
    private int moraleMax = 12;

    private int suppliesCurrent;
    private int suppliesCapacity;
    private int dailySupplyConsumption;
    private int lootCarried;
    private int noncombatantCount;
    private double forcedMarchDays;
    private int daysWithoutSupplies;
    private int daysMarchedThisWeek;
    private double columnLengthMiles;
    private Integer restDurationDays;
    private Integer restStartedDay;
    private Integer destinationHexId;
    private Integer embarkedShipId;

    @Builder.Default
    private Map<String, Object> statusEffects = new LinkedHashMap<>();

    @Builder.Default
    private List<Integer> ordersQueue = new ArrayList<>();

    @JsonIgnore
    public int getTotalSoldiers() {
        return detachments.stream().mapToInt(Detachment::getSoldiers).sum();
    }

    @JsonIgnore
    public int getTotalWagons() {
        return detachments.stream().mapToInt(Detachment::getWagons).sum();
    }

    @JsonIgnore
    public int getFreeSupplyCapacity() {
        return Math.max(0, suppliesCapacity - suppliesCurrent);
    }

    public boolean hasStatusEffect(String effect) {
        if (statusEffects == null) {
            return false;
        }
        Object value = statusEffects.get(effect);
        if (value instanceof Boolean flag) {
            return flag;
        }
        return value != null;
    }

    public void putStatusEffect(String effect, Object value) {
        if (statusEffects == null) {
            statusEffects = new LinkedHashMap<>();
        }
        statusEffects.put(effect, value);
    }

    /**
     * Whether a harrying attempt targeted this army on the given day.
     */
    public boolean isHarriedOn(int day) {
        if (statusEffects == null) {
            return false;
        }
        if (statusEffects.get(EFFECT_HARRIED) instanceof Map<?, ?> harried
                && harried.get("day") instanceof Number harriedDay) {
            return harriedDay.intValue() == day;
        }
        return false;
    }

    /**
     * Applies a fractional loss to every detachment and to carried supplies.
     */
    public void applyLosses(double fraction) {
        detachments.forEach(d -> d.applyLoss(fraction));
        suppliesCurrent = (int) (suppliesCurrent * (1 - fraction));
    }

    /**
     * Loads up to the free capacity and returns the amount actually loaded.
     */
    public int loadSupplies(int amount) {
        int loaded = Math.min(Math.max(0, amount), getFreeSupplyCapacity());
        suppliesCurrent += loaded;
        return loaded;
    }
}
