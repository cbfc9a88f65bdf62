package com.cataphract.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Root aggregate of a running campaign. Every entity is owned here and
 * mutated in place by the order handlers and the daily tick.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Campaign {

    public static final String STATUS_ACTIVE = "active";

    private int id;
    private String name;
    private int currentDay;

    @Builder.Default
    private DayPart currentPart = DayPart.MORNING;

    @Builder.Default
    private Season season = Season.SPRING;

    @Builder.Default
    private String status = STATUS_ACTIVE;

    @Builder.Default
    private Map<Integer, Hex> hexes = new LinkedHashMap<>();

    @Builder.Default
    private Map<Integer, Faction> factions = new LinkedHashMap<>();

    @Builder.Default
    private Map<Integer, Commander> commanders = new LinkedHashMap<>();

    @Builder.Default
    private Map<Integer, Army> armies = new LinkedHashMap<>();

    @Builder.Default
    private Map<Integer, Stronghold> strongholds = new LinkedHashMap<>();

    @Builder.Default
    private Map<Integer, Ship> ships = new LinkedHashMap<>();

    @Builder.Default
    private Map<Integer, UnitType> unitTypes = new LinkedHashMap<>();

    @Builder.Default
    private Map<Integer, Siege> sieges = new LinkedHashMap<>();

    @Builder.Default
    private Map<Integer, Order> orders = new LinkedHashMap<>();

    @Builder.Default
    private Map<Integer, Message> messages = new LinkedHashMap<>();

    @Builder.Default
    private Map<Integer, Operation> operations = new LinkedHashMap<>();

    @Builder.Default
    private Map<Integer, RecruitmentProject> recruitments = new LinkedHashMap<>();

    @Builder.Default
    private Map<Integer, MercenaryContract> mercenaryContracts = new LinkedHashMap<>();

    // ── lookups ─────────────────────────────────────────────────────────

    public Optional<Siege> findSiegeByStronghold(int strongholdId) {
        return sieges.values().stream()
                .filter(s -> s.getStrongholdId() == strongholdId)
                .findFirst();
    }

    public Optional<Hex> findHexAt(HexCoord coord) {
        return hexes.values().stream()
                .filter(h -> h.getQ() == coord.q() && h.getR() == coord.r())
                .findFirst();
    }

    // ── identifier allocation ───────────────────────────────────────────

    @JsonIgnore
    public int getNextArmyId() {
        return nextKey(armies);
    }

    @JsonIgnore
    public int getNextSiegeId() {
        return nextKey(sieges);
    }

    @JsonIgnore
    public int getNextMessageId() {
        return nextKey(messages);
    }

    @JsonIgnore
    public int getNextOperationId() {
        return nextKey(operations);
    }

    @JsonIgnore
    public int getNextOrderId() {
        return nextKey(orders);
    }

    @JsonIgnore
    public int getNextRecruitmentId() {
        return nextKey(recruitments);
    }

    @JsonIgnore
    public int getNextFactionId() {
        return nextKey(factions);
    }

    @JsonIgnore
    public int getNextCommanderId() {
        return nextKey(commanders);
    }

    /**
     * Detachment ids are unique across every army of the campaign.
     */
    @JsonIgnore
    public int getNextDetachmentId() {
        return armies.values().stream()
                .flatMap(a -> a.getDetachments().stream())
                .mapToInt(Detachment::getId)
                .max()
                .orElse(0) + 1;
    }

    private static int nextKey(Map<Integer, ?> entities) {
        return entities.keySet().stream().mapToInt(Integer::intValue).max().orElse(0) + 1;
    }
}
