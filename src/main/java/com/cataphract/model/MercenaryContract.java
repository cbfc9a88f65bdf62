package com.cataphract.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A hired mercenary company serving with an army.
 * <p>
 * Upkeep is charged daily from the army's carried loot, at the negotiated
 * per-soldier rates ("infantry", "cavalry") or the rule defaults.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MercenaryContract {

    public static final String RATE_INFANTRY = "infantry";
    public static final String RATE_CAVALRY = "cavalry";

    private int id;
    private int companyId;
    private int commanderId;
    private Integer armyId;
    private int startDay;
    private Integer endDay;

    @Builder.Default
    private MercenaryContractStatus status = MercenaryContractStatus.ACTIVE;

    private int lastUpkeepDay;

    @Builder.Default
    private Map<String, Integer> negotiatedRates = new LinkedHashMap<>();

    private int daysUnpaid;
}
