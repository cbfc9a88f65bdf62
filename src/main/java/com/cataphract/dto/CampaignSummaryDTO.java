package com.cataphract.dto;

import com.cataphract.model.Campaign;
import com.cataphract.model.DayPart;
import com.cataphract.model.OrderStatus;
import com.cataphract.model.Season;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for campaign list views.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CampaignSummaryDTO {

    private int id;
    private String name;
    private String status;
    private int currentDay;
    private DayPart currentPart;
    private Season season;
    private int factionCount;
    private int armyCount;
    private long openOrderCount;

    public static CampaignSummaryDTO fromCampaign(Campaign campaign) {
        return CampaignSummaryDTO.builder()
                .id(campaign.getId())
                .name(campaign.getName())
                .status(campaign.getStatus())
                .currentDay(campaign.getCurrentDay())
                .currentPart(campaign.getCurrentPart())
                .season(campaign.getSeason())
                .factionCount(campaign.getFactions().size())
                .armyCount(campaign.getArmies().size())
                .openOrderCount(campaign.getOrders().values().stream()
                        .filter(o -> !o.getStatus().isTerminal())
                        .count())
                .build();
    }
}
