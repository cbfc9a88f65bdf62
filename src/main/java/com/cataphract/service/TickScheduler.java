package com.cataphract.service;

import com.cataphract.model.Campaign;
import com.cataphract.repository.CampaignRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Optional wall-clock driver that ticks every active campaign.
 * Disabled unless {@code campaign.tick.auto-enabled} is true.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TickScheduler {

    private final CampaignRepository campaignRepository;
    private final TickService tickService;

    @Value("${campaign.tick.auto-enabled:false}")
    private boolean autoEnabled;

    @Scheduled(fixedDelayString = "${campaign.tick.interval-ms:60000}")
    public void tickActiveCampaigns() {
        if (!autoEnabled) {
            return;
        }
        for (Campaign campaign : campaignRepository.findAll()) {
            if (!Campaign.STATUS_ACTIVE.equals(campaign.getStatus())) {
                continue;
            }
            try {
                tickService.runDailyTick(campaign.getId());
            } catch (IllegalStateException e) {
                log.info("Skipping scheduled tick for campaign {}: {}", campaign.getId(), e.getMessage());
            }
        }
    }
}
