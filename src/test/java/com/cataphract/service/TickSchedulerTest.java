package com.cataphract.service;

import com.cataphract.model.Campaign;
import com.cataphract.repository.CampaignRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TickScheduler.
 */
@ExtendWith(MockitoExtension.class)
class TickSchedulerTest {

    @Mock private CampaignRepository campaignRepository;
    @Mock private TickService tickService;

    @InjectMocks
    private TickScheduler scheduler;

    @Test
    @DisplayName("should do nothing while automatic ticks are disabled")
    void shouldStayIdleWhenDisabled() {
        scheduler.tickActiveCampaigns();

        verifyNoInteractions(campaignRepository, tickService);
    }

    @Test
    @DisplayName("should tick only active campaigns")
    void shouldTickActiveCampaigns() {
        ReflectionTestUtils.setField(scheduler, "autoEnabled", true);
        Campaign active = Campaign.builder().id(1).build();
        Campaign finished = Campaign.builder().id(2).status("finished").build();
        when(campaignRepository.findAll()).thenReturn(List.of(active, finished));

        scheduler.tickActiveCampaigns();

        verify(tickService).runDailyTick(1);
        verify(tickService, never()).runDailyTick(2);
    }

    @Test
    @DisplayName("should carry on when one campaign is already ticking")
    void shouldSkipBusyCampaign() {
        ReflectionTestUtils.setField(scheduler, "autoEnabled", true);
        when(campaignRepository.findAll()).thenReturn(List.of(
                Campaign.builder().id(1).build(), Campaign.builder().id(2).build()));
        when(tickService.runDailyTick(1))
                .thenThrow(new IllegalStateException("tick already in progress for campaign 1"));

        scheduler.tickActiveCampaigns();

        verify(tickService, times(2)).runDailyTick(anyInt());
    }
}
