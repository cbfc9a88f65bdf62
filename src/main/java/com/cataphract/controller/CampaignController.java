package com.cataphract.controller;

import com.cataphract.config.ScenarioLoader;
import com.cataphract.dto.CampaignSummaryDTO;
import com.cataphract.dto.CreateCampaignRequest;
import com.cataphract.dto.OrderRequest;
import com.cataphract.dto.ScenarioInfoDTO;
import com.cataphract.dto.TickReport;
import com.cataphract.model.Campaign;
import com.cataphract.model.Order;
import com.cataphract.service.CampaignService;
import com.cataphract.service.TickService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tools.jackson.databind.JsonNode;

import java.util.List;

/**
 * REST API controller for campaigns, their order queues and the daily tick.
 */
@RestController
@RequestMapping("/api/campaigns")
@RequiredArgsConstructor
@Slf4j
@CrossOrigin(origins = "*")
public class CampaignController {

    private final CampaignService campaignService;
    private final TickService tickService;
    private final ScenarioLoader scenarioLoader;

    /**
     * List available scenarios.
     */
    @GetMapping("/scenarios")
    public ResponseEntity<List<ScenarioInfoDTO>> getScenarios() {
        return ResponseEntity.ok(scenarioLoader.getAvailableScenarios().stream()
                .map(ScenarioInfoDTO::fromDefinition)
                .toList());
    }

    @PostMapping
    public ResponseEntity<Campaign> createCampaign(@Valid @RequestBody CreateCampaignRequest request) {
        log.info("Creating campaign from scenario {}", request.getScenarioId());
        return ResponseEntity.ok(campaignService.createCampaign(request));
    }

    @GetMapping
    public ResponseEntity<List<CampaignSummaryDTO>> getCampaigns() {
        return ResponseEntity.ok(campaignService.getCampaignSummaries());
    }

    /**
     * Full campaign state.
     */
    @GetMapping("/{campaignId}")
    public ResponseEntity<JsonNode> getCampaign(@PathVariable int campaignId) {
        return ResponseEntity.ok(campaignService.getCampaignState(campaignId));
    }

    @GetMapping("/{campaignId}/orders")
    public ResponseEntity<List<Order>> getOrders(@PathVariable int campaignId) {
        return ResponseEntity.ok(campaignService.getOrders(campaignId));
    }

    @PostMapping("/{campaignId}/orders")
    public ResponseEntity<Order> submitOrder(@PathVariable int campaignId,
                                             @Valid @RequestBody OrderRequest request) {
        return ResponseEntity.ok(campaignService.submitOrder(campaignId, request));
    }

    @PostMapping("/{campaignId}/orders/{orderId}/cancel")
    public ResponseEntity<Order> cancelOrder(@PathVariable int campaignId, @PathVariable int orderId) {
        return ResponseEntity.ok(campaignService.cancelOrder(campaignId, orderId));
    }

    /**
     * Advance the campaign by one day.
     */
    @PostMapping("/{campaignId}/tick")
    public ResponseEntity<TickReport> tick(@PathVariable int campaignId) {
        log.info("Manual tick requested for campaign {}", campaignId);
        return ResponseEntity.ok(tickService.runDailyTick(campaignId));
    }
}
