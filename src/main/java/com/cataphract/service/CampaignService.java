package com.cataphract.service;

import com.cataphract.config.ScenarioLoader;
import com.cataphract.dto.CampaignSummaryDTO;
import com.cataphract.dto.CreateCampaignRequest;
import com.cataphract.dto.OrderRequest;
import com.cataphract.exception.CampaignNotFoundException;
import com.cataphract.model.Campaign;
import com.cataphract.model.Order;
import com.cataphract.model.OrderStatus;
import com.cataphract.repository.CampaignRepository;
import com.cataphract.websocket.CampaignWebSocketHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Service responsible for campaign creation, lookup and the order queue.
 * <p>
 * Reads for the outside world are taken under the campaign lock and return
 * detached copies, so a running tick is never observed half-applied.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CampaignService {

    private final CampaignRepository campaignRepository;
    private final ScenarioLoader scenarioLoader;
    private final CampaignLocks campaignLocks;
    private final CampaignWebSocketHandler webSocketHandler;
    private final ObjectMapper objectMapper;

    // ── campaigns ───────────────────────────────────────────────────────

    /**
     * Starts a new campaign from a scenario's day-0 position.
     *
     * @throws IllegalArgumentException if the scenario is unknown
     */
    public Campaign createCampaign(CreateCampaignRequest request) {
        Campaign campaign = scenarioLoader.newCampaign(request.getScenarioId());
        campaign.setId(0);
        if (request.getName() != null && !request.getName().isBlank()) {
            campaign.setName(request.getName().trim());
        }
        Campaign saved = campaignRepository.save(campaign);
        log.info("Created campaign {} '{}' from scenario {}", saved.getId(), saved.getName(), request.getScenarioId());
        return saved;
    }

    public Campaign getCampaign(int campaignId) {
        return campaignRepository.findById(campaignId)
                .orElseThrow(() -> new CampaignNotFoundException(campaignId));
    }

    /**
     * Full campaign state as a JSON tree, serialized while the campaign lock is held.
     */
    public JsonNode getCampaignState(int campaignId) {
        return underLock(getCampaign(campaignId), objectMapper::valueToTree);
    }

    public List<CampaignSummaryDTO> getCampaignSummaries() {
        return campaignRepository.findAll().stream()
                .map(campaign -> underLock(campaign, CampaignSummaryDTO::fromCampaign))
                .toList();
    }

    private <T> T underLock(Campaign campaign, Function<Campaign, T> read) {
        ReentrantLock lock = campaignLocks.lockFor(campaign.getId());
        lock.lock();
        try {
            return read.apply(campaign);
        } finally {
            lock.unlock();
        }
    }

    // ── orders ──────────────────────────────────────────────────────────

    public List<Order> getOrders(int campaignId) {
        return underLock(getCampaign(campaignId), campaign -> campaign.getOrders().values().stream()
                .sorted(Comparator.comparingInt(Order::getId))
                .map(Order::copy)
                .toList());
    }

    /**
     * Queues an order as PENDING. It runs on the given day and part, or the
     * campaign's current ones when they are omitted.
     *
     * @throws IllegalArgumentException if the commander is unknown or the day has passed
     */
    public Order submitOrder(int campaignId, OrderRequest request) {
        Campaign campaign = getCampaign(campaignId);
        ReentrantLock lock = campaignLocks.lockFor(campaignId);
        lock.lock();
        Order order;
        try {
            if (!campaign.getCommanders().containsKey(request.getCommanderId())) {
                throw new IllegalArgumentException("Unknown commander: " + request.getCommanderId());
            }
            int executeDay = request.getExecuteDay() != null ? request.getExecuteDay() : campaign.getCurrentDay();
            if (executeDay < campaign.getCurrentDay()) {
                throw new IllegalArgumentException("Execute day " + executeDay + " has already passed");
            }

            order = Order.builder()
                    .id(campaign.getNextOrderId())
                    .armyId(request.getArmyId())
                    .commanderId(request.getCommanderId())
                    .orderType(request.getOrderType().trim())
                    .parameters(request.getParameters())
                    .issuedAt(LocalDateTime.now())
                    .executeDay(executeDay)
                    .executePart(request.getExecutePart() != null ? request.getExecutePart() : campaign.getCurrentPart())
                    .priority(request.getPriority())
                    .status(OrderStatus.PENDING)
                    .build();
            campaign.getOrders().put(order.getId(), order);
            order = order.copy();
        } finally {
            lock.unlock();
        }

        log.info("Order {} ({}) queued in campaign {} for day {} {}", order.getId(), order.getOrderType(),
                campaignId, order.getExecuteDay(), order.getExecutePart());
        webSocketHandler.broadcastOrderSubmitted(campaignId, order);
        return order;
    }

    /**
     * @throws IllegalArgumentException if the order is unknown
     * @throws IllegalStateException    if the order has already been resolved
     */
    public Order cancelOrder(int campaignId, int orderId) {
        Campaign campaign = getCampaign(campaignId);
        ReentrantLock lock = campaignLocks.lockFor(campaignId);
        lock.lock();
        Order order;
        try {
            order = campaign.getOrders().get(orderId);
            if (order == null) {
                throw new IllegalArgumentException("Unknown order: " + orderId);
            }
            if (order.getStatus().isTerminal()) {
                throw new IllegalStateException("Order " + orderId + " is already " + order.getStatus());
            }
            order.setStatus(OrderStatus.CANCELLED);
            order = order.copy();
        } finally {
            lock.unlock();
        }

        log.info("Order {} cancelled in campaign {}", orderId, campaignId);
        webSocketHandler.broadcastOrderCancelled(campaignId, order);
        return order;
    }
}
