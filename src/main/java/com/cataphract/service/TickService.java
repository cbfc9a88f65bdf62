package com.cataphract.service;

import com.cataphract.config.RulesConfig;
import com.cataphract.dto.MoraleCheck;
import com.cataphract.dto.OrderExecutionRecord;
import com.cataphract.dto.TickReport;
import com.cataphract.exception.CampaignNotFoundException;
import com.cataphract.model.Army;
import com.cataphract.model.ArmyStatus;
import com.cataphract.model.Campaign;
import com.cataphract.model.DayPart;
import com.cataphract.model.Order;
import com.cataphract.model.OrderStatus;
import com.cataphract.model.Siege;
import com.cataphract.model.SiegeStatus;
import com.cataphract.order.OrderContext;
import com.cataphract.order.OrderDispatcher;
import com.cataphract.order.OrderOutcome;
import com.cataphract.repository.CampaignRepository;
import com.cataphract.rng.SeededRng;
import com.cataphract.websocket.CampaignWebSocketHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Service responsible for advancing a campaign by one day.
 * <p>
 * A day runs its start-of-day resets, then each of the four day-parts in
 * order (couriers and ships move a quarter day, then the orders due in that
 * part execute), then supply consumption, mercenary upkeep and, on the last
 * day of a week, siege progress. Only one tick per campaign may run at a time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TickService {

    static final int WEEK_DAYS = 7;
    private static final double DAY_PART_FRACTION = 1.0 / DayPart.values().length;

    private final CampaignRepository campaignRepository;
    private final CampaignLocks campaignLocks;
    private final OrderDispatcher orderDispatcher;
    private final SupplyService supplyService;
    private final MoraleService moraleService;
    private final MessagingService messagingService;
    private final NavalService navalService;
    private final SiegeService siegeService;
    private final MercenaryService mercenaryService;
    private final SeededRng rng;
    private final RulesConfig rules;
    private final CampaignWebSocketHandler webSocketHandler;

    private final Set<Integer> runningTicks = ConcurrentHashMap.newKeySet();

    /**
     * Advances the campaign one day and broadcasts the report.
     *
     * @throws CampaignNotFoundException if the campaign is not stored
     * @throws IllegalStateException     if a tick is already running for it or it is not active
     */
    public TickReport runDailyTick(int campaignId) {
        Campaign campaign = campaignRepository.findById(campaignId)
                .orElseThrow(() -> new CampaignNotFoundException(campaignId));
        if (!runningTicks.add(campaignId)) {
            throw new IllegalStateException("tick already in progress for campaign " + campaignId);
        }

        TickReport report;
        ReentrantLock lock = campaignLocks.lockFor(campaignId);
        lock.lock();
        try {
            if (!Campaign.STATUS_ACTIVE.equals(campaign.getStatus())) {
                throw new IllegalStateException("campaign " + campaignId + " is not active");
            }
            log.info("Tick started for campaign {} on day {}", campaignId, campaign.getCurrentDay());
            report = advanceDay(campaign);
        } finally {
            lock.unlock();
            runningTicks.remove(campaignId);
        }

        log.info("Tick finished for campaign {}: {} order(s) resolved, now day {}",
                campaignId, report.getOrders().size(), campaign.getCurrentDay());
        webSocketHandler.broadcastTickReport(report);
        return report;
    }

    /**
     * Runs one full day against the campaign. The caller holds the campaign lock.
     */
    TickReport advanceDay(Campaign campaign) {
        int day = campaign.getCurrentDay();
        TickReport report = TickReport.builder()
                .campaignId(campaign.getId())
                .day(day)
                .build();

        startOfDay(campaign);

        for (DayPart part : DayPart.values()) {
            campaign.setCurrentPart(part);
            String courierSeed = rng.seed(campaign.getId(), day, part, "courier");
            report.getDeliveredMessageIds().addAll(
                    messagingService.advanceMessages(campaign, DAY_PART_FRACTION, courierSeed, rules));
            report.getArrivedShipIds().addAll(navalService.advanceShips(campaign, DAY_PART_FRACTION));
            executeOrdersFor(campaign, part, report);
        }

        consumeSupplies(campaign, report);
        report.getMercenaryUpkeep().addAll(mercenaryService.processDailyUpkeep(campaign, rules));

        if ((day + 1) % WEEK_DAYS == 0) {
            advanceSieges(campaign, report);
        }

        campaign.setCurrentDay(day + 1);
        campaign.setCurrentPart(DayPart.MORNING);
        return report;
    }

    // ── start of day ────────────────────────────────────────────────────

    private void startOfDay(Campaign campaign) {
        int day = campaign.getCurrentDay();
        for (Army army : campaign.getArmies().values()) {
            supplyService.refresh(campaign, army, rules);
            army.setMovementPointsRemaining(1.0);

            if (day % WEEK_DAYS == 0) {
                army.setDaysMarchedThisWeek(0);
            }
            if (army.getStatus().isMarching() || army.getStatus() == ArmyStatus.HARRYING) {
                army.setStatus(ArmyStatus.IDLE);
            }
            if (army.getStatus() == ArmyStatus.RESTING && army.getRestDurationDays() != null) {
                int started = army.getRestStartedDay() != null ? army.getRestStartedDay() : day;
                if (day - started >= army.getRestDurationDays()) {
                    army.setRestDurationDays(null);
                    army.setRestStartedDay(null);
                    army.setStatus(ArmyStatus.IDLE);
                }
            }
            if (army.getForcedMarchDays() >= WEEK_DAYS) {
                int weeks = (int) (army.getForcedMarchDays() / WEEK_DAYS);
                moraleService.adjustMorale(army, -weeks * rules.getMorale().getForcedMarchMoraleLossPerWeek());
                army.setForcedMarchDays(army.getForcedMarchDays() % WEEK_DAYS);
            }
        }
    }

    // ── orders ──────────────────────────────────────────────────────────

    private void executeOrdersFor(Campaign campaign, DayPart part, TickReport report) {
        int day = campaign.getCurrentDay();
        OrderContext context = new OrderContext(campaign, part, rules);

        for (Order order : ordersDue(campaign, day, part)) {
            OrderOutcome outcome = orderDispatcher.execute(context, order);
            if (outcome.status() == OrderStatus.COMPLETED || outcome.status() == OrderStatus.FAILED) {
                order.setExecuteDay(day);
            }
            report.getOrders().add(OrderExecutionRecord.builder()
                    .orderId(order.getId())
                    .armyId(order.getArmyId())
                    .orderType(order.getOrderType())
                    .dayPart(part)
                    .status(outcome.status())
                    .detail(outcome.detail())
                    .events(new ArrayList<>(outcome.events()))
                    .build());
        }
    }

    /**
     * Pending or executing orders scheduled for this day and part, by
     * execute day, priority, then issue time.
     */
    static List<Order> ordersDue(Campaign campaign, int day, DayPart part) {
        return campaign.getOrders().values().stream()
                .filter(o -> o.getStatus() == OrderStatus.PENDING || o.getStatus() == OrderStatus.EXECUTING)
                .filter(o -> (o.getExecuteDay() != null ? o.getExecuteDay() : day) == day)
                .filter(o -> (o.getExecutePart() != null ? o.getExecutePart() : DayPart.MORNING) == part)
                .sorted(Comparator.comparing((Order o) -> o.getExecuteDay() != null ? o.getExecuteDay() : day)
                        .thenComparingInt(Order::getPriority)
                        .thenComparing(Order::getIssuedAt, Comparator.nullsLast(Comparator.<LocalDateTime>naturalOrder()))
                        .thenComparingInt(Order::getId))
                .toList();
    }

    // ── end of day ──────────────────────────────────────────────────────

    private void consumeSupplies(Campaign campaign, TickReport report) {
        int day = campaign.getCurrentDay();
        for (Army army : campaign.getArmies().values()) {
            int consumption = army.getDailySupplyConsumption();
            if (army.getSuppliesCurrent() >= consumption) {
                army.setSuppliesCurrent(army.getSuppliesCurrent() - consumption);
                army.setDaysWithoutSupplies(0);
                continue;
            }

            army.setSuppliesCurrent(0);
            army.setDaysWithoutSupplies(army.getDaysWithoutSupplies() + 1);
            moraleService.adjustMorale(army, -rules.getMorale().getStarvationMoraleLossPerDay());
            String seed = rng.seed(campaign.getId(), day, DayPart.NIGHT, "starvation:" + army.getId());
            MoraleCheck check = moraleService.rollMoraleCheck(army.getMoraleCurrent(), seed);
            if (!check.success()) {
                moraleService.applyMoraleConsequence(army, check.roll(),
                        campaign.getCommanders().get(army.getCommanderId()), seed + ":consequence", day);
            }
            if (army.getDaysWithoutSupplies() >= rules.getMorale().getStarvationDissolutionDays()) {
                army.setStatus(ArmyStatus.ROUTED);
                log.info("Army {} dissolved after {} days without supplies", army.getId(), army.getDaysWithoutSupplies());
            }
            report.getStarvingArmyIds().add(army.getId());
        }
    }

    private void advanceSieges(Campaign campaign, TickReport report) {
        for (Siege siege : campaign.getSieges().values()) {
            if (siege.getStatus() != SiegeStatus.ONGOING) {
                continue;
            }
            String seed = rng.seed(campaign.getId(), campaign.getCurrentDay(), DayPart.NIGHT, "siege:" + siege.getId());
            report.getSieges().add(siegeService.advanceSiege(siege, seed, rules));
        }
    }
}
