package com.cataphract.service;

import com.cataphract.CampaignFixtures;
import com.cataphract.dto.OrderExecutionRecord;
import com.cataphract.dto.TickReport;
import com.cataphract.exception.CampaignNotFoundException;
import com.cataphract.model.Army;
import com.cataphract.model.Campaign;
import com.cataphract.model.DayPart;
import com.cataphract.model.MercenaryContract;
import com.cataphract.model.Order;
import com.cataphract.model.OrderStatus;
import com.cataphract.model.Siege;
import com.cataphract.model.SiegeStatus;
import com.cataphract.repository.InMemoryCampaignRepository;
import com.cataphract.rng.SeededRng;
import com.cataphract.websocket.CampaignWebSocketHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for TickService, run against real engine services and an
 * in-memory repository. Only the broadcast is mocked.
 */
@ExtendWith(MockitoExtension.class)
class TickServiceTest {

    @Mock
    private CampaignWebSocketHandler webSocketHandler;

    private TickService tickService;
    private InMemoryCampaignRepository repository;
    private Campaign campaign;

    @BeforeEach
    void setUp() {
        SeededRng rng = new SeededRng();
        MoraleService morale = new MoraleService(rng);
        repository = new InMemoryCampaignRepository();
        tickService = new TickService(
                repository,
                new CampaignLocks(),
                CampaignFixtures.dispatcher(rng),
                new SupplyService(rng),
                morale,
                new MessagingService(rng),
                new NavalService(),
                new SiegeService(rng),
                new MercenaryService(rng, morale),
                rng,
                CampaignFixtures.rules(),
                webSocketHandler);

        campaign = repository.save(CampaignFixtures.campaign());
    }

    private Order order(int id, String type, int day, DayPart part, int priority, LocalDateTime issuedAt,
                        Map<String, Object> parameters) {
        Order order = Order.builder()
                .id(id)
                .armyId(1)
                .commanderId(1)
                .orderType(type)
                .parameters(new LinkedHashMap<>(parameters))
                .executeDay(day)
                .executePart(part)
                .priority(priority)
                .issuedAt(issuedAt)
                .build();
        campaign.getOrders().put(id, order);
        return order;
    }

    private static LocalDateTime at(int hour) {
        return LocalDateTime.of(2024, 3, 1, hour, 0);
    }

    // ── ordersDue() ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("ordersDue()")
    class OrdersDueTests {

        @Test
        @DisplayName("should sort by priority, then issue time, then id")
        void shouldSortDueOrders() {
            order(1, "rest", 0, DayPart.MORNING, 5, at(8), Map.of());
            order(2, "rest", 0, DayPart.MORNING, 1, at(10), Map.of());
            order(3, "rest", 0, DayPart.MORNING, 1, at(9), Map.of());
            order(4, "rest", 0, DayPart.MORNING, 1, at(9), Map.of());

            List<Integer> ids = TickService.ordersDue(campaign, 0, DayPart.MORNING).stream()
                    .map(Order::getId).toList();

            assertEquals(List.of(3, 4, 2, 1), ids);
        }

        @Test
        @DisplayName("should skip other days, other parts and resolved orders")
        void shouldFilterOrders() {
            order(1, "rest", 0, DayPart.MORNING, 0, at(8), Map.of());
            order(2, "rest", 1, DayPart.MORNING, 0, at(8), Map.of());
            order(3, "rest", 0, DayPart.EVENING, 0, at(8), Map.of());
            order(4, "rest", 0, DayPart.MORNING, 0, at(8), Map.of()).setStatus(OrderStatus.CANCELLED);
            order(5, "raise_army", 0, DayPart.MORNING, 0, at(8), Map.of()).setStatus(OrderStatus.EXECUTING);

            List<Integer> ids = TickService.ordersDue(campaign, 0, DayPart.MORNING).stream()
                    .map(Order::getId).toList();

            assertEquals(List.of(1, 5), ids);
        }

        @Test
        @DisplayName("should treat a missing schedule as this morning")
        void shouldDefaultSchedule() {
            Order order = order(1, "rest", 0, DayPart.MORNING, 0, at(8), Map.of());
            order.setExecuteDay(null);
            order.setExecutePart(null);

            assertEquals(1, TickService.ordersDue(campaign, 3, DayPart.MORNING).size());
            assertTrue(TickService.ordersDue(campaign, 3, DayPart.MIDDAY).isEmpty());
        }
    }

    // ── runDailyTick() ──────────────────────────────────────────────────

    @Nested
    @DisplayName("runDailyTick()")
    class RunDailyTickTests {

        @Test
        @DisplayName("should execute orders in their day-part and advance the day")
        void shouldRunOrdersAndAdvance() {
            Order move = order(1, "move", 0, DayPart.MIDDAY, 0, at(8),
                    Map.of("legs", List.of(Map.of("to_hex_id", 2, "distance_miles", 6))));

            TickReport report = tickService.runDailyTick(1);

            assertEquals(0, report.getDay());
            assertEquals(1, campaign.getCurrentDay());
            assertEquals(DayPart.MORNING, campaign.getCurrentPart());
            assertEquals(OrderStatus.COMPLETED, move.getStatus());
            assertEquals(2, campaign.getArmies().get(1).getCurrentHexId());

            assertEquals(1, report.getOrders().size());
            OrderExecutionRecord record = report.getOrders().get(0);
            assertEquals(1, record.getOrderId());
            assertEquals(DayPart.MIDDAY, record.getDayPart());
            assertEquals(OrderStatus.COMPLETED, record.getStatus());
        }

        @Test
        @DisplayName("should feed every army at the end of the day")
        void shouldConsumeSupplies() {
            tickService.runDailyTick(1);

            // 1000 soldiers plus 250 camp followers, 800 plus 200
            assertEquals(3750, campaign.getArmies().get(1).getSuppliesCurrent());
            assertEquals(3000, campaign.getArmies().get(2).getSuppliesCurrent());
        }

        @Test
        @DisplayName("should report an army that ran out of supplies")
        void shouldReportStarvation() {
            Army army = campaign.getArmies().get(1);
            army.setSuppliesCurrent(100);

            TickReport report = tickService.runDailyTick(1);

            assertEquals(List.of(1), report.getStarvingArmyIds());
            assertEquals(0, army.getSuppliesCurrent());
            assertEquals(1, army.getDaysWithoutSupplies());
        }

        @Test
        @DisplayName("should charge mercenary upkeep after supplies")
        void shouldChargeMercenaryUpkeep() {
            campaign.setCurrentDay(2);
            Army army = campaign.getArmies().get(1);
            army.setLootCarried(1500);
            campaign.getMercenaryContracts().put(1, MercenaryContract.builder()
                    .id(1).companyId(1).commanderId(1).armyId(1).lastUpkeepDay(1).build());

            TickReport report = tickService.runDailyTick(1);

            assertEquals(1, report.getMercenaryUpkeep().size());
            assertTrue(report.getMercenaryUpkeep().get(0).paid());
            assertEquals(500, army.getLootCarried());
            assertEquals(2, campaign.getMercenaryContracts().get(1).getLastUpkeepDay());
        }

        @Test
        @DisplayName("should fail a malformed order and still finish the day")
        void shouldSurviveMalformedOrder() {
            List<Object> legs = new ArrayList<>();
            legs.add(null);
            Order move = order(1, "move", 0, DayPart.MORNING, 0, at(8), Map.of("legs", legs));

            TickReport report = tickService.runDailyTick(1);

            assertEquals(OrderStatus.FAILED, move.getStatus());
            assertEquals(1, campaign.getCurrentDay());
            assertEquals(OrderStatus.FAILED, report.getOrders().get(0).getStatus());
        }

        @Test
        @DisplayName("should advance ongoing sieges on the last day of the week")
        void shouldAdvanceSiegesWeekly() {
            campaign.setCurrentDay(6);
            campaign.getSieges().put(1, Siege.builder().id(1).strongholdId(1)
                    .attackerArmyIds(new ArrayList<>(List.of(1))).defenderArmyId(2).currentThreshold(10).build());
            campaign.getSieges().put(2, Siege.builder().id(2).strongholdId(1)
                    .status(SiegeStatus.LIFTED).currentThreshold(10).build());

            TickReport report = tickService.runDailyTick(1);

            assertEquals(1, report.getSieges().size());
            assertEquals(1, report.getSieges().get(0).siegeId());
            assertEquals(9, report.getSieges().get(0).threshold());
            assertEquals(1, campaign.getSieges().get(1).getWeeksElapsed());
            assertEquals(0, campaign.getSieges().get(2).getWeeksElapsed());
        }

        @Test
        @DisplayName("should leave sieges alone mid-week")
        void shouldSkipSiegesMidWeek() {
            campaign.getSieges().put(1, Siege.builder().id(1).strongholdId(1).currentThreshold(10).build());

            TickReport report = tickService.runDailyTick(1);

            assertTrue(report.getSieges().isEmpty());
        }

        @Test
        @DisplayName("should broadcast the report")
        void shouldBroadcastReport() {
            tickService.runDailyTick(1);

            ArgumentCaptor<TickReport> captor = ArgumentCaptor.forClass(TickReport.class);
            verify(webSocketHandler).broadcastTickReport(captor.capture());
            assertEquals(1, captor.getValue().getCampaignId());
        }

        @Test
        @DisplayName("should reject an unknown campaign")
        void shouldRejectUnknownCampaign() {
            assertThrows(CampaignNotFoundException.class, () -> tickService.runDailyTick(99));
        }

        @Test
        @DisplayName("should reject a campaign that is not active")
        void shouldRejectInactiveCampaign() {
            campaign.setStatus("paused");

            IllegalStateException ex = assertThrows(IllegalStateException.class,
                    () -> tickService.runDailyTick(1));

            assertEquals("campaign 1 is not active", ex.getMessage());
            assertEquals(0, campaign.getCurrentDay());
            verify(webSocketHandler, never()).broadcastTickReport(any());
        }

        @Test
        @DisplayName("should release the running flag after a failed tick")
        @SuppressWarnings("unchecked")
        void shouldClearRunningFlag() {
            campaign.setStatus("paused");
            assertThrows(IllegalStateException.class, () -> tickService.runDailyTick(1));

            Set<Integer> running = (Set<Integer>) ReflectionTestUtils.getField(tickService, "runningTicks");
            assertNotNull(running);
            assertTrue(running.isEmpty());
        }

        @Test
        @DisplayName("should refuse a second tick while one is running")
        @SuppressWarnings("unchecked")
        void shouldRejectConcurrentTick() {
            Set<Integer> running = (Set<Integer>) ReflectionTestUtils.getField(tickService, "runningTicks");
            assertNotNull(running);
            running.add(1);

            IllegalStateException ex = assertThrows(IllegalStateException.class,
                    () -> tickService.runDailyTick(1));

            assertEquals("tick already in progress for campaign 1", ex.getMessage());
            assertEquals(0, campaign.getCurrentDay());
        }
    }
}
