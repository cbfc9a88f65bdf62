package com.cataphract.order.handler;

import com.cataphract.dto.MovementOptions;
import com.cataphract.dto.MovementValidation;
import com.cataphract.model.Army;
import com.cataphract.model.ArmyStatus;
import com.cataphract.model.Campaign;
import com.cataphract.model.Commander;
import com.cataphract.model.MovementType;
import com.cataphract.model.Order;
import com.cataphract.order.MovementPlan;
import com.cataphract.order.OrderContext;
import com.cataphract.order.OrderOutcome;
import com.cataphract.order.OrderPayloadParser;
import com.cataphract.order.OrderValidationException;
import com.cataphract.order.payload.MoveLeg;
import com.cataphract.order.payload.MovePayload;
import com.cataphract.rng.SeededRng;
import com.cataphract.service.MovementService;
import com.cataphract.service.SupplyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Executes {@code move} orders. The whole march is planned before the army
 * is touched, so a rejected plan leaves it where it was.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MovementOrderHandler {

    private final OrderPayloadParser parser;
    private final MovementService movementService;
    private final SupplyService supplyService;
    private final SeededRng rng;

    public OrderOutcome move(OrderContext context, Order order, Army army) {
        if (army == null) {
            return OrderOutcome.failed("movement order requires an army");
        }
        MovePayload payload = parser.parse(order, MovePayload.class);
        MovementPlan plan = plan(context, order, army, payload);

        army.setCurrentHexId(plan.finalHexId());
        army.setDestinationHexId(null);
        army.setMovementPointsRemaining(Math.max(0.0, 1.0 - plan.totalFraction()));
        army.setDaysMarchedThisWeek(army.getDaysMarchedThisWeek() + 1);
        if (plan.movementType() == MovementType.FORCED) {
            army.setStatus(ArmyStatus.FORCED_MARCH);
            army.setForcedMarchDays(army.getForcedMarchDays() + plan.totalFraction());
        } else if (plan.movementType() == MovementType.NIGHT || plan.anyNightLeg()) {
            army.setStatus(ArmyStatus.NIGHT_MARCH);
        } else {
            army.setStatus(ArmyStatus.MARCHING);
        }

        String detail = "moved to hex " + plan.finalHexId() + " via " + plan.legs().size() + " leg(s)";
        if (plan.diverted() && plan.diversionDetail() != null) {
            detail += " (" + plan.diversionDetail() + ")";
        }
        log.debug("Army {} {}", army.getId(), detail);
        return OrderOutcome.completed(detail);
    }

    /**
     * Works out the legs travelled and the share of the day they use.
     *
     * @throws OrderValidationException if the march is not allowed or does not fit in one day
     */
    MovementPlan plan(OrderContext context, Order order, Army army, MovePayload payload) {
        Campaign campaign = context.campaign();
        MovementType movementType = MovementType.fromCode(payload.movementType())
                .orElseThrow(() -> new OrderValidationException("invalid movement type: " + payload.movementType()));

        List<MoveLeg> legs = payload.legs();
        for (MoveLeg leg : legs) {
            if (leg.distanceMiles() <= 0) {
                throw new OrderValidationException("movement leg requires positive distance");
            }
            if (leg.hasFork() && leg.alternateHexId() == null) {
                throw new OrderValidationException("movement leg with fork requires alternate_hex_id");
            }
        }

        boolean night = movementType == MovementType.NIGHT || legs.stream().anyMatch(MoveLeg::isNight);
        MovementValidation validation = movementService.validateMovementOrder(
                campaign.getUnitTypes(),
                army,
                legs.stream().map(leg -> !leg.onRoad()).toList(),
                legs.stream().map(MoveLeg::hasRiverFord).toList(),
                night);
        if (!validation.valid()) {
            throw new OrderValidationException(validation.error());
        }

        Commander commander = campaign.getCommanders().get(army.getCommanderId());
        List<String> traits = commander != null ? commander.getTraits() : List.of();
        double columnLength = supplyService.snapshot(campaign, army, context.rules()).getColumnLengthMiles();

        double totalFraction = 0.0;
        List<MoveLeg> travelled = new ArrayList<>();
        int finalHex = army.getCurrentHexId();
        boolean diverted = false;
        String diversionDetail = null;

        for (int i = 0; i < legs.size(); i++) {
            MoveLeg leg = legs.get(i);
            int legNumber = i + 1;
            MovementType legType = leg.isNight() ? MovementType.NIGHT : movementType;
            MovementOptions options = new MovementOptions(leg.onRoad(), traits, payload.weatherModifier(), columnLength);
            double allowance = movementService.calculateDailyMovementMiles(
                    campaign.getUnitTypes(), army, legType, options, context.rules());
            if (allowance <= 0) {
                throw new OrderValidationException("movement allowance is zero for a leg");
            }
            totalFraction += leg.distanceMiles() / allowance;
            travelled.add(leg);
            finalHex = leg.toHexId();

            if (legType == MovementType.NIGHT && leg.hasFork()) {
                String seed = context.seed(rng, "night-fork:" + order.getId() + ":" + legNumber);
                if (movementService.shouldTakeWrongFork(seed, context.rules())) {
                    finalHex = leg.alternateHexId();
                    diverted = true;
                    diversionDetail = "took wrong fork on leg " + legNumber;
                    break;
                }
            }
        }

        if (totalFraction > 1.0) {
            throw new OrderValidationException("movement exceeds daily allowance");
        }
        return new MovementPlan(movementType, travelled, totalFraction, finalHex, diverted, diversionDetail);
    }
}
