package com.cataphract.order.handler;

import com.cataphract.dto.ForageOutcome;
import com.cataphract.dto.TorchOutcome;
import com.cataphract.model.Army;
import com.cataphract.model.ArmyStatus;
import com.cataphract.model.Campaign;
import com.cataphract.model.Order;
import com.cataphract.order.OrderContext;
import com.cataphract.order.OrderOutcome;
import com.cataphract.order.OrderPayloadParser;
import com.cataphract.order.payload.HexTargetsPayload;
import com.cataphract.order.payload.RestPayload;
import com.cataphract.order.payload.SupplyTransferPayload;
import com.cataphract.rng.SeededRng;
import com.cataphract.service.MoraleService;
import com.cataphract.service.SupplyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Executes the orders that keep an army fed and rested:
 * {@code rest}, {@code forage}, {@code torch} and {@code supply_transfer}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SustainmentOrderHandler {

    private final OrderPayloadParser parser;
    private final SupplyService supplyService;
    private final MoraleService moraleService;
    private final SeededRng rng;

    public OrderOutcome rest(OrderContext context, Order order, Army army) {
        if (army == null) {
            return OrderOutcome.failed("rest order requires an army");
        }
        int today = context.campaign().getCurrentDay();
        if (army.isHarriedOn(today)) {
            return OrderOutcome.failed("army is harried and cannot rest today");
        }
        RestPayload payload = parser.parse(order, RestPayload.class);
        int duration = payload.durationDays();
        if (duration <= 0) {
            return OrderOutcome.failed("rest duration must be positive");
        }

        army.setStatus(ArmyStatus.RESTING);
        army.setRestDurationDays(duration);
        army.setRestStartedDay(today);
        army.setDaysMarchedThisWeek(0);
        army.setMovementPointsRemaining(0.0);
        army.setDestinationHexId(null);
        moraleService.adjustMorale(army, Math.max(0, army.getMoraleResting() - army.getMoraleCurrent()));

        return OrderOutcome.completed("resting for " + duration + " day(s)");
    }

    public OrderOutcome forage(OrderContext context, Order order, Army army) {
        if (army == null) {
            return OrderOutcome.failed("forage order requires an army");
        }
        HexTargetsPayload payload = parser.parse(order, HexTargetsPayload.class);
        if (payload.hexIds().isEmpty()) {
            return OrderOutcome.failed("forage order missing hex_ids");
        }

        ForageOutcome outcome = supplyService.forage(context.campaign(), army, payload.hexIds(), payload.weather(),
                context.seed(rng, "forage:" + order.getId()), context.rules());
        StringBuilder detail = new StringBuilder("foraged ").append(outcome.getForagedHexes().size()).append(" hex(es)");
        if (outcome.getSuppliesGained() > 0) {
            detail.append(" gaining ").append(outcome.getSuppliesGained()).append(" supplies");
        }
        if (outcome.isRevoltTriggered()) {
            detail.append("; revolt triggered");
        }
        if (!outcome.isSuccess()) {
            return OrderOutcome.failed(detail.toString());
        }
        army.setStatus(ArmyStatus.FORAGING);
        return OrderOutcome.completed(detail.toString());
    }

    public OrderOutcome torch(OrderContext context, Order order, Army army) {
        if (army == null) {
            return OrderOutcome.failed("torch order requires an army");
        }
        HexTargetsPayload payload = parser.parse(order, HexTargetsPayload.class);
        if (payload.hexIds().isEmpty()) {
            return OrderOutcome.failed("torch order missing hex_ids");
        }

        TorchOutcome outcome = supplyService.torch(context.campaign(), army, payload.hexIds(), payload.weather(),
                context.seed(rng, "torch:" + order.getId()), context.rules());
        String detail = "torched " + outcome.getTorchedHexes().size() + " hex(es)";
        if (outcome.isRevoltTriggered()) {
            detail += "; revolt triggered";
        }
        if (!outcome.isSuccess()) {
            return OrderOutcome.failed(detail);
        }
        army.setStatus(ArmyStatus.TORCHING);
        return OrderOutcome.completed(detail);
    }

    /**
     * Moves supplies to another army, limited by what the source carries
     * and what the target can hold.
     */
    public OrderOutcome supplyTransfer(OrderContext context, Order order, Army army) {
        if (army == null) {
            return OrderOutcome.failed("supply transfer requires an army");
        }
        SupplyTransferPayload payload = parser.parse(order, SupplyTransferPayload.class);
        if (payload.amount() <= 0) {
            return OrderOutcome.failed("transfer amount must be positive");
        }
        Campaign campaign = context.campaign();
        Army target = campaign.getArmies().get(payload.targetArmyId());
        if (target == null) {
            return OrderOutcome.failed("target army not found");
        }

        int transferred = Math.min(Math.min(payload.amount(), army.getSuppliesCurrent()),
                target.getFreeSupplyCapacity());
        if (transferred <= 0) {
            return OrderOutcome.failed("no supplies transferable");
        }
        army.setSuppliesCurrent(army.getSuppliesCurrent() - transferred);
        target.setSuppliesCurrent(target.getSuppliesCurrent() + transferred);

        log.debug("Army {} transferred {} supplies to army {}", army.getId(), transferred, target.getId());
        return OrderOutcome.completed("transferred " + transferred + " supplies to army " + target.getId());
    }
}
