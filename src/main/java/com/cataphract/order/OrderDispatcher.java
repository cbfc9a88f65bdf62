package com.cataphract.order;

import com.cataphract.model.Army;
import com.cataphract.model.Order;
import com.cataphract.model.OrderResult;
import com.cataphract.model.OrderStatus;
import com.cataphract.order.handler.CommandOrderHandler;
import com.cataphract.order.handler.MovementOrderHandler;
import com.cataphract.order.handler.NavalOrderHandler;
import com.cataphract.order.handler.RecruitmentOrderHandler;
import com.cataphract.order.handler.SiegeOrderHandler;
import com.cataphract.order.handler.SustainmentOrderHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Service responsible for executing a single order against a campaign.
 * <p>
 * Every failure a player can cause ends as a FAILED order with a detail
 * message; nothing is thrown back to the caller. The order's status and
 * result are written here, after the handler has run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderDispatcher {

    static final String ALREADY_RESOLVED = "order already resolved";

    private final MovementOrderHandler movementHandler;
    private final SustainmentOrderHandler sustainmentHandler;
    private final SiegeOrderHandler siegeHandler;
    private final NavalOrderHandler navalHandler;
    private final CommandOrderHandler commandHandler;
    private final RecruitmentOrderHandler recruitmentHandler;

    public OrderOutcome execute(OrderContext context, Order order) {
        if (order.getStatus().isTerminal()) {
            return new OrderOutcome(order.getStatus(), ALREADY_RESOLVED, null);
        }

        Optional<OrderType> type = OrderType.fromCode(order.getOrderType());
        if (type.isEmpty()) {
            return fail(order, "unsupported order type: " + order.getOrderType());
        }

        Army army = null;
        if (order.getArmyId() != null) {
            army = context.campaign().getArmies().get(order.getArmyId());
            if (army == null) {
                return fail(order, "army " + order.getArmyId() + " not found");
            }
        }

        order.setStatus(OrderStatus.EXECUTING);
        OrderOutcome outcome;
        try {
            outcome = handle(type.get(), context, order, army);
        } catch (OrderValidationException e) {
            outcome = OrderOutcome.failed(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Order {} ({}) aborted by an unexpected error", order.getId(), order.getOrderType(), e);
            outcome = OrderOutcome.failed("internal error while executing order");
        }

        order.setStatus(outcome.status());
        order.setResult(outcome.hasResult() ? new OrderResult(outcome.detail(), outcome.events()) : null);
        log.debug("Order {} ({}) -> {}: {}", order.getId(), order.getOrderType(), outcome.status(), outcome.detail());
        return outcome;
    }

    private OrderOutcome handle(OrderType type, OrderContext context, Order order, Army army) {
        return switch (type) {
            case MOVE -> movementHandler.move(context, order, army);
            case REST -> sustainmentHandler.rest(context, order, army);
            case FORAGE -> sustainmentHandler.forage(context, order, army);
            case TORCH -> sustainmentHandler.torch(context, order, army);
            case SUPPLY_TRANSFER -> sustainmentHandler.supplyTransfer(context, order, army);
            case BESIEGE -> siegeHandler.besiege(context, order, army);
            case ASSAULT -> siegeHandler.assault(context, order, army);
            case EMBARK -> navalHandler.embark(context, order, army);
            case DISEMBARK -> navalHandler.disembark(context, order, army);
            case NAVAL_MOVE -> navalHandler.navalMove(context, order, army);
            case SEND_MESSAGE -> commandHandler.sendMessage(context, order, army);
            case LAUNCH_OPERATION -> commandHandler.launchOperation(context, order, army);
            case RAISE_ARMY -> recruitmentHandler.raiseArmy(context, order, army);
            case HARRY -> commandHandler.harry(context, order, army);
        };
    }

    private static OrderOutcome fail(Order order, String detail) {
        log.debug("Order {} failed: {}", order.getId(), detail);
        order.setStatus(OrderStatus.FAILED);
        order.setResult(new OrderResult(detail, null));
        return OrderOutcome.failed(detail);
    }
}
