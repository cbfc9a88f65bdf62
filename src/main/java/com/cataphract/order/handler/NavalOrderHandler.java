package com.cataphract.order.handler;

import com.cataphract.dto.NavalActionResult;
import com.cataphract.model.Army;
import com.cataphract.model.Order;
import com.cataphract.model.Ship;
import com.cataphract.order.OrderContext;
import com.cataphract.order.OrderOutcome;
import com.cataphract.order.OrderPayloadParser;
import com.cataphract.order.payload.NavalMovePayload;
import com.cataphract.order.payload.ShipPayload;
import com.cataphract.service.NavalService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Executes {@code embark}, {@code disembark} and {@code naval_move} orders.
 */
@Component
@RequiredArgsConstructor
public class NavalOrderHandler {

    private final OrderPayloadParser parser;
    private final NavalService navalService;

    public OrderOutcome embark(OrderContext context, Order order, Army army) {
        if (army == null) {
            return OrderOutcome.failed("embark order requires an army");
        }
        Integer shipId = parser.parse(order, ShipPayload.class).shipId();
        if (shipId == null) {
            return OrderOutcome.failed("embark order missing ship_id");
        }
        Ship ship = context.campaign().getShips().get(shipId);
        if (ship == null) {
            return OrderOutcome.failed("ship not found");
        }
        return toOutcome(navalService.embark(army, ship, context.rules()));
    }

    public OrderOutcome disembark(OrderContext context, Order order, Army army) {
        if (army == null) {
            return OrderOutcome.failed("disembark order requires an army");
        }
        Integer shipId = parser.parse(order, ShipPayload.class).shipId();
        if (shipId == null) {
            return OrderOutcome.failed("disembark order missing ship_id");
        }
        Ship ship = context.campaign().getShips().get(shipId);
        if (ship == null) {
            return OrderOutcome.failed("ship not found");
        }
        return toOutcome(navalService.disembark(army, ship, context.rules()));
    }

    /**
     * Sets a ship on course. The order needs no army.
     */
    public OrderOutcome navalMove(OrderContext context, Order order, Army army) {
        NavalMovePayload payload = parser.parse(order, NavalMovePayload.class);
        Ship ship = context.campaign().getShips().get(payload.shipId());
        if (ship == null) {
            return OrderOutcome.failed("ship not found");
        }
        return toOutcome(navalService.setCourse(context.campaign(), ship, payload.route(), context.rules()));
    }

    private static OrderOutcome toOutcome(NavalActionResult result) {
        return result.success() ? OrderOutcome.completed(result.detail()) : OrderOutcome.failed(result.detail());
    }
}
