package com.cataphract.order.handler;

import com.cataphract.dto.HarryingResult;
import com.cataphract.dto.MessageDispatchResult;
import com.cataphract.dto.OperationResult;
import com.cataphract.model.Army;
import com.cataphract.model.Campaign;
import com.cataphract.model.Commander;
import com.cataphract.model.Detachment;
import com.cataphract.model.Message;
import com.cataphract.model.MessageStatus;
import com.cataphract.model.Operation;
import com.cataphract.model.OperationType;
import com.cataphract.model.Order;
import com.cataphract.model.OrderEvent;
import com.cataphract.model.OrderStatus;
import com.cataphract.model.TerritoryType;
import com.cataphract.order.OrderContext;
import com.cataphract.order.OrderOutcome;
import com.cataphract.order.OrderPayloadParser;
import com.cataphract.order.payload.HarryPayload;
import com.cataphract.order.payload.LaunchOperationPayload;
import com.cataphract.order.payload.SendMessagePayload;
import com.cataphract.rng.SeededRng;
import com.cataphract.service.HarryingService;
import com.cataphract.service.MessagingService;
import com.cataphract.service.OperationsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Executes the orders a commander gives beyond marching and fighting:
 * {@code send_message}, {@code launch_operation} and {@code harry}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CommandOrderHandler {

    private final OrderPayloadParser parser;
    private final MessagingService messagingService;
    private final OperationsService operationsService;
    private final HarryingService harryingService;
    private final SeededRng rng;

    // ── messages ────────────────────────────────────────────────────────

    /**
     * Sends a courier from the army's hex, or from the issuing commander
     * when the order names no army.
     */
    public OrderOutcome sendMessage(OrderContext context, Order order, Army army) {
        SendMessagePayload payload = parser.parse(order, SendMessagePayload.class);
        Campaign campaign = context.campaign();

        Message message = Message.builder()
                .id(campaign.getNextMessageId())
                .senderId(army != null ? army.getCommanderId() : order.getCommanderId())
                .recipientId(payload.recipientId())
                .content(payload.content())
                .sentAt(order.getIssuedAt())
                .status(MessageStatus.IN_TRANSIT)
                .build();

        Integer fromHex = army != null ? army.getCurrentHexId() : null;
        Commander recipient = campaign.getCommanders().get(payload.recipientId());
        Integer toHex = recipient != null ? recipient.getCurrentHexId() : null;

        MessageDispatchResult result = messagingService.dispatch(campaign, message, payload.territoryType(),
                fromHex, toHex, context.rules());
        return result.success() ? OrderOutcome.completed(result.detail()) : OrderOutcome.failed(result.detail());
    }

    // ── operations ──────────────────────────────────────────────────────

    /**
     * Resolves an existing operation, or registers and resolves a new one.
     * A failed operation still completes the order.
     */
    public OrderOutcome launchOperation(OrderContext context, Order order, Army army) {
        LaunchOperationPayload payload = parser.parse(order, LaunchOperationPayload.class);
        Campaign campaign = context.campaign();

        Operation operation = payload.operationId() != null
                ? campaign.getOperations().get(payload.operationId())
                : null;
        if (operation == null) {
            Optional<TerritoryType> territory = TerritoryType.fromCode(payload.territoryType());
            if (territory.isEmpty()) {
                return OrderOutcome.failed("unknown territory: " + payload.territoryType());
            }
            operation = Operation.builder()
                    .id(campaign.getNextOperationId())
                    .commanderId(order.getCommanderId())
                    .operationType(OperationType.fromCode(payload.operationType()).orElse(OperationType.INTELLIGENCE))
                    .targetDescriptor(payload.targetDescriptor())
                    .lootCost(payload.lootCost() != null
                            ? payload.lootCost()
                            : context.rules().getOperations().getLootCostDefault())
                    .complexity(payload.complexity())
                    .difficultyModifier(payload.difficultyModifier())
                    .territoryType(territory.get())
                    .build();
            campaign.getOperations().put(operation.getId(), operation);
        }

        OperationResult result = operationsService.resolve(campaign, operation,
                context.seed(rng, "operation:" + operation.getId()), context.rules());
        return OrderOutcome.completed(result.detail());
    }

    // ── harrying ────────────────────────────────────────────────────────

    public OrderOutcome harry(OrderContext context, Order order, Army army) {
        if (army == null) {
            return OrderOutcome.failed("harry order requires an army");
        }
        HarryPayload payload = parser.parse(order, HarryPayload.class);
        Campaign campaign = context.campaign();

        LinkedHashSet<Integer> wanted = new LinkedHashSet<>(payload.detachmentIds());
        List<Detachment> party = army.getDetachments().stream()
                .filter(d -> wanted.contains(d.getId()))
                .toList();
        if (party.isEmpty()) {
            return OrderOutcome.failed("no matching detachments for harrying");
        }
        Army target = campaign.getArmies().get(payload.targetArmyId());
        if (target == null) {
            return OrderOutcome.failed("target army not found");
        }

        HarryingResult result;
        try {
            result = harryingService.resolve(campaign, army, target, party, payload.objective(),
                    context.seed(rng, "harry:" + order.getId()), context.rules());
        } catch (IllegalArgumentException e) {
            return OrderOutcome.failed(e.getMessage());
        }

        OrderEvent event = OrderEvent.of("harry",
                "success", result.isSuccess(),
                "target_army_id", target.getId(),
                "objective", payload.objective(),
                "roll", result.getRoll(),
                "modifier", result.getModifier(),
                "inflicted_casualties", result.getInflictedCasualties(),
                "attacker_losses", result.getAttackerLosses(),
                "supplies_burned", result.getSuppliesBurned(),
                "supplies_stolen", result.getSuppliesStolen(),
                "loot_stolen", result.getLootStolen());
        return new OrderOutcome(result.isSuccess() ? OrderStatus.COMPLETED
                : OrderStatus.FAILED, result.getDetail(), List.of(event));
    }
}
