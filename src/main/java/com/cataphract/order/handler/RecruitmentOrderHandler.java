package com.cataphract.order.handler;

import com.cataphract.dto.RecruitmentCompletion;
import com.cataphract.dto.RecruitmentStart;
import com.cataphract.model.Army;
import com.cataphract.model.Campaign;
import com.cataphract.model.Commander;
import com.cataphract.model.Hex;
import com.cataphract.model.Order;
import com.cataphract.model.OrderEvent;
import com.cataphract.model.RecruitmentProject;
import com.cataphract.model.Stronghold;
import com.cataphract.model.UnitType;
import com.cataphract.order.OrderContext;
import com.cataphract.order.OrderOutcome;
import com.cataphract.order.OrderPayloadParser;
import com.cataphract.order.payload.RaiseArmyPayload;
import com.cataphract.rng.SeededRng;
import com.cataphract.service.RecruitmentService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes {@code raise_army} in two phases. The first execution opens a
 * recruitment project, records it on the order and reschedules the order
 * for the muster's last day; the second creates the army.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RecruitmentOrderHandler {

    static final String DEFAULT_ARMY_NAME = "Raised Army";

    private final OrderPayloadParser parser;
    private final RecruitmentService recruitmentService;
    private final SeededRng rng;

    public OrderOutcome raiseArmy(OrderContext context, Order order, Army army) {
        RaiseArmyPayload payload = parser.parse(order, RaiseArmyPayload.class);
        if (order.getScheduledProjectId() == null) {
            return start(context, order, payload);
        }
        return complete(context, order, payload);
    }

    private OrderOutcome start(OrderContext context, Order order, RaiseArmyPayload payload) {
        Campaign campaign = context.campaign();
        Stronghold stronghold = campaign.getStrongholds().get(payload.strongholdId());
        if (stronghold == null) {
            return OrderOutcome.failed("stronghold not found");
        }
        Commander commander = campaign.getCommanders().get(payload.newCommanderId());
        if (commander == null) {
            return OrderOutcome.failed("commander not found");
        }
        if (!campaign.getUnitTypes().containsKey(payload.infantryUnitTypeId())
                || (payload.cavalryUnitTypeId() != null
                && !campaign.getUnitTypes().containsKey(payload.cavalryUnitTypeId()))) {
            return OrderOutcome.failed("unit type not found");
        }
        int rallyHexId = payload.rallyHexId() != null ? payload.rallyHexId() : payload.strongholdId();
        Hex rallyHex = campaign.getHexes().get(rallyHexId);
        if (rallyHex == null) {
            return OrderOutcome.failed("rally hex not found");
        }

        RecruitmentStart started;
        try {
            started = recruitmentService.start(campaign, stronghold, commander, rallyHex, order.getId(),
                    context.seed(rng, "recruitment:" + order.getId()), context.rules());
        } catch (IllegalArgumentException e) {
            return OrderOutcome.failed(e.getMessage());
        }

        RecruitmentProject project = started.getProject();
        order.setScheduledProjectId(project.getId());
        order.setExecuteDay(project.getCompletesOnDay());
        if (payload.armyName() == null) {
            Map<String, Object> parameters = new LinkedHashMap<>(order.getParameters());
            parameters.put("army_name", commander.getName() != null ? commander.getName() : DEFAULT_ARMY_NAME);
            order.setParameters(parameters);
        }

        List<OrderEvent> events = started.getRevolts().isEmpty()
                ? List.of()
                : List.of(OrderEvent.of("recruitment_revolt",
                        "army_ids", started.getRevolts().stream().map(Army::getId).toList()));
        return OrderOutcome.executing(started.getDetail(), events);
    }

    private OrderOutcome complete(OrderContext context, Order order, RaiseArmyPayload payload) {
        Campaign campaign = context.campaign();
        RecruitmentProject project = campaign.getRecruitments().get(order.getScheduledProjectId());
        if (project == null) {
            return OrderOutcome.failed("recruitment project missing");
        }
        if (campaign.getCurrentDay() < project.getCompletesOnDay()) {
            int remaining = project.getCompletesOnDay() - campaign.getCurrentDay();
            order.setExecuteDay(project.getCompletesOnDay());
            return OrderOutcome.executing("recruitment in progress; " + remaining + " day(s) remaining", List.of());
        }

        UnitType infantry = campaign.getUnitTypes().get(payload.infantryUnitTypeId());
        UnitType cavalry = payload.cavalryUnitTypeId() != null
                ? campaign.getUnitTypes().get(payload.cavalryUnitTypeId())
                : null;
        if (infantry == null || (payload.cavalryUnitTypeId() != null && cavalry == null)) {
            return OrderOutcome.failed("unit type not found");
        }

        String name = payload.armyName() != null ? payload.armyName() : DEFAULT_ARMY_NAME;
        RecruitmentCompletion completion;
        try {
            completion = recruitmentService.complete(campaign, project, name, infantry, cavalry, context.rules());
        } catch (IllegalArgumentException e) {
            return OrderOutcome.failed(e.getMessage());
        }
        log.info("Order {} raised army {}", order.getId(), completion.army().getId());
        return OrderOutcome.completed(completion.detail());
    }
}
