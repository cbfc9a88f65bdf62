package com.cataphract.service;

import com.cataphract.config.RulesConfig;
import com.cataphract.dto.MessageDispatchResult;
import com.cataphract.model.Campaign;
import com.cataphract.model.Commander;
import com.cataphract.model.Hex;
import com.cataphract.model.Message;
import com.cataphract.model.MessageStatus;
import com.cataphract.model.TerritoryType;
import com.cataphract.rng.SeededRng;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Service responsible for courier travel time and delivery.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MessagingService {

    private final SeededRng rng;

    /**
     * Computes travel time and stores the message in transit. A null
     * {@code fromHexId} or {@code toHexId} falls back to the commanders' positions.
     */
    public MessageDispatchResult dispatch(Campaign campaign, Message message, String territoryCode,
                                          Integer fromHexId, Integer toHexId, RulesConfig rules) {
        Optional<TerritoryType> territory = TerritoryType.fromCode(territoryCode);
        if (territory.isEmpty()) {
            return new MessageDispatchResult(false, "unknown territory: " + territoryCode, null);
        }

        Integer from = fromHexId != null ? fromHexId : commanderHex(campaign, message.getSenderId());
        Integer to = toHexId != null ? toHexId : commanderHex(campaign, message.getRecipientId());
        if (from == null || to == null) {
            return new MessageDispatchResult(false, "sender or recipient location unknown", null);
        }
        Hex origin = campaign.getHexes().get(from);
        Hex destination = campaign.getHexes().get(to);
        if (origin == null || destination == null) {
            return new MessageDispatchResult(false, "origin or destination hex missing", null);
        }

        int miles = Math.max(1, origin.distanceTo(destination)) * NavalService.HEX_MILES;
        double travelDays = Math.max(1.0, (double) miles / speedFor(territory.get(), rules));

        message.setTerritoryType(territory.get());
        message.setTravelTimeDays(travelDays);
        message.setDaysRemaining(travelDays);
        message.setStatus(MessageStatus.IN_TRANSIT);
        campaign.getMessages().put(message.getId(), message);

        return new MessageDispatchResult(true, String.format("message dispatched: %.2f days", travelDays), message);
    }

    /**
     * Moves couriers along; arrivals roll for interception.
     *
     * @return ids of messages delivered during this step
     */
    public List<Integer> advanceMessages(Campaign campaign, double dayFraction, String seedPrefix, RulesConfig rules) {
        List<Integer> delivered = new ArrayList<>();
        for (Message message : campaign.getMessages().values()) {
            if (message.getStatus() != MessageStatus.IN_TRANSIT) {
                continue;
            }
            message.setDaysRemaining(Math.max(0.0, message.getDaysRemaining() - dayFraction));
            if (message.getDaysRemaining() > 0) {
                continue;
            }

            RulesConfig.Messaging messaging = rules.getMessaging();
            boolean hostile = message.getTerritoryType() == TerritoryType.HOSTILE;
            int numerator = hostile ? messaging.getHostileSuccessNumerator() : messaging.getFriendlySuccessNumerator();
            int denominator = hostile ? messaging.getHostileSuccessDenominator() : messaging.getFriendlySuccessDenominator();
            int roll = rng.rollDice(seedPrefix + ":message:" + message.getId(), "1d" + denominator).total();

            if (roll <= numerator) {
                message.setStatus(MessageStatus.DELIVERED);
                message.setDeliveredAt(message.getDeliveredAt() != null ? message.getDeliveredAt() : LocalDateTime.now());
                message.setDeliveredOnDay(campaign.getCurrentDay());
                message.setFailureReason(null);
                delivered.add(message.getId());
            } else {
                message.setStatus(MessageStatus.FAILED);
                message.setFailureReason("intercepted");
                log.debug("Message {} intercepted (roll {})", message.getId(), roll);
            }
        }
        return delivered;
    }

    private static Integer commanderHex(Campaign campaign, int commanderId) {
        Commander commander = campaign.getCommanders().get(commanderId);
        return commander != null ? commander.getCurrentHexId() : null;
    }

    private static int speedFor(TerritoryType territory, RulesConfig rules) {
        return switch (territory) {
            case FRIENDLY -> rules.getMessaging().getFriendlyMilesPerDay();
            case NEUTRAL -> rules.getMessaging().getNeutralMilesPerDay();
            case HOSTILE -> rules.getMessaging().getHostileMilesPerDay();
        };
    }
}
