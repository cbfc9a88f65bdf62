package com.cataphract.websocket;

import com.cataphract.dto.TickReport;
import com.cataphract.model.Order;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Pushes campaign events to STOMP subscribers.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CampaignWebSocketHandler {

    static final String TOPIC_PREFIX = "/topic/campaign/";

    private final SimpMessagingTemplate messagingTemplate;

    /**
     * Broadcast the outcome of a daily tick. A failed broadcast is logged
     * and never undoes the tick.
     */
    public void broadcastTickReport(TickReport report) {
        send(report.getCampaignId(), CampaignMessage.of("TICK_COMPLETED", report));
    }

    public void broadcastOrderSubmitted(int campaignId, Order order) {
        send(campaignId, CampaignMessage.of("ORDER_SUBMITTED", order));
    }

    public void broadcastOrderCancelled(int campaignId, Order order) {
        send(campaignId, CampaignMessage.of("ORDER_CANCELLED", order));
    }

    private void send(int campaignId, CampaignMessage message) {
        try {
            messagingTemplate.convertAndSend(TOPIC_PREFIX + campaignId, message);
            log.debug("Broadcast {} for campaign {}", message.getType(), campaignId);
        } catch (RuntimeException e) {
            log.error("Error broadcasting {} for campaign {}", message.getType(), campaignId, e);
        }
    }

    /**
     * Generic campaign message wrapper.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class CampaignMessage {
        private String type;
        private Object payload;
        private long timestamp;

        public static CampaignMessage of(String type, Object payload) {
            return CampaignMessage.builder()
                    .type(type)
                    .payload(payload)
                    .timestamp(System.currentTimeMillis())
                    .build();
        }
    }
}
