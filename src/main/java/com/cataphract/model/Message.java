package com.cataphract.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A courier message between two commanders.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Message {

    private int id;
    private int senderId;
    private int recipientId;
    private String content;
    private LocalDateTime sentAt;
    private LocalDateTime deliveredAt;
    private Integer deliveredOnDay;
    private double travelTimeDays;

    @Builder.Default
    private TerritoryType territoryType = TerritoryType.FRIENDLY;

    @Builder.Default
    private MessageStatus status = MessageStatus.IN_TRANSIT;

    private double daysRemaining;
    private String failureReason;
}
