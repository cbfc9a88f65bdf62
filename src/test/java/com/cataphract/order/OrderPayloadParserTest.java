package com.cataphract.order;

import com.cataphract.CampaignFixtures;
import com.cataphract.model.Order;
import com.cataphract.order.payload.HexTargetsPayload;
import com.cataphract.order.payload.MovePayload;
import com.cataphract.order.payload.NavalMovePayload;
import com.cataphract.order.payload.RestPayload;
import com.cataphract.order.payload.SupplyTransferPayload;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for OrderPayloadParser.
 */
class OrderPayloadParserTest {

    private final OrderPayloadParser parser = CampaignFixtures.parser();

    private static Order order(Map<String, Object> parameters) {
        return Order.builder().id(1).commanderId(1).orderType("test")
                .parameters(new LinkedHashMap<>(parameters)).build();
    }

    @Test
    @DisplayName("should map snake_case keys and fill defaults")
    void shouldParseMovePayload() {
        MovePayload payload = parser.parse(order(Map.of(
                "legs", List.of(Map.of("to_hex_id", 2, "distance_miles", 6)))), MovePayload.class);

        assertEquals("standard", payload.movementType());
        assertEquals(0, payload.weatherModifier());
        assertEquals(2, payload.legs().get(0).toHexId());
        assertEquals(6.0, payload.legs().get(0).distanceMiles());
        assertTrue(payload.legs().get(0).onRoad());
        assertFalse(payload.legs().get(0).isNight());
    }

    @Test
    @DisplayName("should reject an unknown key by name")
    void shouldRejectUnknownKey() {
        OrderValidationException ex = assertThrows(OrderValidationException.class,
                () -> parser.parse(order(Map.of("duration_days", 2, "speed", 3)), RestPayload.class));

        assertEquals("unknown parameter: speed", ex.getMessage());
    }

    @Test
    @DisplayName("should reject a wrongly typed value")
    void shouldRejectWrongType() {
        OrderValidationException ex = assertThrows(OrderValidationException.class,
                () -> parser.parse(order(Map.of("duration_days", "a week")), RestPayload.class));

        assertEquals("invalid order parameters", ex.getMessage());
    }

    @Test
    @DisplayName("should report a missing required key with its message")
    void shouldRejectMissingRequiredKey() {
        OrderValidationException ex = assertThrows(OrderValidationException.class,
                () -> parser.parse(order(Map.of("amount", 50)), SupplyTransferPayload.class));

        assertEquals("supply transfer requires target_army_id and amount", ex.getMessage());
    }

    @Test
    @DisplayName("should reject an empty leg list")
    void shouldRejectEmptyLegs() {
        OrderValidationException ex = assertThrows(OrderValidationException.class,
                () -> parser.parse(order(Map.of("legs", List.of())), MovePayload.class));

        assertEquals("movement order missing legs", ex.getMessage());
    }

    @Test
    @DisplayName("should validate nested legs")
    void shouldValidateNestedLegs() {
        OrderValidationException ex = assertThrows(OrderValidationException.class,
                () -> parser.parse(order(Map.of("legs", List.of(Map.of("distance_miles", 6)))), MovePayload.class));

        assertEquals("movement leg missing to_hex_id", ex.getMessage());
    }

    @Test
    @DisplayName("should reject a null hex in a naval route")
    void shouldRejectNullRouteHex() {
        Map<String, Object> parameters = new HashMap<>();
        parameters.put("ship_id", 1);
        parameters.put("route", Arrays.asList(2, null));

        OrderValidationException ex = assertThrows(OrderValidationException.class,
                () -> parser.parse(order(parameters), NavalMovePayload.class));

        assertEquals("invalid hex id in route", ex.getMessage());
    }

    @Test
    @DisplayName("should treat missing parameters as an empty map")
    void shouldAcceptNullParameters() {
        Order order = Order.builder().id(1).commanderId(1).orderType("forage").parameters(null).build();

        HexTargetsPayload payload = parser.parse(order, HexTargetsPayload.class);

        assertTrue(payload.hexIds().isEmpty());
        assertEquals("clear", payload.weather());
    }
}
