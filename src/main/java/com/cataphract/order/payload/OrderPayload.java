package com.cataphract.order.payload;

/**
 * Typed parameters of an order, parsed from its persisted parameter map.
 */
public sealed interface OrderPayload permits MovePayload, RestPayload, HexTargetsPayload, SupplyTransferPayload,
        BesiegePayload, AssaultPayload, ShipPayload, NavalMovePayload, SendMessagePayload, LaunchOperationPayload,
        RaiseArmyPayload, HarryPayload {
}
