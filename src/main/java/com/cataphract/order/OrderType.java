package com.cataphract.order;

import java.util.Arrays;
import java.util.Optional;

/**
 * Every order variant the dispatcher can execute, keyed by its persisted tag.
 */
public enum OrderType {
    MOVE("move"),
    REST("rest"),
    FORAGE("forage"),
    TORCH("torch"),
    SUPPLY_TRANSFER("supply_transfer"),
    BESIEGE("besiege"),
    ASSAULT("assault"),
    EMBARK("embark"),
    DISEMBARK("disembark"),
    NAVAL_MOVE("naval_move"),
    SEND_MESSAGE("send_message"),
    LAUNCH_OPERATION("launch_operation"),
    RAISE_ARMY("raise_army"),
    HARRY("harry");

    private final String code;

    OrderType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Optional<OrderType> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(t -> t.code.equals(code))
                .findFirst();
    }
}
