package com.cataphract.battle;

public enum BattleSide {
    ATTACKER,
    DEFENDER
}
