package com.cataphract.model;

/**
 * Standing of a hex relative to the faction of the army acting on it.
 */
public enum HexAllegiance {
    NEUTRAL,
    FRIENDLY,
    RECENTLY_CONQUERED,
    HOSTILE
}
