package com.cataphract.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Axial hex coordinate. Distances are computed in cube space.
 */
public record HexCoord(int q, int r) {

    public int distanceTo(HexCoord other) {
        int dq = q - other.q;
        int dr = r - other.r;
        int ds = -dq - dr;
        return Math.max(Math.abs(dq), Math.max(Math.abs(dr), Math.abs(ds)));
    }

    /**
     * Every coordinate within {@code radius} steps, including this one.
     */
    public List<HexCoord> withinRange(int radius) {
        List<HexCoord> result = new ArrayList<>();
        for (int dq = -radius; dq <= radius; dq++) {
            int low = Math.max(-radius, -dq - radius);
            int high = Math.min(radius, -dq + radius);
            for (int dr = low; dr <= high; dr++) {
                result.add(new HexCoord(q + dq, r + dr));
            }
        }
        return result;
    }
}
