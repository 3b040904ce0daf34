package com.cubefour.core;

import java.util.List;
import java.util.Objects;

/**
 * One of the fixed four-cell winning lines.
 *
 * @param id    position of the line inside {@link LineCatalog#allLines()}
 * @param cells the four cells in order along the line direction
 * @param mask  bit mask with one bit set per cell index
 */
public record Line(int id, List<Coordinate> cells, long mask) {

    public Line {
        Objects.requireNonNull(cells, "cells");
        cells = List.copyOf(cells);
        if (cells.size() != Board.SIZE) {
            throw new IllegalArgumentException("A line must contain exactly " + Board.SIZE + " cells");
        }
        long expected = 0L;
        for (Coordinate cell : cells) {
            expected |= 1L << cell.index();
        }
        if (Long.bitCount(expected) != Board.SIZE || expected != mask) {
            throw new IllegalArgumentException("Mask does not match the line cells: " + cells);
        }
    }

    public boolean contains(int cellIndex) {
        return (mask & (1L << cellIndex)) != 0;
    }
}
