package com.cubefour.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Utility responsible for constructing all 76 winning lines of the cube and for indexing them by
 * cell.
 */
public final class LineCatalog {

    public static final int LINE_COUNT = 76;

    /**
     * One representative per line direction: the three axes, the six planar diagonals and the four
     * space diagonals.
     */
    private static final int[][] DIRECTIONS = {
            {1, 0, 0}, {0, 1, 0}, {0, 0, 1},
            {1, 1, 0}, {1, -1, 0},
            {1, 0, 1}, {1, 0, -1},
            {0, 1, 1}, {0, 1, -1},
            {1, 1, 1}, {1, 1, -1}, {1, -1, 1}, {1, -1, -1}
    };

    private static final List<Line> LINES;
    private static final long[] LINE_MASKS;
    private static final int[][] LINES_BY_CELL;

    static {
        List<Line> lines = new ArrayList<>();
        for (int[] direction : DIRECTIONS) {
            generateLines(direction[0], direction[1], direction[2], lines);
        }
        if (lines.size() != LINE_COUNT) {
            throw new IllegalStateException("Generated " + lines.size() + " lines instead of " + LINE_COUNT);
        }

        long[] masks = new long[lines.size()];
        int[] lineCounts = new int[Board.CELL_COUNT];
        for (Line line : lines) {
            masks[line.id()] = line.mask();
            for (Coordinate cell : line.cells()) {
                lineCounts[cell.index()]++;
            }
        }

        int[][] linesByCell = new int[Board.CELL_COUNT][];
        for (int cell = 0; cell < Board.CELL_COUNT; cell++) {
            linesByCell[cell] = new int[lineCounts[cell]];
            lineCounts[cell] = 0;
        }
        for (Line line : lines) {
            for (Coordinate cell : line.cells()) {
                int index = cell.index();
                linesByCell[index][lineCounts[index]++] = line.id();
            }
        }

        LINES = Collections.unmodifiableList(lines);
        LINE_MASKS = masks;
        LINES_BY_CELL = linesByCell;
    }

    private LineCatalog() {
    }

    /**
     * Returns the immutable list of all winning lines, ordered by {@link Line#id()}.
     */
    public static List<Line> allLines() {
        return LINES;
    }

    public static Line line(int id) {
        return LINES.get(id);
    }

    /**
     * Returns a defensive copy of all line bit masks, indexed by line id.
     */
    public static long[] lineMasks() {
        return LINE_MASKS.clone();
    }

    /**
     * Returns the mask of the line with the provided id without copying.
     */
    static long maskOf(int lineId) {
        return LINE_MASKS[lineId];
    }

    /**
     * Returns the ids of every line passing through the provided cell.
     */
    public static int[] linesThrough(int cellIndex) {
        return LINES_BY_CELL[cellIndex].clone();
    }

    static int[] linesThroughUnsafe(int cellIndex) {
        return LINES_BY_CELL[cellIndex];
    }

    private static void generateLines(int dx, int dy, int dz, List<Line> lines) {
        for (int z = 0; z < Board.SIZE; z++) {
            for (int y = 0; y < Board.SIZE; y++) {
                for (int x = 0; x < Board.SIZE; x++) {
                    if (isStart(x, dx) && isStart(y, dy) && isStart(z, dz)) {
                        lines.add(collectLine(lines.size(), x, y, z, dx, dy, dz));
                    }
                }
            }
        }
    }

    // A line spans the whole cube along every axis it moves on.
    private static boolean isStart(int coordinate, int step) {
        if (step == 0) {
            return true;
        }
        return step > 0 ? coordinate == 0 : coordinate == Board.SIZE - 1;
    }

    private static Line collectLine(int id, int x, int y, int z, int dx, int dy, int dz) {
        List<Coordinate> cells = new ArrayList<>(Board.SIZE);
        long mask = 0L;
        for (int step = 0; step < Board.SIZE; step++) {
            Coordinate cell = new Coordinate(x + step * dx, y + step * dy, z + step * dz);
            cells.add(cell);
            mask |= 1L << cell.index();
        }
        return new Line(id, cells, mask);
    }
}
