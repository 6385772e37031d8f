package com.tictactoe.game;

import java.util.Arrays;
import java.util.List;

/**
 * A 3x3 board stored as 9 cells in row-major order (index 0 is top-left,
 * index 8 is bottom-right).
 *
 * Not thread-safe on its own: a board is only touched through its owning
 * {@link GameSession} while that session's lock is held.
 */
public class Board {

    public static final int SIZE = 9;

    // 3 rows, 3 columns, 2 diagonals
    static final int[][] LINES = {
            {0, 1, 2}, {3, 4, 5}, {6, 7, 8},
            {0, 3, 6}, {1, 4, 7}, {2, 5, 8},
            {0, 4, 8}, {2, 4, 6}
    };

    private final Mark[] cells;

    public Board() {
        this.cells = new Mark[SIZE];
        Arrays.fill(cells, Mark.EMPTY);
    }

    public static boolean isValidIndex(int index) {
        return index >= 0 && index < SIZE;
    }

    public Mark get(int index) {
        return cells[index];
    }

    public boolean isEmpty(int index) {
        return cells[index] == Mark.EMPTY;
    }

    /**
     * Places a mark on an empty cell.
     *
     * @throws IllegalStateException if the cell is already taken
     */
    void place(int index, Mark mark) {
        if (!mark.isRole()) {
            throw new IllegalArgumentException("Cannot place " + mark);
        }
        if (cells[index] != Mark.EMPTY) {
            throw new IllegalStateException("Cell " + index + " already holds " + cells[index]);
        }
        cells[index] = mark;
    }

    void clear() {
        Arrays.fill(cells, Mark.EMPTY);
    }

    /**
     * Returns the mark that owns a complete line, or EMPTY if no line is complete.
     */
    public Mark winner() {
        for (int[] line : LINES) {
            Mark first = cells[line[0]];
            if (first != Mark.EMPTY && first == cells[line[1]] && first == cells[line[2]]) {
                return first;
            }
        }
        return Mark.EMPTY;
    }

    public boolean isFull() {
        for (Mark cell : cells) {
            if (cell == Mark.EMPTY) {
                return false;
            }
        }
        return true;
    }

    /**
     * Immutable copy of the cells, suitable for snapshots.
     */
    public List<Mark> toList() {
        return List.of(cells.clone());
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < SIZE; i++) {
            Mark cell = cells[i];
            sb.append(cell == Mark.EMPTY ? '.' : cell.name().charAt(0));
            if (i % 3 == 2 && i < SIZE - 1) {
                sb.append('/');
            }
        }
        return "Board{" + sb + '}';
    }
}
