package max.chess.rules.common;

import max.chess.rules.utils.notations.MoveIOUtils;

/**
 * One of the 64 board squares. Instances are interned, so identity equality holds.
 * File and rank are 0-based: a1 is (0, 0), h8 is (7, 7).
 */
public final class Square {
    private static final Square[] SQUARE_CACHE = new Square[64];
    static {
        for(int i = 0; i < 64; i++) {
            SQUARE_CACHE[i] = new Square(i % 8, i / 8);
        }
    }

    public static final Square A1 = of(0, 0);
    public static final Square H1 = of(7, 0);
    public static final Square A8 = of(0, 7);
    public static final Square H8 = of(7, 7);

    public static boolean isOnBoard(int file, int rank) {
        return file >= 0 && file < 8 && rank >= 0 && rank < 8;
    }

    public static Square of(int file, int rank) {
        if(!isOnBoard(file, rank)) {
            throw new IllegalArgumentException("Square out of board: file=" + file + ", rank=" + rank);
        }
        return SQUARE_CACHE[rank * 8 + file];
    }

    public static Square of(int flatIndex) {
        if(flatIndex < 0 || flatIndex >= 64) {
            throw new IllegalArgumentException("Square index out of board: " + flatIndex);
        }
        return SQUARE_CACHE[flatIndex];
    }

    /** Parses the canonical text form, e.g. "e4". */
    public static Square of(String text) {
        return MoveIOUtils.getSquareFromText(text);
    }

    private final int file;
    private final int rank;
    private final int flatIndex;

    private Square(int file, int rank) {
        this.file = file;
        this.rank = rank;
        this.flatIndex = file + 8 * rank;
    }

    /** Returns the square shifted by the given deltas, or null when it falls off the board. */
    public Square translate(int fileDelta, int rankDelta) {
        int newFile = file + fileDelta;
        int newRank = rank + rankDelta;
        if(!isOnBoard(newFile, newRank)) {
            return null;
        }
        return SQUARE_CACHE[newRank * 8 + newFile];
    }

    public int file() {
        return file;
    }

    public int rank() {
        return rank;
    }

    public int flatIndex() {
        return flatIndex;
    }

    public char fileLetter() {
        return (char) ('a' + file);
    }

    @Override
    public String toString() {
        return MoveIOUtils.writeSquare(this);
    }
}
