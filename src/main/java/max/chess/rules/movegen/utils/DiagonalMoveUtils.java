package max.chess.rules.movegen.utils;

import max.chess.rules.common.Square;

public final class DiagonalMoveUtils {
    // north-east, south-east, north-west, south-west
    public static final int[][] DIRECTIONS = {{1, 1}, {1, -1}, {-1, 1}, {-1, -1}};

    // For each square, the squares of each ray ordered from the nearest to the farthest
    public static final Square[][][] RAYS = RayUtils.generateRays(DIRECTIONS);

    public static boolean isAligned(Square from, Square to) {
        return from != to && Math.abs(to.file() - from.file()) == Math.abs(to.rank() - from.rank());
    }

    private DiagonalMoveUtils() {}
}
