package max.chess.rules.movegen.utils;

import max.chess.rules.common.Square;

public final class OrthogonalMoveUtils {
    // north, south, east, west
    public static final int[][] DIRECTIONS = {{0, 1}, {0, -1}, {1, 0}, {-1, 0}};

    // For each square, the squares of each ray ordered from the nearest to the farthest
    public static final Square[][][] RAYS = RayUtils.generateRays(DIRECTIONS);

    public static boolean isAligned(Square from, Square to) {
        return from != to && (from.file() == to.file() || from.rank() == to.rank());
    }

    private OrthogonalMoveUtils() {}
}
