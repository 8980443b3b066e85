package max.chess.rules.movegen.utils;

import max.chess.rules.common.Color;
import max.chess.rules.common.Piece;
import max.chess.rules.common.PieceType;
import max.chess.rules.common.Square;
import max.chess.rules.game.board.Board;
import max.chess.rules.movegen.Move;

import java.util.ArrayList;
import java.util.List;

public final class RayUtils {

    static Square[][][] generateRays(int[][] directions) {
        Square[][][] rays = new Square[64][directions.length][];
        for(int i = 0; i < 64; i++) {
            Square origin = Square.of(i);
            for(int d = 0; d < directions.length; d++) {
                rays[i][d] = generateRayAt(origin, directions[d][0], directions[d][1]);
            }
        }
        return rays;
    }

    private static Square[] generateRayAt(Square origin, int fileDelta, int rankDelta) {
        List<Square> ray = new ArrayList<>(7);
        Square current = origin.translate(fileDelta, rankDelta);
        while(current != null) {
            ray.add(current);
            current = current.translate(fileDelta, rankDelta);
        }
        return ray.toArray(new Square[0]);
    }

    /**
     * Walks each ray one square at a time: empty squares are quiet moves, the first occupied
     * square ends the ray and is a capture only when it holds an enemy piece.
     */
    public static void addSlidingMoves(Board board, Square from, PieceType pieceType, Color color,
                                       Square[][] rays, List<Move> moves) {
        for(Square[] ray : rays) {
            for(Square target : ray) {
                Piece targetPiece = board.getPiece(target);
                if(targetPiece == null) {
                    moves.add(Move.quiet(from, target, pieceType));
                    continue;
                }
                if(targetPiece.color() != color) {
                    moves.add(Move.capture(from, target, pieceType, targetPiece.type()));
                }
                break;
            }
        }
    }

    /** True when every square strictly between two aligned squares is empty. */
    public static boolean isPathClear(Board board, Square from, Square to) {
        int fileStep = Integer.signum(to.file() - from.file());
        int rankStep = Integer.signum(to.rank() - from.rank());
        Square current = from.translate(fileStep, rankStep);
        while(current != null && current != to) {
            if(!board.isEmpty(current)) {
                return false;
            }
            current = current.translate(fileStep, rankStep);
        }
        return current == to;
    }

    private RayUtils() {}
}
