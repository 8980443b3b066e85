package max.chess.rules.movegen.utils;

import max.chess.rules.common.Color;
import max.chess.rules.common.Piece;
import max.chess.rules.common.Square;
import max.chess.rules.game.board.Board;

/**
 * Attack queries on a board. A full scan of the 64 squares is cheap enough at this scale.
 */
public final class CheckUtils {

    /** True if the piece standing on {@code attackerSquare} attacks {@code target}. */
    public static boolean attacks(Board board, Square attackerSquare, Square target) {
        Piece attacker = board.getPiece(attackerSquare);
        if(attacker == null || attackerSquare == target) {
            return false;
        }

        int fileOffset = target.file() - attackerSquare.file();
        int rankOffset = target.rank() - attackerSquare.rank();

        return switch (attacker.type()) {
            // pawns only attack diagonally forward, never straight ahead
            case PAWN -> rankOffset == attacker.color().pawnDirection() && Math.abs(fileOffset) == 1;
            case KNIGHT -> (Math.abs(fileOffset) == 2 && Math.abs(rankOffset) == 1)
                    || (Math.abs(fileOffset) == 1 && Math.abs(rankOffset) == 2);
            case KING -> Math.abs(fileOffset) <= 1 && Math.abs(rankOffset) <= 1;
            case ROOK -> OrthogonalMoveUtils.isAligned(attackerSquare, target)
                    && RayUtils.isPathClear(board, attackerSquare, target);
            case BISHOP -> DiagonalMoveUtils.isAligned(attackerSquare, target)
                    && RayUtils.isPathClear(board, attackerSquare, target);
            case QUEEN -> (OrthogonalMoveUtils.isAligned(attackerSquare, target)
                    || DiagonalMoveUtils.isAligned(attackerSquare, target))
                    && RayUtils.isPathClear(board, attackerSquare, target);
        };
    }

    public static boolean isSquareAttackedBy(Board board, Square square, Color attackerColor) {
        for(int i = 0; i < 64; i++) {
            Square attackerSquare = Square.of(i);
            if(board.isOccupiedBy(attackerSquare, attackerColor) && attacks(board, attackerSquare, square)) {
                return true;
            }
        }
        return false;
    }

    public static boolean isInCheck(Board board, Color kingColor) {
        Square kingSquare = board.getKingSquare(kingColor);
        if(kingSquare == null) {
            throw new IllegalStateException("No " + kingColor + " king on the board");
        }
        return isSquareAttackedBy(board, kingSquare, kingColor.getOppositeColor());
    }

    private CheckUtils() {}
}
