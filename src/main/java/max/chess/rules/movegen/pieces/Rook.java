package max.chess.rules.movegen.pieces;

import max.chess.rules.common.Color;
import max.chess.rules.common.PieceType;
import max.chess.rules.common.Square;
import max.chess.rules.game.board.Board;
import max.chess.rules.movegen.Move;
import max.chess.rules.movegen.utils.OrthogonalMoveUtils;
import max.chess.rules.movegen.utils.RayUtils;

import java.util.List;

public final class Rook {
    public static void addPseudoLegalMoves(Board board, Square square, Color color, List<Move> moves) {
        addPseudoLegalMoves(board, square, color, PieceType.ROOK, moves);
    }

    // Shared with the queen, which moves as a rook and a bishop
    static void addPseudoLegalMoves(Board board, Square square, Color color, PieceType pieceType, List<Move> moves) {
        RayUtils.addSlidingMoves(board, square, pieceType, color, OrthogonalMoveUtils.RAYS[square.flatIndex()], moves);
    }

    private Rook() {}
}
