package max.chess.rules.movegen.pieces;

import max.chess.rules.common.Color;
import max.chess.rules.common.PieceType;
import max.chess.rules.common.Square;
import max.chess.rules.game.board.Board;
import max.chess.rules.movegen.Move;

import java.util.List;

public final class Queen {
    public static void addPseudoLegalMoves(Board board, Square square, Color color, List<Move> moves) {
        Rook.addPseudoLegalMoves(board, square, color, PieceType.QUEEN, moves);
        Bishop.addPseudoLegalMoves(board, square, color, PieceType.QUEEN, moves);
    }

    private Queen() {}
}
