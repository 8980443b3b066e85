package max.chess.rules.game;

import max.chess.rules.common.Color;
import max.chess.rules.common.Piece;
import max.chess.rules.common.PieceType;
import max.chess.rules.common.Square;
import max.chess.rules.game.board.Board;
import max.chess.rules.movegen.MoveGenerator;

public final class GameStatusEvaluator {
    public static final int DEFAULT_FIFTY_MOVE_HALF_MOVES = 100;

    public static GameStatus evaluate(Position position) {
        return evaluate(position, DEFAULT_FIFTY_MOVE_HALF_MOVES);
    }

    /**
     * Classifies the position for the side to move. Mate and stalemate take precedence over
     * the draw rules, which take precedence over a plain check.
     */
    public static GameStatus evaluate(Position position, int fiftyMoveHalfMoves) {
        boolean inCheck = position.isInCheck();
        boolean legalMovePossible = MoveGenerator.hasLegalMove(position);

        if(!legalMovePossible) {
            return inCheck ? GameStatus.CHECKMATE : GameStatus.STALEMATE;
        }
        if(getDrawReason(position, fiftyMoveHalfMoves) != null) {
            return GameStatus.DRAW;
        }
        return inCheck ? GameStatus.CHECK : GameStatus.ACTIVE;
    }

    /** Draw rule met by the position, or null. Does not look at stalemate. */
    public static DrawReason getDrawReason(Position position, int fiftyMoveHalfMoves) {
        if(position.halfMoveClock() >= fiftyMoveHalfMoves) {
            return DrawReason.FIFTY_MOVE_RULE;
        }
        if(isInsufficientMaterial(position.board())) {
            return DrawReason.INSUFFICIENT_MATERIAL;
        }
        return null;
    }

    /**
     * King against king, or king against king and a single bishop or knight.
     * Opposite colored bishops or two knights are not detected.
     */
    public static boolean isInsufficientMaterial(Board board) {
        int whiteCount = board.countPieces(Color.WHITE);
        int blackCount = board.countPieces(Color.BLACK);

        if(whiteCount == 1 && blackCount == 1) {
            return true;
        }
        if(whiteCount == 1 && blackCount == 2) {
            return hasSingleMinorPiece(board, Color.BLACK);
        }
        if(blackCount == 1 && whiteCount == 2) {
            return hasSingleMinorPiece(board, Color.WHITE);
        }
        return false;
    }

    private static boolean hasSingleMinorPiece(Board board, Color color) {
        for(int i = 0; i < 64; i++) {
            Piece piece = board.getPiece(Square.of(i));
            if(piece != null && piece.color() == color && piece.type() != PieceType.KING) {
                return piece.type().isMinor();
            }
        }
        return false;
    }

    private GameStatusEvaluator() {}
}
