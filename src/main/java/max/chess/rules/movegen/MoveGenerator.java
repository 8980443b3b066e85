package max.chess.rules.movegen;

import max.chess.rules.common.Color;
import max.chess.rules.common.Piece;
import max.chess.rules.common.PieceType;
import max.chess.rules.common.Square;
import max.chess.rules.game.Position;
import max.chess.rules.game.board.Board;
import max.chess.rules.movegen.pieces.Bishop;
import max.chess.rules.movegen.pieces.King;
import max.chess.rules.movegen.pieces.Knight;
import max.chess.rules.movegen.pieces.Pawn;
import max.chess.rules.movegen.pieces.Queen;
import max.chess.rules.movegen.pieces.Rook;
import max.chess.rules.movegen.utils.CheckUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Legal move generation. Moves are first generated from the piece movement patterns,
 * then each one is tried on a scratch copy of the board and dropped if it leaves the
 * mover's king attacked. The live position is never touched.
 */
public final class MoveGenerator {
    private static final int MAX_PIECE_MOVES = 28;
    private static final int MAX_POSITION_MOVES = 218;

    /** Moves of the piece on {@code square}, ignoring whether they expose the own king. */
    public static List<Move> generatePseudoLegalMoves(Position position, Square square) {
        List<Move> moves = new ArrayList<>(MAX_PIECE_MOVES);
        Piece piece = position.board().getPiece(square);
        if(piece == null || piece.color() != position.sideToMove()) {
            return moves;
        }

        Board board = position.board();
        Color color = piece.color();
        switch (piece.type()) {
            case PAWN -> Pawn.addPseudoLegalMoves(position, square, color, moves);
            case KNIGHT -> Knight.addPseudoLegalMoves(board, square, color, moves);
            case BISHOP -> Bishop.addPseudoLegalMoves(board, square, color, moves);
            case ROOK -> Rook.addPseudoLegalMoves(board, square, color, moves);
            case QUEEN -> Queen.addPseudoLegalMoves(board, square, color, moves);
            case KING -> King.addPseudoLegalMoves(position, square, color, moves);
        }
        return moves;
    }

    /** Legal moves of the piece on {@code square}; empty when it is not the side to move's piece. */
    public static List<Move> generateLegalMoves(Position position, Square square) {
        List<Move> moves = generatePseudoLegalMoves(position, square);
        moves.removeIf(move -> !isLegal(position, move));
        return moves;
    }

    /** All legal moves of the side to move, squares scanned from a1 to h8. */
    public static List<Move> generateLegalMoves(Position position) {
        List<Move> moves = new ArrayList<>(MAX_POSITION_MOVES);
        for(int i = 0; i < 64; i++) {
            moves.addAll(generateLegalMoves(position, Square.of(i)));
        }
        return moves;
    }

    public static int countLegalMoves(Position position) {
        return generateLegalMoves(position).size();
    }

    /** Stops at the first legal move found. */
    public static boolean hasLegalMove(Position position) {
        Color color = position.sideToMove();
        Board board = position.board();
        for(int i = 0; i < 64; i++) {
            Square square = Square.of(i);
            if(!board.isOccupiedBy(square, color)) {
                continue;
            }
            for(Move move : generatePseudoLegalMoves(position, square)) {
                if(isLegal(position, move)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Trial move: plays {@code move} on a scratch copy of the board and checks the mover's
     * king. Capturing a king is never legal.
     */
    public static boolean isLegal(Position position, Move move) {
        if(move.capturedType() == PieceType.KING) {
            return false;
        }
        Color mover = position.sideToMove();
        Board scratch = new Board(position.board());
        scratch.applyMove(move);
        return !CheckUtils.isInCheck(scratch, mover);
    }

    private MoveGenerator() {}
}
