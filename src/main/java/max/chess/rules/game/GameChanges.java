package max.chess.rules.game;

import max.chess.rules.common.Piece;
import max.chess.rules.common.Square;
import max.chess.rules.movegen.Move;

/**
 * One history entry: the move played, its notation and the state it overwrote.
 * {@code capturedPiece} includes an en passant victim; it and {@code previousEnPassantTarget}
 * may be null.
 */
public record GameChanges(Move move, String notation, Piece capturedPiece,
                          CastlingRights previousCastlingRights, Square previousEnPassantTarget,
                          int previousHalfMoveClock) {
}
