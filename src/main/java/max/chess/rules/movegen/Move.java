package max.chess.rules.movegen;

import max.chess.rules.common.CastlingSide;
import max.chess.rules.common.Color;
import max.chess.rules.common.PieceType;
import max.chess.rules.common.Square;
import max.chess.rules.utils.notations.MoveIOUtils;

import java.util.Objects;

/**
 * A move as produced by the generator. {@code capturedType}, {@code promotion} and
 * {@code castlingSide} are null when they do not apply.
 */
public record Move(Square from, Square to, PieceType pieceType, PieceType capturedType,
                   PieceType promotion, boolean enPassant, CastlingSide castlingSide) {

    public Move {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(pieceType, "pieceType");
        if(promotion != null && !promotion.isPromotionTarget()) {
            throw new IllegalArgumentException("Cannot promote to " + promotion);
        }
    }

    public static Move quiet(Square from, Square to, PieceType pieceType) {
        return new Move(from, to, pieceType, null, null, false, null);
    }

    public static Move capture(Square from, Square to, PieceType pieceType, PieceType capturedType) {
        return new Move(from, to, pieceType, capturedType, null, false, null);
    }

    public static Move promote(Square from, Square to, PieceType capturedType, PieceType promotion) {
        return new Move(from, to, PieceType.PAWN, capturedType, promotion, false, null);
    }

    public static Move enPassant(Square from, Square to) {
        return new Move(from, to, PieceType.PAWN, PieceType.PAWN, null, true, null);
    }

    public static Move castle(Color color, CastlingSide side) {
        return new Move(side.kingOrigin(color), side.kingTarget(color), PieceType.KING, null, null, false, side);
    }

    public boolean isCapture() {
        return capturedType != null;
    }

    public boolean isPromotion() {
        return promotion != null;
    }

    public boolean isCastling() {
        return castlingSide != null;
    }

    /** Square of the captured piece; differs from {@code to} only for en passant. */
    public Square capturedSquare() {
        if(enPassant) {
            return Square.of(to.file(), from.rank());
        }
        return to;
    }

    public boolean matches(Square start, Square end) {
        return from == start && to == end;
    }

    @Override
    public String toString() {
        return MoveIOUtils.writeShortNotation(this);
    }
}
