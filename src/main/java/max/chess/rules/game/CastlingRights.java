package max.chess.rules.game;

import max.chess.rules.common.CastlingSide;
import max.chess.rules.common.Color;
import max.chess.rules.common.Square;

public record CastlingRights(boolean whiteKingSide, boolean whiteQueenSide,
                             boolean blackKingSide, boolean blackQueenSide) {
    public static final CastlingRights ALL = new CastlingRights(true, true, true, true);
    public static final CastlingRights NONE = new CastlingRights(false, false, false, false);

    public boolean canCastle(Color color, CastlingSide side) {
        if(color == Color.WHITE) {
            return side == CastlingSide.KINGSIDE ? whiteKingSide : whiteQueenSide;
        }
        return side == CastlingSide.KINGSIDE ? blackKingSide : blackQueenSide;
    }

    public CastlingRights withoutColor(Color color) {
        if(color == Color.WHITE) {
            return new CastlingRights(false, false, blackKingSide, blackQueenSide);
        }
        return new CastlingRights(whiteKingSide, whiteQueenSide, false, false);
    }

    /** Clears the right tied to a rook starting square, if any. */
    public CastlingRights withoutRookSquare(Square square) {
        if(square == Square.H1) {
            return new CastlingRights(false, whiteQueenSide, blackKingSide, blackQueenSide);
        } else if(square == Square.A1) {
            return new CastlingRights(whiteKingSide, false, blackKingSide, blackQueenSide);
        } else if(square == Square.H8) {
            return new CastlingRights(whiteKingSide, whiteQueenSide, false, blackQueenSide);
        } else if(square == Square.A8) {
            return new CastlingRights(whiteKingSide, whiteQueenSide, blackKingSide, false);
        }
        return this;
    }
}
