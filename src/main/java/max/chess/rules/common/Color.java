package max.chess.rules.common;

public enum Color {
    WHITE, BLACK;

    public Color getOppositeColor() {
        if(this == WHITE) {
            return BLACK;
        } else {
            return WHITE;
        }
    }

    /** Direction a pawn of this color advances in, as a rank delta. */
    public int pawnDirection() {
        return this == WHITE ? 1 : -1;
    }

    /** Rank (0-based) the king and rooks of this color start on. */
    public int backRank() {
        return this == WHITE ? 0 : 7;
    }

    public int pawnStartRank() {
        return this == WHITE ? 1 : 6;
    }

    public int promotionRank() {
        return this == WHITE ? 7 : 0;
    }
}
