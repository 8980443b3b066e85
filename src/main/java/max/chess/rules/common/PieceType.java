package max.chess.rules.common;

public enum PieceType {
    PAWN(""), KNIGHT("N"), BISHOP("B"), ROOK("R"), QUEEN("Q"), KING("K");

    public static final PieceType[] VALUES = PieceType.values();
    // Generation order of promotion variants, the first one is the default tie-break
    public static final PieceType[] PROMOTIONS = {QUEEN, ROOK, BISHOP, KNIGHT};

    private final String algebraicLetter;

    PieceType(String algebraicLetter) {
        this.algebraicLetter = algebraicLetter;
    }

    /** Upper-case letter used in move notation, empty for pawns. */
    public String algebraicLetter() {
        return algebraicLetter;
    }

    public boolean isMinor() {
        return this == BISHOP || this == KNIGHT;
    }

    public boolean isPromotionTarget() {
        return this == QUEEN || this == ROOK || this == BISHOP || this == KNIGHT;
    }
}
