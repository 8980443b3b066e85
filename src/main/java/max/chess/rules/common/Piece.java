package max.chess.rules.common;

import java.util.Objects;

public record Piece(PieceType type, Color color) {
    private static final Piece[][] PIECE_CACHE = new Piece[Color.values().length][PieceType.VALUES.length];

    static {
        for(Color color : Color.values()) {
            for(PieceType pieceType : PieceType.VALUES) {
                PIECE_CACHE[color.ordinal()][pieceType.ordinal()] = new Piece(pieceType, color);
            }
        }
    }

    public Piece {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(color, "color");
    }

    public static Piece of(PieceType type, Color color) {
        return PIECE_CACHE[color.ordinal()][type.ordinal()];
    }

    public boolean is(PieceType pieceType, Color pieceColor) {
        return type == pieceType && color == pieceColor;
    }

    /** FEN letter, upper-case for white. */
    public char fenLetter() {
        char letter = switch (type) {
            case PAWN -> 'p';
            case KNIGHT -> 'n';
            case BISHOP -> 'b';
            case ROOK -> 'r';
            case QUEEN -> 'q';
            case KING -> 'k';
        };
        return color == Color.WHITE ? Character.toUpperCase(letter) : letter;
    }

    @Override
    public String toString() {
        return String.valueOf(fenLetter());
    }
}
