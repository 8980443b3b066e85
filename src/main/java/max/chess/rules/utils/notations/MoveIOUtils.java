package max.chess.rules.utils.notations;

import max.chess.rules.common.PieceType;
import max.chess.rules.common.Square;
import max.chess.rules.movegen.Move;

public class MoveIOUtils {

    /**
     * Short notation without disambiguation: "O-O", "Nf3", "exd5", "e8=Q", "exd6 e.p.".
     * Two pieces of the same kind able to reach the same square produce the same text.
     */
    public static String writeShortNotation(Move move) {
        if(move.isCastling()) {
            return move.castlingSide().notation();
        }

        StringBuilder notation = new StringBuilder(12);
        notation.append(move.pieceType().algebraicLetter());
        if(move.isCapture()) {
            if(move.pieceType() == PieceType.PAWN) {
                notation.append(move.from().fileLetter());
            }
            notation.append('x');
        }
        notation.append(writeSquare(move.to()));
        if(move.isPromotion()) {
            notation.append('=').append(move.promotion().algebraicLetter());
        }
        if(move.enPassant()) {
            notation.append(" e.p.");
        }
        return notation.toString();
    }

    /** Coordinate form such as "e7e8q", handy for logs and test fixtures. */
    public static String writeCoordinateNotation(Move move) {
        String promotedPiece = move.isPromotion() ? move.promotion().algebraicLetter().toLowerCase() : "";
        return writeSquare(move.from()) + writeSquare(move.to()) + promotedPiece;
    }

    public static PieceType getPieceTypeFromLetter(char letter) {
        return switch (letter) {
            case 'k', 'K' -> PieceType.KING;
            case 'n', 'N' -> PieceType.KNIGHT;
            case 'q', 'Q' -> PieceType.QUEEN;
            case 'r', 'R' -> PieceType.ROOK;
            case 'b', 'B' -> PieceType.BISHOP;
            case 'p', 'P' -> PieceType.PAWN;
            default -> throw new IllegalArgumentException("Unknown piece letter " + letter);
        };
    }

    public static String writeSquare(Square square) {
        return String.valueOf(square.fileLetter()) + (square.rank() + 1);
    }

    public static Square getSquareFromText(String text) {
        if(text == null || text.length() != 2) {
            throw new IllegalArgumentException("square should be format 'a1', got " + text);
        }
        char fileLetter = text.charAt(0);
        char rankDigit = text.charAt(1);
        if(fileLetter < 'a' || fileLetter > 'h') {
            throw new IllegalArgumentException("square letter should be in [a-h], got " + text);
        }
        if(rankDigit < '1' || rankDigit > '8') {
            throw new IllegalArgumentException("square digit should be in [1-8], got " + text);
        }
        return Square.of(fileLetter - 'a', rankDigit - '1');
    }
}
