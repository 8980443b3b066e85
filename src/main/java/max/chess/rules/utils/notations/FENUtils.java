package max.chess.rules.utils.notations;

import max.chess.rules.common.Color;
import max.chess.rules.common.Piece;
import max.chess.rules.common.PieceType;
import max.chess.rules.common.Square;
import max.chess.rules.game.CastlingRights;
import max.chess.rules.game.Position;
import max.chess.rules.game.board.Board;

// https://en.wikipedia.org/wiki/Forsyth%E2%80%93Edwards_Notation
public class FENUtils {

    public static Position getPositionFrom(String fen) {
        if(fen == null) {
            throw new IllegalArgumentException("FEN record cannot be null");
        }
        String[] fenFields = fen.trim().split("\\s+");
        if(fenFields.length != 6) {
            throw new IllegalArgumentException("Invalid FEN record, expected 6 fields: " + fen);
        }

        Board board = readPiecePlacement(fenFields[0]);
        for(Color color : Color.values()) {
            if(board.getKingSquare(color) == null) {
                throw new IllegalArgumentException("FEN record has no " + color + " king: " + fen);
            }
        }

        return new Position(board,
                readCurrentTurn(fenFields[1]),
                readCastlingRights(fenFields[2]),
                "-".equals(fenFields[3]) ? null : MoveIOUtils.getSquareFromText(fenFields[3]),
                readNumber(fenFields[4], "half move clock"),
                readNumber(fenFields[5], "full move number"));
    }

    public static String getFENFromPosition(Position position) {
        StringBuilder fen = new StringBuilder(90);
        writePiecePlacement(position.board(), fen);
        fen.append(' ').append(position.sideToMove() == Color.BLACK ? 'b' : 'w');
        writeCastlingRights(position.castlingRights(), fen);
        fen.append(' ');
        if(position.enPassantTarget() != null) {
            fen.append(MoveIOUtils.writeSquare(position.enPassantTarget()));
        } else {
            fen.append('-');
        }
        fen.append(' ').append(position.halfMoveClock());
        fen.append(' ').append(position.fullMoveNumber());
        return fen.toString();
    }

    private static void writePiecePlacement(Board board, StringBuilder fen) {
        for(int rank = 7; rank >= 0; rank--) {
            int emptySpaceCounter = 0;
            if(rank != 7) {
                fen.append('/');
            }
            for(int file = 0; file < 8; file++) {
                Piece piece = board.getPiece(Square.of(file, rank));
                if(piece == null) {
                    emptySpaceCounter++;
                    continue;
                }
                if(emptySpaceCounter != 0) {
                    fen.append(emptySpaceCounter);
                    emptySpaceCounter = 0;
                }
                fen.append(piece.fenLetter());
            }
            if(emptySpaceCounter != 0) {
                fen.append(emptySpaceCounter);
            }
        }
    }

    private static void writeCastlingRights(CastlingRights castlingRights, StringBuilder fen) {
        fen.append(' ');
        StringBuilder rights = new StringBuilder(4);
        if(castlingRights.whiteKingSide()) {
            rights.append('K');
        }
        if(castlingRights.whiteQueenSide()) {
            rights.append('Q');
        }
        if(castlingRights.blackKingSide()) {
            rights.append('k');
        }
        if(castlingRights.blackQueenSide()) {
            rights.append('q');
        }
        fen.append(rights.length() == 0 ? "-" : rights);
    }

    private static Board readPiecePlacement(String piecePlacement) {
        String[] rows = piecePlacement.split("/");
        if(rows.length != 8) {
            throw new IllegalArgumentException("Invalid FEN piece placement: " + piecePlacement);
        }
        Board board = new Board();
        for(int row = 0; row < 8; row++) {
            int rank = 7 - row;
            int file = 0;
            for(char character : rows[row].toCharArray()) {
                if(character >= '1' && character <= '8') {
                    file += character - '0';
                    continue;
                }
                if(file > 7) {
                    throw new IllegalArgumentException("Too many squares on FEN rank " + (rank + 1) + ": " + rows[row]);
                }
                Color color = Character.isUpperCase(character) ? Color.WHITE : Color.BLACK;
                PieceType pieceType = MoveIOUtils.getPieceTypeFromLetter(character);
                Square square = Square.of(file, rank);
                if(pieceType == PieceType.KING && board.getKingSquare(color) != null) {
                    throw new IllegalArgumentException("FEN record has more than one " + color + " king");
                }
                board.setPiece(square, Piece.of(pieceType, color));
                file++;
            }
            if(file != 8) {
                throw new IllegalArgumentException("FEN rank " + (rank + 1) + " does not cover 8 squares: " + rows[row]);
            }
        }
        return board;
    }

    private static Color readCurrentTurn(String currentTurn) {
        return switch (currentTurn) {
            case "w" -> Color.WHITE;
            case "b" -> Color.BLACK;
            default -> throw new IllegalArgumentException("Unexpected FEN side to move " + currentTurn);
        };
    }

    private static CastlingRights readCastlingRights(String castlingRights) {
        if("-".equals(castlingRights)) {
            return CastlingRights.NONE;
        }
        boolean whiteCanCastleKingSide = false;
        boolean whiteCanCastleQueenSide = false;
        boolean blackCanCastleKingSide = false;
        boolean blackCanCastleQueenSide = false;
        for(char character : castlingRights.toCharArray()) {
            switch (character) {
                case 'K' -> whiteCanCastleKingSide = true;
                case 'k' -> blackCanCastleKingSide = true;
                case 'Q' -> whiteCanCastleQueenSide = true;
                case 'q' -> blackCanCastleQueenSide = true;
                default -> throw new IllegalArgumentException("Unexpected FEN castling letter " + character);
            }
        }
        return new CastlingRights(whiteCanCastleKingSide, whiteCanCastleQueenSide,
                blackCanCastleKingSide, blackCanCastleQueenSide);
    }

    private static int readNumber(String field, String name) {
        try {
            return Integer.parseInt(field);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid FEN " + name + ": " + field, e);
        }
    }
}
