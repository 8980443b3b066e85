package max.chess.rules.game.board;

import max.chess.rules.common.CastlingSide;
import max.chess.rules.common.Color;
import max.chess.rules.common.Piece;
import max.chess.rules.common.PieceType;
import max.chess.rules.common.Square;
import max.chess.rules.movegen.Move;

/**
 * Piece placement plus a per-color cache of the king square. The cache is maintained by
 * every mutation going through this class, so it always matches the placement.
 */
public class Board {
    private final Piece[] pieceAt;
    private final Square[] kingSquares;

    public Board() {
        this.pieceAt = new Piece[64];
        this.kingSquares = new Square[Color.values().length];
    }

    public Board(Board other) {
        this.pieceAt = other.pieceAt.clone();
        this.kingSquares = other.kingSquares.clone();
    }

    public Piece getPiece(Square square) {
        return pieceAt[square.flatIndex()];
    }

    public boolean isEmpty(Square square) {
        return pieceAt[square.flatIndex()] == null;
    }

    public boolean isOccupiedBy(Square square, Color color) {
        Piece piece = pieceAt[square.flatIndex()];
        return piece != null && piece.color() == color;
    }

    /** Cached king square of the given color, null only while a board is being set up. */
    public Square getKingSquare(Color color) {
        return kingSquares[color.ordinal()];
    }

    public void setPiece(Square square, Piece piece) {
        Piece replaced = pieceAt[square.flatIndex()];
        if(replaced != null && replaced.type() == PieceType.KING && kingSquares[replaced.color().ordinal()] == square) {
            kingSquares[replaced.color().ordinal()] = null;
        }
        pieceAt[square.flatIndex()] = piece;
        if(piece != null && piece.type() == PieceType.KING) {
            kingSquares[piece.color().ordinal()] = square;
        }
    }

    public Piece removePiece(Square square) {
        Piece removed = pieceAt[square.flatIndex()];
        setPiece(square, null);
        return removed;
    }

    private void movePiece(Square from, Square to) {
        setPiece(to, removePiece(from));
    }

    /**
     * Plays the placement part of a move: en passant victim removal, castling relocation,
     * promotion and the king cache. Returns the captured piece, or null.
     */
    public Piece applyMove(Move move) {
        Piece movingPiece = getPiece(move.from());
        if(movingPiece == null) {
            throw new IllegalStateException("No piece to move on " + move.from());
        }
        Color color = movingPiece.color();

        if(move.isCastling()) {
            CastlingSide side = move.castlingSide();
            movePiece(side.kingOrigin(color), side.kingTarget(color));
            movePiece(side.rookOrigin(color), side.rookTarget(color));
            return null;
        }

        Piece captured = null;
        if(move.enPassant()) {
            captured = removePiece(move.capturedSquare());
        } else if(!isEmpty(move.to())) {
            captured = getPiece(move.to());
        }

        removePiece(move.from());
        setPiece(move.to(), move.isPromotion() ? Piece.of(move.promotion(), color) : movingPiece);
        return captured;
    }

    /** Reverts {@link #applyMove(Move)} given the piece it returned. */
    public void revertMove(Move move, Piece captured) {
        if(move.isCastling()) {
            Color color = getPiece(move.to()).color();
            CastlingSide side = move.castlingSide();
            movePiece(side.kingTarget(color), side.kingOrigin(color));
            movePiece(side.rookTarget(color), side.rookOrigin(color));
            return;
        }

        Piece movedPiece = removePiece(move.to());
        if(movedPiece == null) {
            throw new IllegalStateException("No piece to take back on " + move.to());
        }
        // any promoted piece reverts to a pawn
        setPiece(move.from(), move.isPromotion() ? Piece.of(PieceType.PAWN, movedPiece.color()) : movedPiece);
        if(captured != null) {
            setPiece(move.capturedSquare(), captured);
        }
    }

    public int countPieces(Color color) {
        int count = 0;
        for(Piece piece : pieceAt) {
            if(piece != null && piece.color() == color) {
                count++;
            }
        }
        return count;
    }

    /** Copy of the placement, indexed by {@link Square#flatIndex()}. */
    public Piece[] toArray() {
        return pieceAt.clone();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(8 * (8 + 4));
        for (int rank = 7; rank >= 0; rank--) {
            sb.append(rank + 1).append("  ");
            for (int file = 0; file < 8; file++) {
                Piece piece = pieceAt[rank * 8 + file];
                sb.append(piece == null ? '.' : piece.fenLetter()).append(' ');
            }
            sb.append('\n');
        }
        sb.append("\n   a b c d e f g h");
        return sb.toString();
    }
}
