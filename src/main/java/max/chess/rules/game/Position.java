package max.chess.rules.game;

import max.chess.rules.common.Color;
import max.chess.rules.common.Piece;
import max.chess.rules.common.PieceType;
import max.chess.rules.common.Square;
import max.chess.rules.game.board.Board;
import max.chess.rules.movegen.Move;
import max.chess.rules.movegen.utils.CheckUtils;
import max.chess.rules.utils.notations.FENUtils;
import max.chess.rules.utils.notations.MoveIOUtils;

/**
 * Full state of a chess position: placement, side to move, castling rights, en passant
 * target and move counters. Mutated only through {@link #playMove(Move)} and
 * {@link #undoMove(GameChanges)}.
 */
public class Position {
    private final Board board;
    private Color sideToMove;
    private CastlingRights castlingRights;
    private Square enPassantTarget;
    private int halfMoveClock;
    private int fullMoveNumber;

    public Position(Board board, Color sideToMove, CastlingRights castlingRights, Square enPassantTarget,
                    int halfMoveClock, int fullMoveNumber) {
        if(halfMoveClock < 0) {
            throw new IllegalArgumentException("Half move clock cannot be negative: " + halfMoveClock);
        }
        if(fullMoveNumber < 1) {
            throw new IllegalArgumentException("Full move number starts at 1: " + fullMoveNumber);
        }
        this.board = board;
        this.sideToMove = sideToMove;
        this.castlingRights = castlingRights;
        this.enPassantTarget = enPassantTarget;
        this.halfMoveClock = halfMoveClock;
        this.fullMoveNumber = fullMoveNumber;
    }

    public Position copy() {
        return new Position(new Board(board), sideToMove, castlingRights, enPassantTarget, halfMoveClock, fullMoveNumber);
    }

    /**
     * Executes an already legal move and returns what is needed to take it back.
     */
    public GameChanges playMove(Move move) {
        String notation = MoveIOUtils.writeShortNotation(move);
        CastlingRights previousCastlingRights = castlingRights;
        Square previousEnPassantTarget = enPassantTarget;
        int previousHalfMoveClock = halfMoveClock;

        Piece captured = board.applyMove(move);

        if(move.pieceType() == PieceType.KING) {
            castlingRights = castlingRights.withoutColor(sideToMove);
        }
        // covers rook moves as well as rook captures
        castlingRights = castlingRights.withoutRookSquare(move.from()).withoutRookSquare(move.to());

        if(move.pieceType() == PieceType.PAWN && Math.abs(move.to().rank() - move.from().rank()) == 2) {
            enPassantTarget = Square.of(move.from().file(), (move.from().rank() + move.to().rank()) / 2);
        } else {
            enPassantTarget = null;
        }

        if(move.pieceType() == PieceType.PAWN || captured != null) {
            halfMoveClock = 0;
        } else {
            halfMoveClock++;
        }

        if(sideToMove == Color.BLACK) {
            fullMoveNumber++;
        }
        sideToMove = sideToMove.getOppositeColor();

        return new GameChanges(move, notation, captured, previousCastlingRights, previousEnPassantTarget,
                previousHalfMoveClock);
    }

    public void undoMove(GameChanges gameChanges) {
        board.revertMove(gameChanges.move(), gameChanges.capturedPiece());

        castlingRights = gameChanges.previousCastlingRights();
        enPassantTarget = gameChanges.previousEnPassantTarget();
        halfMoveClock = gameChanges.previousHalfMoveClock();

        sideToMove = sideToMove.getOppositeColor();
        if(sideToMove == Color.BLACK) {
            fullMoveNumber--;
        }
    }

    public boolean isInCheck() {
        return CheckUtils.isInCheck(board, sideToMove);
    }

    public Board board() {
        return board;
    }

    public Color sideToMove() {
        return sideToMove;
    }

    public CastlingRights castlingRights() {
        return castlingRights;
    }

    /** Square skipped by a two-square pawn advance on the previous move, or null. */
    public Square enPassantTarget() {
        return enPassantTarget;
    }

    public int halfMoveClock() {
        return halfMoveClock;
    }

    public int fullMoveNumber() {
        return fullMoveNumber;
    }

    public String toFen() {
        return FENUtils.getFENFromPosition(this);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        return toFen().equals(((Position) o).toFen());
    }

    @Override
    public int hashCode() {
        return toFen().hashCode();
    }

    @Override
    public String toString() {
        return board + "\nFEN: " + toFen();
    }
}
