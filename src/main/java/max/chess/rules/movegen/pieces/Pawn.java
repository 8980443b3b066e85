package max.chess.rules.movegen.pieces;

import max.chess.rules.common.Color;
import max.chess.rules.common.Piece;
import max.chess.rules.common.PieceType;
import max.chess.rules.common.Square;
import max.chess.rules.game.Position;
import max.chess.rules.game.board.Board;
import max.chess.rules.movegen.Move;

import java.util.List;

public final class Pawn {
    private static final int[] CAPTURE_FILE_OFFSETS = {-1, 1};

    public static void addPseudoLegalMoves(Position position, Square square, Color color, List<Move> moves) {
        Board board = position.board();
        int direction = color.pawnDirection();

        Square oneForward = square.translate(0, direction);
        if(oneForward != null && board.isEmpty(oneForward)) {
            addAdvance(square, oneForward, null, color, moves);

            if(square.rank() == color.pawnStartRank()) {
                Square twoForward = oneForward.translate(0, direction);
                if(twoForward != null && board.isEmpty(twoForward)) {
                    moves.add(Move.quiet(square, twoForward, PieceType.PAWN));
                }
            }
        }

        for(int fileOffset : CAPTURE_FILE_OFFSETS) {
            Square target = square.translate(fileOffset, direction);
            if(target == null) {
                continue;
            }
            Piece targetPiece = board.getPiece(target);
            if(targetPiece != null && targetPiece.color() != color) {
                addAdvance(square, target, targetPiece.type(), color, moves);
            }
            if(target == position.enPassantTarget() && isEnPassantVictim(board, Square.of(target.file(), square.rank()), color)) {
                moves.add(Move.enPassant(square, target));
            }
        }
    }

    // Reaching the last rank yields one move per promotion piece
    private static void addAdvance(Square from, Square to, PieceType capturedType, Color color, List<Move> moves) {
        if(to.rank() == color.promotionRank()) {
            for(PieceType promotion : PieceType.PROMOTIONS) {
                moves.add(Move.promote(from, to, capturedType, promotion));
            }
        } else if(capturedType == null) {
            moves.add(Move.quiet(from, to, PieceType.PAWN));
        } else {
            moves.add(Move.capture(from, to, PieceType.PAWN, capturedType));
        }
    }

    private static boolean isEnPassantVictim(Board board, Square victimSquare, Color color) {
        Piece victim = board.getPiece(victimSquare);
        return victim != null && victim.is(PieceType.PAWN, color.getOppositeColor());
    }

    private Pawn() {}
}
