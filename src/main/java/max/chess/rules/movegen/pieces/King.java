package max.chess.rules.movegen.pieces;

import max.chess.rules.common.CastlingSide;
import max.chess.rules.common.Color;
import max.chess.rules.common.Piece;
import max.chess.rules.common.PieceType;
import max.chess.rules.common.Square;
import max.chess.rules.game.Position;
import max.chess.rules.game.board.Board;
import max.chess.rules.movegen.Move;
import max.chess.rules.movegen.utils.CheckUtils;

import java.util.List;

public final class King {
    private static final int[][] OFFSETS = {
            {0, 1}, {0, -1}, {1, 0}, {-1, 0},
            {1, 1}, {1, -1}, {-1, 1}, {-1, -1}
    };

    public static final Square[][] KING_TARGETS = new Square[64][];

    static {
        for(int i = 0; i < 64; i++) {
            KING_TARGETS[i] = Knight.generateTargetsAt(Square.of(i), OFFSETS);
        }
    }

    public static void addPseudoLegalMoves(Position position, Square square, Color color, List<Move> moves) {
        Board board = position.board();
        for(Square target : KING_TARGETS[square.flatIndex()]) {
            Piece targetPiece = board.getPiece(target);
            if(targetPiece == null) {
                moves.add(Move.quiet(square, target, PieceType.KING));
            } else if(targetPiece.color() != color) {
                moves.add(Move.capture(square, target, PieceType.KING, targetPiece.type()));
            }
        }

        for(CastlingSide side : CastlingSide.values()) {
            if(square == side.kingOrigin(color) && isCastleLegal(position, color, side)) {
                moves.add(Move.castle(color, side));
            }
        }
    }

    public static boolean isCastleLegal(Position position, Color color, CastlingSide side) {
        if(!position.castlingRights().canCastle(color, side)) {
            return false;
        }

        Board board = position.board();
        Piece king = board.getPiece(side.kingOrigin(color));
        if(king == null || !king.is(PieceType.KING, color)) {
            return false;
        }
        Piece rook = board.getPiece(side.rookOrigin(color));
        if(rook == null || !rook.is(PieceType.ROOK, color)) {
            return false;
        }

        // every square between king and rook must be empty
        int rank = color.backRank();
        int kingFile = CastlingSide.KING_ORIGIN_FILE;
        int rookFile = side.rookOrigin(color).file();
        for(int file = Math.min(kingFile, rookFile) + 1; file < Math.max(kingFile, rookFile); file++) {
            if(!board.isEmpty(Square.of(file, rank))) {
                return false;
            }
        }

        // the king may not castle out of, through or into check
        Color opponent = color.getOppositeColor();
        if(CheckUtils.isInCheck(board, color)) {
            return false;
        }
        int step = Integer.signum(side.kingTarget(color).file() - kingFile);
        for(int file = kingFile + step; file != side.kingTarget(color).file() + step; file += step) {
            if(CheckUtils.isSquareAttackedBy(board, Square.of(file, rank), opponent)) {
                return false;
            }
        }
        return true;
    }

    private King() {}
}
