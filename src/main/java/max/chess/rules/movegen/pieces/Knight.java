package max.chess.rules.movegen.pieces;

import max.chess.rules.common.Color;
import max.chess.rules.common.Piece;
import max.chess.rules.common.PieceType;
import max.chess.rules.common.Square;
import max.chess.rules.game.board.Board;
import max.chess.rules.movegen.Move;

import java.util.ArrayList;
import java.util.List;

public final class Knight {
    private static final int[][] OFFSETS = {
            {-1, 2}, {1, 2}, {-1, -2}, {1, -2},
            {-2, 1}, {-2, -1}, {2, 1}, {2, -1}
    };

    // Target squares per origin square, computed once
    public static final Square[][] KNIGHT_TARGETS = new Square[64][];

    static {
        generateKnightTargets();
    }

    public static void addPseudoLegalMoves(Board board, Square square, Color color, List<Move> moves) {
        for(Square target : KNIGHT_TARGETS[square.flatIndex()]) {
            Piece targetPiece = board.getPiece(target);
            if(targetPiece == null) {
                moves.add(Move.quiet(square, target, PieceType.KNIGHT));
            } else if(targetPiece.color() != color) {
                moves.add(Move.capture(square, target, PieceType.KNIGHT, targetPiece.type()));
            }
        }
    }

    private static void generateKnightTargets() {
        for(int i = 0; i < 64; i++) {
            KNIGHT_TARGETS[i] = generateTargetsAt(Square.of(i), OFFSETS);
        }
    }

    static Square[] generateTargetsAt(Square origin, int[][] offsets) {
        List<Square> targets = new ArrayList<>(offsets.length);
        for(int[] offset : offsets) {
            Square target = origin.translate(offset[0], offset[1]);
            if(target != null) {
                targets.add(target);
            }
        }
        return targets.toArray(new Square[0]);
    }

    private Knight() {}
}
