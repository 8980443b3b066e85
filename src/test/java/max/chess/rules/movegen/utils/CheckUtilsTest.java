package max.chess.rules.movegen.utils;

import max.chess.rules.common.Color;
import max.chess.rules.common.Square;
import max.chess.rules.game.Position;
import max.chess.rules.game.board.Board;
import max.chess.rules.game.board.utils.BoardGenerator;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CheckUtilsTest {

    @Test
    public void pawnShouldOnlyAttackDiagonally() {
        // Given
        Board board = BoardGenerator.from("4k3/8/8/8/4P3/8/8/4K3 w - - 0 1").board();
        Square pawn = Square.of("e4");

        // Then
        assertTrue(CheckUtils.attacks(board, pawn, Square.of("d5")));
        assertTrue(CheckUtils.attacks(board, pawn, Square.of("f5")));
        assertFalse(CheckUtils.attacks(board, pawn, Square.of("e5")));
        assertFalse(CheckUtils.attacks(board, pawn, Square.of("d3")));
    }

    @Test
    public void blackPawnShouldAttackTowardsFirstRank() {
        // Given
        Board board = BoardGenerator.from("4k3/8/8/4p3/8/8/8/4K3 w - - 0 1").board();

        // Then
        assertTrue(CheckUtils.attacks(board, Square.of("e5"), Square.of("d4")));
        assertFalse(CheckUtils.attacks(board, Square.of("e5"), Square.of("d6")));
    }

    @Test
    public void slidersShouldBeBlockedByTheFirstPiece() {
        // Given
        // rook a1 is blocked by the knight on a4, bishop c1 sees up to g5
        Board board = BoardGenerator.from("4k3/8/8/6p1/N7/8/8/R1B1K3 w - - 0 1").board();

        // Then
        assertTrue(CheckUtils.attacks(board, Square.of("a1"), Square.of("a4")));
        assertFalse(CheckUtils.attacks(board, Square.of("a1"), Square.of("a5")));
        assertTrue(CheckUtils.attacks(board, Square.of("c1"), Square.of("g5")));
        assertFalse(CheckUtils.attacks(board, Square.of("c1"), Square.of("h6")));
        assertFalse(CheckUtils.attacks(board, Square.of("c1"), Square.of("c2")));
    }

    @Test
    public void knightShouldJumpOverPieces() {
        // Given
        Position position = BoardGenerator.newStandardPosition();

        // Then
        assertTrue(CheckUtils.attacks(position.board(), Square.of("g1"), Square.of("f3")));
        assertTrue(CheckUtils.attacks(position.board(), Square.of("g1"), Square.of("e2")));
        assertFalse(CheckUtils.attacks(position.board(), Square.of("g1"), Square.of("g3")));
    }

    @Test
    public void squareAttackedByShouldScanAllPiecesOfTheSide() {
        // Given
        Board board = BoardGenerator.newStandardPosition().board();

        // Then
        assertTrue(CheckUtils.isSquareAttackedBy(board, Square.of("f3"), Color.WHITE));
        assertFalse(CheckUtils.isSquareAttackedBy(board, Square.of("e4"), Color.WHITE));
        assertTrue(CheckUtils.isSquareAttackedBy(board, Square.of("f6"), Color.BLACK));
        assertFalse(CheckUtils.isSquareAttackedBy(board, Square.of("f3"), Color.BLACK));
    }

    @Test
    public void kingShouldBeInCheckFromQueenOnOpenDiagonal() {
        // Given
        // 1.f3 e5 2.g4 Qh4
        Board board = BoardGenerator.from("rnb1kbnr/pppp1ppp/8/4p3/6Pq/5P2/PPPPP2P/RNBQKBNR w KQkq - 1 3").board();

        // Then
        assertTrue(CheckUtils.isInCheck(board, Color.WHITE));
        assertFalse(CheckUtils.isInCheck(board, Color.BLACK));
    }
}
