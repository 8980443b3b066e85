package max.chess.rules.game;

import max.chess.rules.game.board.utils.BoardGenerator;
import max.chess.rules.movegen.MoveGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class GameStatusEvaluatorTest {

    @Test
    public void standardBoardShouldBeActive() {
        assertEquals(GameStatus.ACTIVE, GameStatusEvaluator.evaluate(BoardGenerator.newStandardPosition()));
    }

    @Test
    public void foolsMateShouldBeCheckmate() {
        // Given
        Position position = BoardGenerator.from("rnb1kbnr/pppp1ppp/8/4p3/6Pq/5P2/PPPPP2P/RNBQKBNR w KQkq - 1 3");

        // Then
        assertEquals(0, MoveGenerator.countLegalMoves(position));
        assertEquals(GameStatus.CHECKMATE, GameStatusEvaluator.evaluate(position));
    }

    @Test
    public void kingWithoutMovesAndNotInCheckShouldBeStalemate() {
        // Given
        Position position = BoardGenerator.from("7k/5Q2/6K1/8/8/8/8/8 b - - 0 1");

        // Then
        assertEquals(GameStatus.STALEMATE, GameStatusEvaluator.evaluate(position));
    }

    @Test
    public void checkWithEscapeShouldBeCheck() {
        // Given
        Position position = BoardGenerator.from("4k3/8/8/8/8/8/8/r3K2R w K - 0 1");

        // Then
        assertEquals(GameStatus.CHECK, GameStatusEvaluator.evaluate(position));
    }

    @Test
    public void hundredHalfMovesShouldBeDraw() {
        // Given
        Position justBelow = BoardGenerator.from("4k3/8/8/8/8/8/4P3/R3K3 w - - 99 80");
        Position reached = BoardGenerator.from("4k3/8/8/8/8/8/4P3/R3K3 w - - 100 80");

        // Then
        assertEquals(GameStatus.ACTIVE, GameStatusEvaluator.evaluate(justBelow));
        assertEquals(GameStatus.DRAW, GameStatusEvaluator.evaluate(reached));
        assertEquals(DrawReason.FIFTY_MOVE_RULE, GameStatusEvaluator.getDrawReason(reached, 100));
    }

    @Test
    public void checkmateShouldWinOverTheFiftyMoveRule() {
        // Given
        // back rank mate delivered on the hundredth half move
        Position position = BoardGenerator.from("R5k1/5ppp/8/8/8/8/8/6K1 b - - 100 90");

        // Then
        assertEquals(GameStatus.CHECKMATE, GameStatusEvaluator.evaluate(position));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "4k3/8/8/8/8/8/8/4K3 w - - 0 1",
            "4k3/8/8/8/8/8/8/2B1K3 w - - 0 1",
            "4k3/8/8/8/8/8/8/1N2K3 b - - 0 1",
            "4k3/2n5/8/8/8/8/8/4K3 w - - 0 1",
            "4kb2/8/8/8/8/8/8/4K3 w - - 0 1"
    })
    public void loneKingAgainstAtMostOneMinorPieceShouldBeDraw(String fen) {
        // Given
        Position position = BoardGenerator.from(fen);

        // Then
        assertTrue(GameStatusEvaluator.isInsufficientMaterial(position.board()));
        assertEquals(GameStatus.DRAW, GameStatusEvaluator.evaluate(position));
        assertEquals(DrawReason.INSUFFICIENT_MATERIAL, GameStatusEvaluator.getDrawReason(position, 100));
    }

    @Test
    public void insufficientMaterialShouldBeDrawEvenInCheck() {
        // Given
        // the bishop on b5 checks the black king
        Position position = BoardGenerator.from("4k3/8/8/1B6/8/8/8/4K3 b - - 0 1");

        // Then
        assertTrue(position.isInCheck());
        assertEquals(GameStatus.DRAW, GameStatusEvaluator.evaluate(position));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            // opposite colored bishops and two knights are not detected
            "4kb2/8/8/8/8/8/8/2B1K3 w - - 0 1",
            "4k3/8/8/8/8/8/8/1N2K1N1 w - - 0 1",
            "4k3/8/8/8/8/8/8/R3K3 w - - 0 1",
            "4k3/8/8/8/8/8/4P3/4K3 w - - 0 1"
    })
    public void otherMaterialShouldNotBeInsufficient(String fen) {
        // Given
        Position position = BoardGenerator.from(fen);

        // Then
        assertFalse(GameStatusEvaluator.isInsufficientMaterial(position.board()));
        assertNull(GameStatusEvaluator.getDrawReason(position, 100));
    }
}
