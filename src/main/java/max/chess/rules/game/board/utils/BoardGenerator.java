package max.chess.rules.game.board.utils;

import max.chess.rules.game.Position;
import max.chess.rules.utils.notations.FENUtils;

public class BoardGenerator {
    public static final String STANDARD_GAME = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1";

    public static Position newStandardPosition() {
        return FENUtils.getPositionFrom(STANDARD_GAME);
    }

    public static Position from(String fen) {
        return FENUtils.getPositionFrom(fen);
    }
}
