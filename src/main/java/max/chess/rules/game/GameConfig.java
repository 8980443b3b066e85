package max.chess.rules.game;

import max.chess.rules.common.PieceType;
import max.chess.rules.game.board.utils.BoardGenerator;

public final class GameConfig {

    public final boolean debug;

    // Position the game starts from, and returns to on newGame()
    public final String startingFen;

    // Half moves without capture or pawn move after which the game is drawn
    public final int fiftyMoveHalfMoves;

    // Used when a promotion is attempted without an explicit choice
    public final PieceType defaultPromotion;

    private GameConfig(Builder b) {
        this.debug = b.debug;
        this.startingFen = b.startingFen;
        this.fiftyMoveHalfMoves = b.fiftyMoveHalfMoves;
        this.defaultPromotion = b.defaultPromotion;
    }

    public static GameConfig defaults() {
        return new Builder().build();
    }

    public static class Builder {
        private boolean debug = false;
        private String startingFen = BoardGenerator.STANDARD_GAME;
        private int fiftyMoveHalfMoves = GameStatusEvaluator.DEFAULT_FIFTY_MOVE_HALF_MOVES;
        private PieceType defaultPromotion = PieceType.QUEEN;

        public Builder debug(boolean v){debug=v;return this;}
        public Builder startingFen(String v){startingFen=v;return this;}
        public Builder fiftyMoveHalfMoves(int v){fiftyMoveHalfMoves=v;return this;}
        public Builder defaultPromotion(PieceType v){defaultPromotion=v;return this;}

        public GameConfig build(){
            if(startingFen == null) {
                throw new IllegalArgumentException("startingFen cannot be null");
            }
            if(fiftyMoveHalfMoves < 1) {
                throw new IllegalArgumentException("fiftyMoveHalfMoves must be positive: " + fiftyMoveHalfMoves);
            }
            if(defaultPromotion == null || !defaultPromotion.isPromotionTarget()) {
                throw new IllegalArgumentException("Cannot promote to " + defaultPromotion);
            }
            return new GameConfig(this);
        }
    }
}
