package max.chess.rules.game;

public enum GameStatus {
    ACTIVE, CHECK, CHECKMATE, STALEMATE, DRAW;

    /** Checkmate, stalemate and draws end the game. */
    public boolean isTerminal() {
        return this == CHECKMATE || this == STALEMATE || this == DRAW;
    }
}
