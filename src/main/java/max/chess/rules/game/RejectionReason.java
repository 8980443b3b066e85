package max.chess.rules.game;

public enum RejectionReason {
    // No legal move joins the requested squares
    ILLEGAL_MOVE,
    NOTHING_TO_UNDO,
    // Checkmate, stalemate or draw reached
    GAME_OVER
}
