package max.chess.rules.game;

public enum DrawReason {
    FIFTY_MOVE_RULE, INSUFFICIENT_MATERIAL
}
