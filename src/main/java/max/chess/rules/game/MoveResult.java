package max.chess.rules.game;

import max.chess.rules.movegen.Move;

/** Outcome of a move attempt: the applied move and the new status, or why it was rejected. */
public final class MoveResult {
    public final Move move; // null when rejected
    public final String notation; // null when rejected
    public final GameStatus status;
    public final RejectionReason rejectionReason; // null when applied

    private MoveResult(Move move, String notation, GameStatus status, RejectionReason rejectionReason) {
        this.move = move;
        this.notation = notation;
        this.status = status;
        this.rejectionReason = rejectionReason;
    }

    public static MoveResult applied(Move move, String notation, GameStatus status) {
        return new MoveResult(move, notation, status, null);
    }

    public static MoveResult rejected(RejectionReason reason, GameStatus status) {
        return new MoveResult(null, null, status, reason);
    }

    public boolean isApplied() {
        return rejectionReason == null;
    }

    @Override
    public String toString() {
        return isApplied() ? "applied " + notation + " (" + status + ")" : "rejected " + rejectionReason;
    }
}
