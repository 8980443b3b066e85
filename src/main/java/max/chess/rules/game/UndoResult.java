package max.chess.rules.game;

import max.chess.rules.movegen.Move;

/** Outcome of an undo request: the move taken back and the restored status, or why it was refused. */
public final class UndoResult {
    public final Move move; // null when rejected
    public final GameStatus status;
    public final RejectionReason rejectionReason; // null when undone

    private UndoResult(Move move, GameStatus status, RejectionReason rejectionReason) {
        this.move = move;
        this.status = status;
        this.rejectionReason = rejectionReason;
    }

    public static UndoResult undone(Move move, GameStatus status) {
        return new UndoResult(move, status, null);
    }

    public static UndoResult rejected(RejectionReason reason, GameStatus status) {
        return new UndoResult(null, status, reason);
    }

    public boolean isUndone() {
        return rejectionReason == null;
    }

    @Override
    public String toString() {
        return isUndone() ? "undone " + move + " (" + status + ")" : "rejected " + rejectionReason;
    }
}
