package max.chess.rules.game;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import max.chess.rules.common.Color;
import max.chess.rules.common.Piece;
import max.chess.rules.common.PieceType;

import java.util.Collections;
import java.util.List;

/**
 * Append-only log of played moves with what is needed to take them back, plus the
 * pieces each side has lost.
 */
public class MoveHistory {
    private final ObjectArrayList<GameChanges> entries = new ObjectArrayList<>();
    private final ObjectArrayList<PieceType> whiteCaptured = new ObjectArrayList<>();
    private final ObjectArrayList<PieceType> blackCaptured = new ObjectArrayList<>();

    public void push(GameChanges gameChanges) {
        entries.push(gameChanges);
        Piece captured = gameChanges.capturedPiece();
        if(captured != null) {
            capturedList(captured.color()).add(captured.type());
        }
    }

    /** Removes the latest entry, and one instance of its captured piece from the loser's list. */
    public GameChanges pop() {
        GameChanges gameChanges = entries.pop();
        Piece captured = gameChanges.capturedPiece();
        if(captured != null) {
            ObjectArrayList<PieceType> capturedList = capturedList(captured.color());
            int index = capturedList.lastIndexOf(captured.type());
            if(index >= 0) {
                capturedList.remove(index);
            }
        }
        return gameChanges;
    }

    public GameChanges last() {
        return entries.isEmpty() ? null : entries.top();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
        whiteCaptured.clear();
        blackCaptured.clear();
    }

    public List<GameChanges> entries() {
        return Collections.unmodifiableList(entries);
    }

    public List<String> notations() {
        List<String> notations = new ObjectArrayList<>(entries.size());
        for(GameChanges gameChanges : entries) {
            notations.add(gameChanges.notation());
        }
        return Collections.unmodifiableList(notations);
    }

    /** Pieces of {@code color} captured by the opponent, in capture order. */
    public List<PieceType> capturedPieces(Color color) {
        return Collections.unmodifiableList(capturedList(color));
    }

    private ObjectArrayList<PieceType> capturedList(Color color) {
        return color == Color.WHITE ? whiteCaptured : blackCaptured;
    }
}
