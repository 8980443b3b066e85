package max.chess.rules.common;

public enum CastlingSide {
    KINGSIDE(6, 7, 5),
    QUEENSIDE(2, 0, 3);

    private final int kingTargetFile;
    private final int rookOriginFile;
    private final int rookTargetFile;

    CastlingSide(int kingTargetFile, int rookOriginFile, int rookTargetFile) {
        this.kingTargetFile = kingTargetFile;
        this.rookOriginFile = rookOriginFile;
        this.rookTargetFile = rookTargetFile;
    }

    public static final int KING_ORIGIN_FILE = 4;

    public Square kingOrigin(Color color) {
        return Square.of(KING_ORIGIN_FILE, color.backRank());
    }

    public Square kingTarget(Color color) {
        return Square.of(kingTargetFile, color.backRank());
    }

    public Square rookOrigin(Color color) {
        return Square.of(rookOriginFile, color.backRank());
    }

    public Square rookTarget(Color color) {
        return Square.of(rookTargetFile, color.backRank());
    }

    public String notation() {
        return this == KINGSIDE ? "O-O" : "O-O-O";
    }
}
