package max.chess.rules.game;

import max.chess.rules.common.Color;
import max.chess.rules.common.Piece;
import max.chess.rules.common.PieceType;
import max.chess.rules.common.Square;
import max.chess.rules.game.board.Board;
import max.chess.rules.game.board.utils.BoardGenerator;
import max.chess.rules.movegen.Move;
import max.chess.rules.movegen.MoveGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One chess game: a live {@link Position}, its {@link MoveHistory} and the current status.
 * Not thread-safe; callers serialise the operations on a given instance.
 */
public class Game {
    private static final Logger LOGGER = LoggerFactory.getLogger(Game.class);

    private final GameConfig config;
    private final MoveHistory history = new MoveHistory();
    private Position position;
    private GameStatus status;
    private DrawReason drawReason;

    public Game() {
        this(GameConfig.defaults());
    }

    public Game(GameConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        newGame();
    }

    public static Game fromFen(String fen) {
        return new Game(new GameConfig.Builder().startingFen(fen).build());
    }

    /** Resets position, history and status to the configured starting position. */
    public void newGame() {
        position = BoardGenerator.from(config.startingFen);
        history.clear();
        refreshStatus();
        LOGGER.info("New game from {} ({})", config.startingFen, status);
    }

    /** Legal moves of the piece on {@code square}, empty if it is not the side to move's piece. */
    public List<Move> validMoves(Square square) {
        Objects.requireNonNull(square, "square");
        if(status.isTerminal()) {
            return List.of();
        }
        return List.copyOf(MoveGenerator.generateLegalMoves(position, square));
    }

    /** All legal moves of the side to move. */
    public List<Move> validMoves() {
        if(status.isTerminal()) {
            return List.of();
        }
        return List.copyOf(MoveGenerator.generateLegalMoves(position));
    }

    /**
     * Plays the legal move joining both squares. A promotion resolves to the configured
     * default piece, queen unless configured otherwise.
     */
    public MoveResult attemptMove(Square from, Square to) {
        return attemptMove(from, to, config.defaultPromotion);
    }

    /**
     * Same as {@link #attemptMove(Square, Square)} with an explicit promotion choice. A null
     * choice takes the first generated variant. Ignored for non promoting moves.
     */
    public MoveResult attemptMove(Square from, Square to, PieceType promotion) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if(status.isTerminal()) {
            LOGGER.debug("Move {}{} rejected, game is over ({})", from, to, status);
            return MoveResult.rejected(RejectionReason.GAME_OVER, status);
        }

        Move selected = null;
        for(Move move : MoveGenerator.generateLegalMoves(position, from)) {
            if(!move.matches(from, to)) {
                continue;
            }
            if(!move.isPromotion() || promotion == null || move.promotion() == promotion) {
                selected = move;
                break;
            }
        }
        if(selected == null) {
            LOGGER.debug("Move {}{} rejected, not legal for {}", from, to, position.sideToMove());
            return MoveResult.rejected(RejectionReason.ILLEGAL_MOVE, status);
        }

        GameChanges gameChanges = position.playMove(selected);
        history.push(gameChanges);
        refreshStatus();
        checkInvariants();

        LOGGER.debug("Played {} -> {}", gameChanges.notation(), status);
        if(status.isTerminal()) {
            LOGGER.info("Game over after {}: {}{}", gameChanges.notation(), status,
                    drawReason == null ? "" : " by " + drawReason);
        }
        return MoveResult.applied(selected, gameChanges.notation(), status);
    }

    /** Takes back the last move. Refused when nothing was played or the game is over. */
    public UndoResult undo() {
        if(history.isEmpty()) {
            return UndoResult.rejected(RejectionReason.NOTHING_TO_UNDO, status);
        }
        if(status.isTerminal()) {
            LOGGER.debug("Undo rejected, game is over ({})", status);
            return UndoResult.rejected(RejectionReason.GAME_OVER, status);
        }

        GameChanges gameChanges = history.pop();
        position.undoMove(gameChanges);
        refreshStatus();
        checkInvariants();

        LOGGER.debug("Took back {} -> {}", gameChanges.notation(), status);
        return UndoResult.undone(gameChanges.move(), status);
    }

    private void refreshStatus() {
        status = GameStatusEvaluator.evaluate(position, config.fiftyMoveHalfMoves);
        drawReason = status == GameStatus.DRAW
                ? GameStatusEvaluator.getDrawReason(position, config.fiftyMoveHalfMoves)
                : null;
    }

    private void checkInvariants() {
        if(!config.debug) {
            return;
        }
        Board board = position.board();
        for(Color color : Color.values()) {
            int kings = 0;
            for(int i = 0; i < 64; i++) {
                Piece piece = board.getPiece(Square.of(i));
                if(piece != null && piece.is(PieceType.KING, color)) {
                    kings++;
                    if(board.getKingSquare(color) != Square.of(i)) {
                        throw new IllegalStateException(color + " king cache points to " + board.getKingSquare(color)
                                + " but the king stands on " + Square.of(i));
                    }
                }
            }
            if(kings != 1) {
                throw new IllegalStateException("Expected one " + color + " king, found " + kings);
            }
        }
    }

    /** Read-only copy of the current position. */
    public Position position() {
        return position.copy();
    }

    public Piece pieceAt(Square square) {
        return position.board().getPiece(square);
    }

    public Color sideToMove() {
        return position.sideToMove();
    }

    public GameStatus status() {
        return status;
    }

    public Optional<DrawReason> drawReason() {
        return Optional.ofNullable(drawReason);
    }

    /** The side that delivered mate, only once the game ended in checkmate. */
    public Optional<Color> winner() {
        if(status != GameStatus.CHECKMATE) {
            return Optional.empty();
        }
        return Optional.of(position.sideToMove().getOppositeColor());
    }

    /** The side to move's king square, only while it is in check. */
    public Optional<Square> checkSquare() {
        if(status != GameStatus.CHECK) {
            return Optional.empty();
        }
        return Optional.of(position.board().getKingSquare(position.sideToMove()));
    }

    public List<PieceType> capturedPieces(Color color) {
        return List.copyOf(history.capturedPieces(color));
    }

    public List<String> moveHistory() {
        return List.copyOf(history.notations());
    }

    public List<GameChanges> historyEntries() {
        return List.copyOf(history.entries());
    }

    public Optional<Move> lastMove() {
        GameChanges last = history.last();
        return last == null ? Optional.empty() : Optional.of(last.move());
    }

    public String toFen() {
        return position.toFen();
    }

    @Override
    public String toString() {
        return position.toString();
    }
}
