package max.bgend.engine.tb;

import it.unimi.dsi.fastutil.longs.Long2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongIterator;
import it.unimi.dsi.fastutil.longs.LongList;
import max.bgend.engine.game.GameConfiguration;
import max.bgend.engine.game.InvalidBoardIdException;
import max.bgend.engine.game.board.Board;
import max.bgend.engine.movegen.Move;
import max.bgend.engine.movegen.Roll;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * The bearoff database: one {@link MoveCountDistribution} per board id, computed by retrograde analysis.
 * <p>
 * {@link #compute} visits the ids in ascending order. Since every move lowers the id, all the boards reachable in
 * one roll are final by the time a board is reached, and each board is computed exactly once. The sweep is
 * sequential by construction.
 */
public final class DistributionStore implements BearoffDatabase {
    private record BestMove(List<Move> moves, long resultingId, double expectedValue) {}

    private final GameConfiguration config;
    private final Long2ObjectOpenHashMap<MoveCountDistribution> distributionMap;

    public DistributionStore(GameConfiguration config) {
        this.config = config;
        this.distributionMap = new Long2ObjectOpenHashMap<>();
    }

    @Override
    public GameConfiguration config() {
        return config;
    }

    /** Full sweep with the default progress reporting on standard output. */
    public void compute() {
        compute(ComputeConfig.defaults(), System.out::println, new AtomicBoolean(false));
    }

    public void compute(long progressInterval, long limit) {
        ComputeConfig cfg = new ComputeConfig.Builder()
            .progressInterval(progressInterval)
            .limit(limit)
            .build();
        compute(cfg, System.out::println, new AtomicBoolean(false));
    }

    /**
     * Clears the store and computes the distribution of every board.
     * <p>
     * The sweep halts early when {@code cfg.limit} boards have been processed (the finished board included) or when
     * {@code stop} is set; it is only checked between two boards. An early stop leaves a store covering a prefix of
     * the id space, see {@link #isComplete()}.
     *
     * @throws UnnormalizedDistributionException if a computed distribution does not sum to one. The sweep is
     *                                           aborted and the store must not be persisted.
     */
    public void compute(ComputeConfig cfg, Consumer<String> out, AtomicBoolean stop) {
        distributionMap.clear();
        long total = config.numValidBoards();
        if (cfg.progressInterval > 0) {
            out.accept("Starting compute on " + total + " boards");
        }

        // The minimum board id is the game ended state
        distributionMap.put(config.minBoardId(), MoveCountDistribution.finished());
        ProgressIndicator progress = new ProgressIndicator(total, cfg.progressInterval, out, 1);

        LongIterator ids = config.generateValidIds().iterator();
        ids.nextLong();
        long lastId = config.minBoardId();
        while (ids.hasNext()) {
            if (cfg.isLimited() && progress.completed() >= cfg.limit) {
                out.accept("Stopping at " + progress.completed() + " boards, id " + lastId);
                return;
            }
            if (stop.get()) {
                out.accept("Stop requested at " + progress.completed() + " boards, id " + lastId);
                return;
            }
            long boardId = ids.nextLong();
            Board board = Board.fromId(config, boardId);
            distributionMap.put(boardId, computeMoveDistributionForBoard(board));
            lastId = boardId;
            progress.completeOne();
        }
        if (cfg.progressInterval > 0) {
            out.accept(String.format(Locale.ROOT, "Computed %d boards in %fs", progress.completed(),
                progress.elapsedSeconds()));
        }
    }

    /**
     * Combines the 21 rolls: for each, the best reachable board's distribution one turn later, weighted by the roll's
     * probability. Every reachable board must already be in the store.
     */
    public MoveCountDistribution computeMoveDistributionForBoard(Board board) {
        if (board.isFinished()) {
            return MoveCountDistribution.finished();
        }
        MoveCountDistribution out = MoveCountDistribution.zero();
        for (Roll roll : Roll.ALL) {
            BestMove best = bestMoveForRoll(board, roll);
            out = out.plus(require(best.resultingId()).increaseCounts(1).times(roll.probability()));
        }
        if (!out.isNormalized()) {
            throw new UnnormalizedDistributionException(board.getId(), out);
        }
        return out;
    }

    /**
     * The moves for {@code roll} reaching the board with the lowest expected number of turns. Move lists reaching the
     * same board are equivalent, only the first one generated is kept; ties between boards go to the first one
     * generated as well.
     */
    public List<Move> computeBestMovesForRoll(Board board, Roll roll) {
        return bestMoveForRoll(board, roll).moves();
    }

    private BestMove bestMoveForRoll(Board board, Roll roll) {
        Long2ObjectLinkedOpenHashMap<List<Move>> nextBoards = new Long2ObjectLinkedOpenHashMap<>();
        for (List<Move> moves : board.generateMoves(roll)) {
            long nextId = board.applyMoves(moves).getId();
            nextBoards.putIfAbsent(nextId, moves);
        }

        BestMove best = null;
        for (Long2ObjectMap.Entry<List<Move>> entry : nextBoards.long2ObjectEntrySet()) {
            double expectedValue = require(entry.getLongKey()).expectedValue();
            if (best == null || expectedValue < best.expectedValue()) {
                best = new BestMove(entry.getValue(), entry.getLongKey(), expectedValue);
            }
        }
        if (best == null) {
            throw new IllegalStateException("No move generated for " + board + " and " + roll);
        }
        return best;
    }

    private MoveCountDistribution require(long boardId) {
        MoveCountDistribution dist = distributionMap.get(boardId);
        if (dist == null) {
            throw new IllegalStateException("Board " + boardId + " has not been computed yet");
        }
        return dist;
    }

    @Override
    public Optional<MoveCountDistribution> probe(long boardId) {
        return Optional.ofNullable(distributionMap.get(boardId));
    }

    /** Adds or replaces an entry, for loaders and importers. */
    public void put(long boardId, MoveCountDistribution distribution) {
        if (!config.isValidId(boardId)) {
            throw new InvalidBoardIdException(boardId, config);
        }
        distributionMap.put(boardId, Objects.requireNonNull(distribution));
    }

    public void clear() {
        distributionMap.clear();
    }

    @Override
    public long size() {
        return distributionMap.size();
    }

    @Override
    public boolean isComplete() {
        return distributionMap.size() == config.numValidBoards();
    }

    /** The ids of the stored boards, ascending. */
    public LongList boardIds() {
        long[] ids = distributionMap.keySet().toLongArray();
        Arrays.sort(ids);
        return LongArrayList.wrap(ids);
    }

    @Override
    public String toString() {
        return "DistributionStore[" + config + ", " + distributionMap.size() + "/" + config.numValidBoards()
            + " boards]";
    }
}
