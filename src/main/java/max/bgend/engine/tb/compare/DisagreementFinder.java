package max.bgend.engine.tb.compare;

import it.unimi.dsi.fastutil.longs.LongList;
import max.bgend.engine.game.board.Board;
import max.bgend.engine.movegen.Move;
import max.bgend.engine.movegen.Roll;
import max.bgend.engine.tb.DistributionStore;
import max.bgend.engine.tb.ProgressIndicator;
import max.bgend.engine.utils.notations.BoardIOUtils;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.function.Consumer;

/**
 * Replays the best-move choice of two databases over the same positions and reports where they lead to different
 * boards. Used to cross-check a computed store against one imported from gnubg.
 */
public final class DisagreementFinder {
    public static final String CSV_HEADER = "board_id,roll0,roll1,our_moves,our_moves_our_ev,our_moves_their_ev,"
        + "their_moves,their_moves_our_ev,their_moves_their_ev";

    private final DistributionStore ours;
    private final DistributionStore theirs;
    private long boardsExamined;

    public DisagreementFinder(DistributionStore ours, DistributionStore theirs) {
        if (!ours.config().equals(theirs.config())) {
            throw new IllegalArgumentException("Cannot compare " + ours.config() + " with " + theirs.config());
        }
        this.ours = ours;
        this.theirs = theirs;
    }

    public List<Disagreement> find(int sampleEvery, long seed) {
        return find(sampleEvery, seed, 0, s -> {});
    }

    /**
     * @param sampleEvery examine one board out of this many on average, every board when {@code <= 1}
     */
    public List<Disagreement> find(int sampleEvery, long seed, long progressInterval, Consumer<String> out) {
        Random random = new Random(seed);
        List<Disagreement> disagreements = new ArrayList<>();
        LongList ids = ours.boardIds();
        ProgressIndicator progress = new ProgressIndicator(ids.size(), progressInterval, out);
        boardsExamined = 0;

        for (int i = 0; i < ids.size(); i++) {
            long boardId = ids.getLong(i);
            progress.completeOne();
            if (sampleEvery > 1 && random.nextInt(sampleEvery) > 0) {
                continue;
            }
            boardsExamined++;
            Board board = Board.fromId(ours.config(), boardId);
            for (Roll roll : Roll.ALL) {
                List<Move> ourMoves = ours.computeBestMovesForRoll(board, roll);
                List<Move> theirMoves = theirs.computeBestMovesForRoll(board, roll);
                long ourBoardId = board.applyMoves(ourMoves).getId();
                long theirBoardId = board.applyMoves(theirMoves).getId();
                if (ourBoardId == theirBoardId) {
                    continue;
                }
                disagreements.add(new Disagreement(boardId, roll,
                    ourMoves, expectedValue(ours, ourBoardId), expectedValue(theirs, ourBoardId),
                    theirMoves, expectedValue(ours, theirBoardId), expectedValue(theirs, theirBoardId)));
            }
        }
        out.accept(String.format(Locale.ROOT, "Examined %d boards, found %d disagreements", boardsExamined,
            disagreements.size()));
        return disagreements;
    }

    public long boardsExamined() {
        return boardsExamined;
    }

    private static double expectedValue(DistributionStore store, long boardId) {
        return store.probe(boardId)
            .orElseThrow(() -> new IllegalStateException("Board " + boardId + " missing from " + store))
            .expectedValue();
    }

    public static void writeCsv(List<Disagreement> disagreements, Writer out) throws IOException {
        out.write(CSV_HEADER);
        out.write('\n');
        for (Disagreement d : disagreements) {
            out.write(String.format(Locale.ROOT, "%d,%d,%d,\"%s\",%s,%s,\"%s\",%s,%s\n",
                d.boardId(), d.roll().die(0), d.roll().die(1),
                BoardIOUtils.encodeMoves(d.ourMoves()), d.ourMovesOurEv(), d.ourMovesTheirEv(),
                BoardIOUtils.encodeMoves(d.theirMoves()), d.theirMovesOurEv(), d.theirMovesTheirEv()));
        }
        out.flush();
    }
}
