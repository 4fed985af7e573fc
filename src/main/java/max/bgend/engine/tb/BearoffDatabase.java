package max.bgend.engine.tb;

import max.bgend.engine.game.GameConfiguration;
import max.bgend.engine.game.board.Board;

import java.util.Optional;

public interface BearoffDatabase {
    GameConfiguration config();

    /** Distribution of a board id, empty if this database has no entry for it. */
    Optional<MoveCountDistribution> probe(long boardId);

    default Optional<MoveCountDistribution> probe(Board board) {
        return probe(board.getId());
    }

    long size();

    /** True only when every valid board id has an entry; partial databases are for diagnostics. */
    boolean isComplete();
}
