package max.bgend.engine.tb.compare;

import max.bgend.engine.movegen.Move;
import max.bgend.engine.movegen.Roll;

import java.util.List;

/**
 * Two databases pick different boards for the same position and roll. Each choice is scored by both databases.
 */
public record Disagreement(long boardId, Roll roll,
                           List<Move> ourMoves, double ourMovesOurEv, double ourMovesTheirEv,
                           List<Move> theirMoves, double theirMovesOurEv, double theirMovesTheirEv) {
}
