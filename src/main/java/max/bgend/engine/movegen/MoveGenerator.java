package max.bgend.engine.movegen;

import max.bgend.engine.game.board.Board;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Enumerates the legal ways to play a roll.
 * <p>
 * Every returned list is legal, but several lists can lead to the same final board: de-duplication is left to the
 * caller. A list is shorter than the roll only when the board is finished before every die is used.
 */
public final class MoveGenerator {
    private MoveGenerator() {}

    public static List<List<Move>> generateMoves(Board board, Roll roll) {
        List<List<Move>> moveLists = new ArrayList<>();
        Move[] buffer = new Move[roll.numDice()];
        int[] dice = roll.dice();
        generate(board, dice, 0, buffer, moveLists);
        // Playing the dice in the other order can reach boards the first order cannot
        if (!roll.isDouble() && dice.length > 1) {
            int[] reversed = new int[dice.length];
            for (int i = 0; i < dice.length; i++) {
                reversed[i] = dice[dice.length - 1 - i];
            }
            generate(board, reversed, 0, buffer, moveLists);
        }
        return moveLists;
    }

    private static void generate(Board board, int[] dice, int diceIndex, Move[] buffer, List<List<Move>> out) {
        if (diceIndex >= dice.length || board.isFinished()) {
            out.add(Collections.unmodifiableList(Arrays.asList(Arrays.copyOf(buffer, diceIndex))));
            return;
        }
        int die = dice[diceIndex];
        boolean foundMarkers = false;
        for (int spot = board.numSpots(); spot > 0; spot--) {
            // Once a farther marker exists, a spot closer than the die cannot bear off
            if (foundMarkers && spot < die) {
                break;
            }
            if (board.spotCount(spot) > 0) {
                foundMarkers = true;
                Move move = new Move(spot, die);
                buffer[diceIndex] = move;
                generate(board.applyMove(move), dice, diceIndex + 1, buffer, out);
            }
        }
    }
}
