package max.bgend.engine.movegen;

import max.bgend.engine.game.GameConfiguration;
import max.bgend.engine.game.board.Board;
import max.bgend.engine.utils.notations.BoardIOUtils;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class MoveGeneratorTest {

    private static String encode(List<List<Move>> moveLists) {
        return moveLists.stream().map(BoardIOUtils::encodeMoves).collect(Collectors.joining(", ", "[", "]"));
    }

    @Test
    void mixedRollIsPlayedInBothOrders() {
        Board board = new Board(new GameConfiguration(6, 2), 1, 2, 3);
        assertEquals("[[[2, 5], [2, 4]], [[2, 4], [2, 5]]]", encode(MoveGenerator.generateMoves(board, Roll.of(5, 4))));
    }

    @Test
    void overflowOnlyFromTheFarthestSpot() {
        Board board = new Board(new GameConfiguration(2, 4), 0, 0, 1, 0, 1);
        assertEquals("[[[4, 4], [2, 3]], [[4, 3], [2, 4]]]", encode(board.generateMoves(Roll.of(4, 3))));
    }

    @Test
    void shorterListsWhenTheBoardFinishesEarly() {
        Board board = new Board(new GameConfiguration(2, 2), 1, 0, 1);
        assertEquals("[[[2, 5]], [[2, 4]]]", encode(board.generateMoves(Roll.of(5, 4))));

        Board twoLeft = new Board(new GameConfiguration(2, 4), 0, 0, 1, 0, 1);
        assertEquals("[[[4, 4], [2, 4]]]", encode(twoLeft.generateMoves(Roll.of(4, 4))));

        Board threeLeft = new Board(new GameConfiguration(3, 4), 0, 1, 0, 2, 0);
        assertEquals("[[[3, 4], [3, 4], [1, 4]]]", encode(threeLeft.generateMoves(Roll.of(4, 4))));
    }

    @Test
    void doublesEnumerateEveryOrder() {
        Board board = new Board(new GameConfiguration(9, 4), 0, 0, 3, 3, 3);
        List<List<Move>> moveLists = board.generateMoves(Roll.of(2, 2));
        assertEquals(78, moveLists.size());
        for (List<Move> moves : moveLists) {
            assertEquals(4, moves.size());
            assertDoesNotThrow(() -> board.applyMoves(moves));
        }
    }

    @Test
    void finishedBoardHasOnlyTheEmptyMove() {
        Board board = Board.fromId(new GameConfiguration(3, 2), 0b111);
        List<List<Move>> moveLists = board.generateMoves(Roll.of(6, 6));
        assertEquals(1, moveLists.size());
        assertTrue(moveLists.get(0).isEmpty());
    }

    @Test
    void everyGeneratedListIsLegal() {
        GameConfiguration config = new GameConfiguration(4, 4);
        var ids = config.generateValidIds().iterator();
        while (ids.hasNext()) {
            Board board = Board.fromId(config, ids.nextLong());
            for (Roll roll : Roll.ALL) {
                List<List<Move>> moveLists = board.generateMoves(roll);
                assertFalse(moveLists.isEmpty(), board + " " + roll);
                for (List<Move> moves : moveLists) {
                    Board after = board.applyMoves(moves);
                    assertTrue(after.getId() < board.getId() || board.isFinished(), board + " " + moves);
                    assertTrue(moves.size() == roll.numDice() || after.isFinished(), board + " " + moves);
                }
            }
        }
    }

    @Test
    void generatedListsAreUnmodifiable() {
        Board board = new Board(new GameConfiguration(6, 2), 1, 2, 3);
        List<Move> moves = board.generateMoves(Roll.of(1, 2)).get(0);
        assertThrows(UnsupportedOperationException.class, () -> moves.add(new Move(1, 1)));
    }

    @Test
    void explicitDice() {
        Board board = new Board(new GameConfiguration(2, 6), 0, 0, 0, 0, 0, 0, 2);
        assertEquals("[[[6, 3]]]", encode(board.generateMoves(Roll.ofDice(3))));
    }
}
