package max.bgend.engine.game;

import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongIterator;
import it.unimi.dsi.fastutil.longs.LongList;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.NoSuchElementException;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

public class GameConfigurationTest {

    @ParameterizedTest
    @CsvSource({
        "3, 2, 10",
        "6, 3, 84",
        "15, 6, 54264",
        "1, 1, 2",
    })
    void countsValidBoards(int markers, int spots, long expected) {
        GameConfiguration config = new GameConfiguration(markers, spots);
        assertEquals(expected, config.numValidBoards());

        long count = 0;
        LongIterator ids = config.generateValidIds().iterator();
        while (ids.hasNext()) {
            ids.nextLong();
            count++;
        }
        assertEquals(expected, count, "iteration must visit every valid id once");
    }

    @Test
    void idBounds() {
        GameConfiguration config = new GameConfiguration(3, 2);
        assertEquals(0b111, config.minBoardId());
        assertEquals(0b11100 + 1, config.maxBoardId());
        assertTrue(config.isValidId(config.minBoardId()));
        assertTrue(config.isValidId(config.maxBoardId() - 1));
        assertFalse(config.isValidId(config.maxBoardId()));
        assertFalse(config.isValidId(0b1111), "four bits set");
        assertFalse(config.isValidId(0b11));
    }

    @ParameterizedTest
    @CsvSource({
        "6, 3",
        "7, 5",
    })
    void validityIsPopulationCountOverTheWholeRange(int markers, int spots) {
        GameConfiguration config = new GameConfiguration(markers, spots);
        long valid = 0;
        for (long id = config.minBoardId(); id < config.maxBoardId(); id++) {
            assertEquals(Long.bitCount(id) == markers, config.isValidId(id), "id " + id);
            if (config.isValidId(id)) {
                valid++;
            }
        }
        assertEquals(config.numValidBoards(), valid);
    }

    @Test
    void generatesIdsInAscendingOrder() {
        GameConfiguration config = new GameConfiguration(3, 2);
        LongList ids = new LongArrayList(config.generateValidIds().iterator());
        assertEquals(LongArrayList.wrap(new long[] {7, 11, 13, 14, 19, 21, 22, 25, 26, 28}), ids);
    }

    @Test
    void validIdIterationRestartsOnEachCall() {
        GameConfiguration config = new GameConfiguration(2, 2);
        LongIterator first = config.generateValidIds().iterator();
        first.nextLong();
        first.nextLong();
        assertEquals(config.minBoardId(), config.generateValidIds().iterator().nextLong());
    }

    @Test
    void iteratorThrowsPastTheEnd() {
        GameConfiguration config = new GameConfiguration(1, 1);
        LongIterator ids = config.generateValidIds().iterator();
        assertEquals(0b01, ids.nextLong());
        assertEquals(0b10, ids.nextLong());
        assertFalse(ids.hasNext());
        assertThrows(NoSuchElementException.class, ids::nextLong);
    }

    @Test
    void nextValidIdChainsThroughTheWholeSpace() {
        GameConfiguration config = new GameConfiguration(5, 3);
        long id = config.minBoardId();
        int length = 1;
        OptionalLong next;
        while ((next = config.nextValidId(id)).isPresent()) {
            assertTrue(next.getAsLong() > id, "ids must increase");
            assertTrue(config.isValidId(next.getAsLong()));
            id = next.getAsLong();
            length++;
        }
        assertEquals(56, length);
        assertEquals(config.maxBoardId() - 1, id);
    }

    @Test
    void nextValidIdRejectsInvalidIds() {
        GameConfiguration config = new GameConfiguration(3, 2);
        InvalidBoardIdException e = assertThrows(InvalidBoardIdException.class, () -> config.nextValidId(0b1011_1));
        assertEquals(0b10111, e.boardId());
    }

    @ParameterizedTest
    @CsvSource({
        "0, 3",
        "3, 0",
        "-1, 4",
        "40, 23",
    })
    void rejectsBadConfigurations(int markers, int spots) {
        assertThrows(IllegalArgumentException.class, () -> new GameConfiguration(markers, spots));
    }

    @Test
    void largestSupportedConfiguration() {
        GameConfiguration config = new GameConfiguration(31, 31);
        assertEquals(GameConfiguration.MAX_ID_BITS, config.idBits());
        assertTrue(config.maxBoardId() > 0);
    }

    @Test
    void equality() {
        assertEquals(new GameConfiguration(15, 6), new GameConfiguration(15, 6));
        assertEquals(new GameConfiguration(15, 6).hashCode(), new GameConfiguration(15, 6).hashCode());
        assertNotEquals(new GameConfiguration(15, 6), new GameConfiguration(6, 15));
    }
}
