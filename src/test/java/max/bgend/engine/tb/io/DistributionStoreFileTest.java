package max.bgend.engine.tb.io;

import max.bgend.engine.game.GameConfiguration;
import max.bgend.engine.tb.DistributionStore;
import max.bgend.engine.tb.MoveCountDistribution;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class DistributionStoreFileTest {
    static DistributionStore store;

    @BeforeAll
    static void setUp() {
        store = new DistributionStore(new GameConfiguration(3, 2));
        store.compute(0, -1);
    }

    private static void assertSameEntries(DistributionStore expected, DistributionStore actual) {
        assertEquals(expected.config(), actual.config());
        assertEquals(expected.boardIds(), actual.boardIds());
        for (long id : expected.boardIds()) {
            assertEquals(expected.probe(id), actual.probe(id), "board " + id);
        }
    }

    private static byte[] bytes(DistributionStore store) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        DistributionStoreFile.save(store, out);
        return out.toByteArray();
    }

    @Test
    void roundTripThroughAFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("nested").resolve("store.bin");
        DistributionStoreFile.save(store, file);
        assertTrue(Files.exists(file));

        DistributionStore loaded = DistributionStoreFile.load(file);
        assertEquals(10, loaded.size());
        assertTrue(loaded.isComplete());
        assertSameEntries(store, loaded);
        assertArrayEquals(new double[] {0, 13 / 18.0, 5 / 18.0}, loaded.probe(25).orElseThrow().toArray(), 1e-12);
    }

    @Test
    void headerLayout() throws IOException {
        ByteBuffer buf = ByteBuffer.wrap(bytes(store));
        assertEquals(DistributionStoreFile.MAGIC, buf.getInt());
        assertEquals(DistributionStoreFile.VERSION, buf.getShort());
        assertEquals(3, buf.getInt());
        assertEquals(2, buf.getInt());
        assertEquals(10, buf.getInt());
        assertEquals(7, buf.getLong(), "entries ascending, finished board first");
        assertEquals(1, buf.getInt());
        assertEquals(1.0, buf.getDouble());
    }

    @Test
    void partialStoresAreKeptPartial() throws IOException {
        DistributionStore partial = new DistributionStore(new GameConfiguration(3, 2));
        partial.put(7, MoveCountDistribution.finished());
        partial.put(11, new MoveCountDistribution(0, 1));
        DistributionStore loaded = DistributionStoreFile.load(new ByteArrayInputStream(bytes(partial)));
        assertFalse(loaded.isComplete());
        assertSameEntries(partial, loaded);
    }

    @Test
    void rejectsBadMagic() throws IOException {
        byte[] data = bytes(store);
        data[0] = 'X';
        IOException e = assertThrows(IOException.class,
            () -> DistributionStoreFile.load(new ByteArrayInputStream(data)));
        assertTrue(e.getMessage().contains("bad magic"), e.getMessage());
    }

    @Test
    void rejectsUnknownVersion() throws IOException {
        byte[] data = bytes(store);
        data[5] = 9;
        assertThrows(IOException.class, () -> DistributionStoreFile.load(new ByteArrayInputStream(data)));
    }

    @Test
    void rejectsTruncatedFiles() throws IOException {
        byte[] data = bytes(store);
        byte[] truncated = Arrays.copyOf(data, data.length - 4);
        IOException e = assertThrows(IOException.class,
            () -> DistributionStoreFile.load(new ByteArrayInputStream(truncated)));
        assertTrue(e.getMessage().startsWith("Truncated"), e.getMessage());
        assertThrows(IOException.class, () -> DistributionStoreFile.load(new ByteArrayInputStream(new byte[3])));
    }

    @Test
    void rejectsInvalidBoardIds() throws IOException {
        byte[] data = bytes(store);
        // first entry id, right after the 18 byte header
        ByteBuffer.wrap(data).putLong(18, 0L);
        assertThrows(IOException.class, () -> DistributionStoreFile.load(new ByteArrayInputStream(data)));
    }
}
