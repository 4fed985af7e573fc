package max.bgend.engine.tb.gnubg;

import max.bgend.engine.game.GameConfiguration;
import max.bgend.engine.game.board.Board;
import max.bgend.engine.tb.DistributionStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class GnubgStoreImporterTest {
    private static final GameConfiguration GNUBG = new GameConfiguration(15, 6);

    @Test
    void importsDumpsKeyedByOurIds(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("a.txt"), GnubgDumpParserTest.DUMP);
        Files.writeString(dir.resolve("b.TXT"), "Position ID: YwAAAAAAAAAAAA\nRolls\n 1 10\n 2 90\n");
        Files.writeString(dir.resolve("ignored.csv"), "Position ID: uX8HAAAAAAAAAA\n");

        DistributionStore store = GnubgStoreImporter.fromDirectory(GNUBG, dir);
        assertEquals(3, store.size());
        assertFalse(store.isComplete());

        Board board = new Board(GNUBG, 14, 0, 1, 0, 0, 0, 0);
        assertEquals(0.02778, store.probe(board).orElseThrow().get(2), 1e-12);
        assertTrue(store.probe(new Board(GNUBG, 11, 2, 0, 0, 2, 0, 0)).isPresent());
    }

    @Test
    void addsToAnExistingStore() throws IOException {
        DistributionStore store = new DistributionStore(GNUBG);
        GnubgStoreImporter.addAll(store, new StringReader(GnubgDumpParserTest.DUMP));
        assertEquals(2, store.size());
        assertEquals(1.0, store.probe(new Board(GNUBG, 14, 1, 0, 0, 0, 0, 0)).orElseThrow().get(1));
    }

    @Test
    void positionsOutsideTheConfigurationAreRejected() {
        DistributionStore small = new DistributionStore(new GameConfiguration(3, 2));
        assertThrows(IllegalArgumentException.class,
            () -> GnubgStoreImporter.addAll(small, new StringReader("Position ID: uX8HAAAAAAAAAA\nRolls\n 1 100\n")));
    }
}
