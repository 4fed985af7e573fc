package max.bgend.engine.tb.gnubg;

import max.bgend.engine.game.GameConfiguration;
import max.bgend.engine.game.board.Board;
import max.bgend.engine.tb.DistributionStore;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds a {@link DistributionStore} from gnubg dumps, keyed by our board ids, to compare against a computed one.
 */
public final class GnubgStoreImporter {
    private GnubgStoreImporter() {}

    /** Reads every {@code *.txt} dump of a directory. */
    public static DistributionStore fromDirectory(GameConfiguration config, Path dir) throws IOException {
        List<Path> dumps;
        try (Stream<Path> files = Files.list(dir)) {
            dumps = files
                .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".txt"))
                .sorted()
                .collect(Collectors.toList());
        }
        DistributionStore store = new DistributionStore(config);
        for (Path dump : dumps) {
            try (Reader in = Files.newBufferedReader(dump, StandardCharsets.UTF_8)) {
                addAll(store, in);
            }
        }
        return store;
    }

    public static void addAll(DistributionStore store, Reader dump) throws IOException {
        for (GnubgDumpEntry entry : GnubgDumpParser.parse(dump)) {
            Board board = GnubgPositionId.toBoard(store.config(), entry.positionId());
            store.put(board.getId(), entry.distribution());
        }
    }
}
