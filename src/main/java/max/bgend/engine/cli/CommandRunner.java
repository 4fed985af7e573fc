package max.bgend.engine.cli;

import max.bgend.engine.game.GameConfiguration;
import max.bgend.engine.game.board.Board;
import max.bgend.engine.tb.ComputeConfig;
import max.bgend.engine.tb.DistributionStore;
import max.bgend.engine.tb.MoveCountDistribution;
import max.bgend.engine.tb.compare.Disagreement;
import max.bgend.engine.tb.compare.DisagreementFinder;
import max.bgend.engine.tb.gnubg.GnubgStoreImporter;
import max.bgend.engine.tb.io.DistributionStoreFile;
import max.bgend.engine.utils.notations.BoardIOUtils;

import java.io.IOException;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Command line front end. Commands:
 * <pre>
 *   compute &lt;markers&gt; &lt;spots&gt; [--out DIR] [--progress N] [--limit N]
 *   show &lt;store&gt; &lt;boardId&gt;
 *   gnubg-import &lt;markers&gt; &lt;spots&gt; &lt;dumpDir&gt; &lt;out&gt;
 *   compare &lt;ours&gt; &lt;theirs&gt; &lt;csv&gt; [--sample N] [--seed S]
 * </pre>
 * A sweep stopped by {@code --limit} is saved as {@code bgend_store_<m>_<s>.partial.bin}.
 */
public final class CommandRunner {
    public static final int EXIT_OK = 0;
    public static final int EXIT_IO_ERROR = 1;
    public static final int EXIT_USAGE = 2;

    private static final String USAGE = String.join("\n",
        "usage:",
        "  compute <markers> <spots> [--out DIR] [--progress N] [--limit N]",
        "  show <store> <boardId>",
        "  gnubg-import <markers> <spots> <dumpDir> <out>",
        "  compare <ours> <theirs> <csv> [--sample N] [--seed S]");

    private final PrintStream out;
    private final PrintStream err;

    public CommandRunner(PrintStream out, PrintStream err) {
        this.out = Objects.requireNonNull(out);
        this.err = Objects.requireNonNull(err);
    }

    public int run(String[] args) {
        if (args.length == 0) {
            err.println(USAGE);
            return EXIT_USAGE;
        }
        String command = args[0];
        List<String> rest = Arrays.asList(args).subList(1, args.length);
        try {
            switch (command) {
                case "compute": return handleCompute(Arguments.parse(rest, Set.of("out", "progress", "limit")));
                case "show": return handleShow(Arguments.parse(rest, Set.of()));
                case "gnubg-import": return handleGnubgImport(Arguments.parse(rest, Set.of()));
                case "compare": return handleCompare(Arguments.parse(rest, Set.of("sample", "seed")));
                default:
                    err.println("Unknown command: " + command);
                    err.println(USAGE);
                    return EXIT_USAGE;
            }
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return EXIT_IO_ERROR;
        }
    }

    /* -------------------- command handlers -------------------- */

    private int handleCompute(Arguments a) throws IOException {
        a.expectPositionals(2);
        GameConfiguration config = new GameConfiguration(a.intAt(0), a.intAt(1));
        ComputeConfig.Builder builder = new ComputeConfig.Builder();
        if (a.has("out")) builder.outputDirectory(Path.of(a.option("out")));
        if (a.has("progress")) builder.progressInterval(a.longOption("progress"));
        if (a.has("limit")) builder.limit(a.longOption("limit"));
        ComputeConfig cfg = builder.build();

        DistributionStore store = new DistributionStore(config);
        store.compute(cfg, out::println, new AtomicBoolean(false));
        Path file;
        if (store.isComplete()) {
            file = cfg.storeFile(config.numMarkers(), config.numSpots());
        } else {
            err.println("Warning: partial store (" + store.size() + "/" + config.numValidBoards()
                + " boards), for diagnostics only");
            file = cfg.partialStoreFile(config.numMarkers(), config.numSpots());
        }
        DistributionStoreFile.save(store, file);
        out.println("Saved " + store.size() + " boards to " + file);
        return EXIT_OK;
    }

    private int handleShow(Arguments a) throws IOException {
        a.expectPositionals(2);
        DistributionStore store = DistributionStoreFile.load(Path.of(a.positional(0)));
        if (!store.isComplete()) {
            err.println("Warning: partial store (" + store.size() + "/" + store.config().numValidBoards()
                + " boards), for diagnostics only");
        }
        long boardId = a.longAt(1);
        Board board = Board.fromId(store.config(), boardId);
        out.println("Board " + boardId);
        out.print(BoardIOUtils.prettyString(board));
        MoveCountDistribution dist = store.probe(boardId).orElse(null);
        out.println(dist == null ? "Not in store" : dist.toString());
        return EXIT_OK;
    }

    private int handleGnubgImport(Arguments a) throws IOException {
        a.expectPositionals(4);
        GameConfiguration config = new GameConfiguration(a.intAt(0), a.intAt(1));
        DistributionStore store = GnubgStoreImporter.fromDirectory(config, Path.of(a.positional(2)));
        Path file = Path.of(a.positional(3));
        DistributionStoreFile.save(store, file);
        out.println("Imported " + store.size() + " boards to " + file);
        return EXIT_OK;
    }

    private int handleCompare(Arguments a) throws IOException {
        a.expectPositionals(3);
        int sampleEvery = a.has("sample") ? a.intOption("sample") : 1;
        long seed = a.has("seed") ? a.longOption("seed") : 0L;
        out.println("Reading stores");
        DistributionStore ours = DistributionStoreFile.load(Path.of(a.positional(0)));
        DistributionStore theirs = DistributionStoreFile.load(Path.of(a.positional(1)));

        out.println("Starting analysis");
        DisagreementFinder finder = new DisagreementFinder(ours, theirs);
        List<Disagreement> disagreements = finder.find(sampleEvery, seed, 500, out::println);
        try (Writer csv = Files.newBufferedWriter(Path.of(a.positional(2)), StandardCharsets.UTF_8)) {
            DisagreementFinder.writeCsv(disagreements, csv);
        }
        return EXIT_OK;
    }

    /* -------------------- argument parsing -------------------- */

    static final class Arguments {
        private final List<String> positionals = new ArrayList<>();
        private final Map<String, String> options = new HashMap<>();

        static Arguments parse(List<String> tokens, Set<String> allowedOptions) {
            Arguments a = new Arguments();
            for (int i = 0; i < tokens.size(); i++) {
                String t = tokens.get(i);
                if (t.startsWith("--")) {
                    String name = t.substring(2);
                    if (!allowedOptions.contains(name)) {
                        throw new IllegalArgumentException("Unknown option: " + t);
                    }
                    if (i + 1 >= tokens.size()) {
                        throw new IllegalArgumentException("Missing value for " + t);
                    }
                    a.options.put(name, tokens.get(++i));
                } else {
                    a.positionals.add(t);
                }
            }
            return a;
        }

        void expectPositionals(int n) {
            if (positionals.size() != n) {
                throw new IllegalArgumentException("Expected " + n + " arguments, got " + positionals.size());
            }
        }

        String positional(int i) {
            return positionals.get(i);
        }

        int intAt(int i) {
            return Integer.parseInt(positionals.get(i));
        }

        long longAt(int i) {
            return Long.parseLong(positionals.get(i));
        }

        boolean has(String name) {
            return options.containsKey(name);
        }

        String option(String name) {
            return options.get(name);
        }

        int intOption(String name) {
            return Integer.parseInt(options.get(name));
        }

        long longOption(String name) {
            return Long.parseLong(options.get(name));
        }
    }
}
