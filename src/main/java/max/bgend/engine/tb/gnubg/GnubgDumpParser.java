package max.bgend.engine.tb.gnubg;

import max.bgend.engine.tb.MoveCountDistribution;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the one-sided bearoff dumps written by gnubg.
 * <p>
 * A dump holds one or more blocks. A block starts on the line carrying {@code Position ID: <id>}; its distribution is
 * the table under the next line starting with {@code Rolls}, one row per number of turns, the player's probability
 * in percent in the second column. The table ends on the first line that is not a row. Anything else is ignored.
 */
public final class GnubgDumpParser {
    private static final Pattern POSITION_ID = Pattern.compile("Position ID:\\s*([A-Za-z0-9+/=]+)");
    private static final Pattern ROW = Pattern.compile("^\\s*(\\d+)\\s+([0-9]*\\.?[0-9]+(?:[eE][-+]?\\d+)?)%?(\\s.*)?$");

    private GnubgDumpParser() {}

    public static List<GnubgDumpEntry> parse(String dump) throws IOException {
        return parse(new StringReader(dump));
    }

    public static List<GnubgDumpEntry> parse(Reader reader) throws IOException {
        List<GnubgDumpEntry> entries = new ArrayList<>();
        BufferedReader in = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);

        String positionId = null;
        double[] dist = null;
        boolean inTable = false;
        int lineNumber = 0;
        String line;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            Matcher id = POSITION_ID.matcher(line);
            if (id.find()) {
                addEntry(entries, positionId, dist);
                positionId = id.group(1);
                dist = null;
                inTable = false;
                continue;
            }
            if (positionId == null) {
                continue;
            }
            if (line.trim().startsWith("Rolls")) {
                inTable = true;
                dist = new double[0];
                continue;
            }
            if (!inTable) {
                continue;
            }
            Matcher row = ROW.matcher(line);
            if (!row.matches()) {
                inTable = false;
                continue;
            }
            int turns;
            double percent;
            try {
                turns = Integer.parseInt(row.group(1));
                percent = Double.parseDouble(row.group(2));
            } catch (NumberFormatException e) {
                throw new IOException("Bad row at line " + lineNumber + ": " + line, e);
            }
            if (turns >= dist.length) {
                dist = Arrays.copyOf(dist, turns + 1);
            }
            dist[turns] = percent / 100.0;
        }
        addEntry(entries, positionId, dist);
        return entries;
    }

    private static void addEntry(List<GnubgDumpEntry> entries, String positionId, double[] dist) throws IOException {
        if (positionId == null) {
            return;
        }
        if (dist == null || dist.length == 0) {
            throw new IOException(String.format(Locale.ROOT, "No distribution found for position %s", positionId));
        }
        entries.add(new GnubgDumpEntry(positionId, new MoveCountDistribution(dist)));
    }
}
