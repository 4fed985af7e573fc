package max.bgend.engine.utils.notations;

import max.bgend.engine.game.board.Board;
import max.bgend.engine.movegen.Move;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class BoardIOUtils {

    public static String prettyString(Board board) {
        return prettyString(board, Collections.emptyList());
    }

    /**
     * One line per spot, spot 0 first: the spot, its count and one 'o' per marker. Each move then adds a column,
     * drawn from the farthest spot down to spot 0:
     * <pre>
     *   "c "  at the source spot, c being the die value
     *   "| "  on the spots travelled through
     *   "x "  at the landing spot
     *   "+ "  at the off pile when the die overshoots
     * </pre>
     */
    public static String prettyString(Board board, List<Move> moves) {
        int numSpots = board.numSpots();
        int maxCount = 0;
        for (int spot = 0; spot <= numSpots; spot++) {
            maxCount = Math.max(maxCount, board.spotCount(spot));
        }

        List<StringBuilder> lines = new ArrayList<>(numSpots + 1);
        for (int spot = 0; spot <= numSpots; spot++) {
            StringBuilder line = new StringBuilder();
            int count = board.spotCount(spot);
            line.append(spot).append(' ').append(count).append(' ');
            line.append("o".repeat(count));
            line.append(" ".repeat(maxCount + 1 - count));
            lines.add(line);
        }

        for (Move move : moves) {
            int moveEnd = move.destination();
            for (int spot = numSpots; spot >= 0; spot--) {
                String column;
                if (spot > move.spot()) {
                    column = "  ";
                } else if (spot == move.spot()) {
                    column = move.count() + " ";
                } else if (spot > moveEnd) {
                    column = "| ";
                } else if (spot == move.spot() - move.count()) {
                    column = "x ";
                } else if (spot == moveEnd) {
                    column = "+ ";
                } else {
                    column = "  ";
                }
                lines.get(spot).append(column);
            }
        }

        StringBuilder out = new StringBuilder();
        for (StringBuilder line : lines) {
            out.append(line).append('\n');
        }
        return out.toString();
    }

    /** Writes moves as {@code [[6, 2], [5, 3]]}. */
    public static String encodeMoves(List<Move> moves) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < moves.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            Move move = moves.get(i);
            sb.append('[').append(move.spot()).append(", ").append(move.count()).append(']');
        }
        return sb.append(']').toString();
    }

    public static List<Move> decodeMoves(String encoded) {
        String s = encoded.replaceAll("\\s+", "");
        if (s.length() < 2 || s.charAt(0) != '[' || s.charAt(s.length() - 1) != ']') {
            throw new IllegalArgumentException("Cannot parse moves '" + encoded + "'");
        }
        String body = s.substring(1, s.length() - 1);
        List<Move> moves = new ArrayList<>();
        int i = 0;
        while (i < body.length()) {
            if (body.charAt(i) != '[') {
                throw new IllegalArgumentException("Bad element at " + i + " in '" + encoded + "'");
            }
            int close = body.indexOf(']', i);
            if (close < 0) {
                throw new IllegalArgumentException("Unclosed element in '" + encoded + "'");
            }
            String[] parts = body.substring(i + 1, close).split(",");
            if (parts.length != 2) {
                throw new IllegalArgumentException("Bad element [" + body.substring(i + 1, close) + "] in '"
                    + encoded + "'");
            }
            try {
                moves.add(new Move(Integer.parseInt(parts[0]), Integer.parseInt(parts[1])));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Bad number in '" + encoded + "'", e);
            }
            i = close + 1;
            if (i < body.length()) {
                if (body.charAt(i) != ',') {
                    throw new IllegalArgumentException("Expected ',' at " + i + " in '" + encoded + "'");
                }
                i++;
                if (i == body.length()) {
                    throw new IllegalArgumentException("Trailing ',' in '" + encoded + "'");
                }
            }
        }
        return moves;
    }
}
