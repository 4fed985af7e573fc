package max.bgend.engine.game.board;

import max.bgend.engine.game.GameConfiguration;
import max.bgend.engine.game.InvalidBoardIdException;
import max.bgend.engine.movegen.InvalidMoveException;
import max.bgend.engine.movegen.Move;
import max.bgend.engine.movegen.MoveGenerator;
import max.bgend.engine.movegen.Roll;
import max.bgend.engine.utils.BitUtils;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * A bearoff position: how many markers sit on each spot. Spot 0 is the off pile, spots 1..M count the distance from
 * home.
 * <p>
 * Boards are values: every operation that changes the position returns a new board. The configuration is shared,
 * never copied.
 */
public final class Board {
    private final GameConfiguration config;
    private final int[] spotCounts;

    public Board(GameConfiguration config, int... spotCounts) {
        this.config = config;
        if (spotCounts.length != config.numSpots() + 1) {
            throw new InvalidSpotCountsException("Bad size for " + Arrays.toString(spotCounts) + ", expected "
                + (config.numSpots() + 1));
        }
        int total = 0;
        for (int count : spotCounts) {
            if (count < 0) {
                throw new InvalidSpotCountsException("Negative count in " + Arrays.toString(spotCounts));
            }
            total += count;
        }
        if (total != config.numMarkers()) {
            throw new InvalidSpotCountsException("Total markers " + total + " in " + Arrays.toString(spotCounts)
                + " not expected number " + config.numMarkers());
        }
        this.spotCounts = spotCounts.clone();
    }

    // No checks, the array is owned by the new board
    private Board(int[] spotCounts, GameConfiguration config) {
        this.config = config;
        this.spotCounts = spotCounts;
    }

    public static Board fromId(GameConfiguration config, long id) {
        if (!config.isValidId(id)) {
            throw new InvalidBoardIdException(id, config);
        }
        int[] spotCounts = new int[config.numSpots() + 1];
        int currentSpot = 0;
        int currentSpotCount = 0;
        for (int i = 0; i < config.idBits(); i++) {
            if ((id & BitUtils.getPositionIndexBitMask(i)) != 0) {
                currentSpotCount++;
            } else {
                // separator
                spotCounts[currentSpot++] = currentSpotCount;
                currentSpotCount = 0;
            }
        }
        spotCounts[currentSpot] = currentSpotCount;
        return new Board(spotCounts, config);
    }

    public long getId() {
        long id = 0;
        int bitIndex = 0;
        for (int count : spotCounts) {
            id |= BitUtils.lowMask(count) << bitIndex;
            bitIndex += count + 1;
        }
        return id;
    }

    public GameConfiguration config() {
        return config;
    }

    public int numSpots() {
        return config.numSpots();
    }

    public int spotCount(int spot) {
        return spotCounts[spot];
    }

    public int[] spotCounts() {
        return spotCounts.clone();
    }

    public boolean isFinished() {
        return spotCounts[0] == config.numMarkers();
    }

    public int totalPips() {
        int pips = 0;
        for (int spot = 1; spot < spotCounts.length; spot++) {
            pips += spot * spotCounts[spot];
        }
        return pips;
    }

    /**
     * The board whose id is {@code config().nextValidId(getId())}, built on the spot counts directly.
     * <p>
     * The lowest non-empty spot below the last one gives one marker to the next higher spot and sends the rest to the
     * off pile. When only the last spot holds markers this is the largest board and there is no successor.
     */
    public Optional<Board> nextValidBoard() {
        for (int spot = 0; spot < config.numSpots(); spot++) {
            int markers = spotCounts[spot];
            if (markers == 0) {
                continue;
            }
            int[] next = spotCounts.clone();
            next[spot + 1]++;
            next[spot] = 0;
            next[0] = markers - 1;
            return Optional.of(new Board(next, config));
        }
        return Optional.empty();
    }

    public Board applyMove(Move move) {
        int spot = move.spot();
        if (spot < 1 || spot > config.numSpots()) {
            throw new InvalidMoveException("Invalid spot for " + move + " on " + this, move);
        }
        if (spotCounts[spot] < 1) {
            throw new InvalidMoveException("No marker for " + move + " on " + this, move);
        }
        if (move.count() < 1) {
            throw new InvalidMoveException("Invalid count for " + move + " on " + this, move);
        }
        int[] next = spotCounts.clone();
        next[spot]--;
        if (move.overflows()) {
            // Bearing off with a larger die is only allowed from the farthest occupied spot
            for (int higher = spot + 1; higher <= config.numSpots(); higher++) {
                if (next[higher] != 0) {
                    throw new InvalidMoveException("Overflow count " + move + " blocked when spot " + higher
                        + " still has markers on " + this, move);
                }
            }
            next[0]++;
        } else {
            next[spot - move.count()]++;
        }
        return new Board(next, config);
    }

    public Board applyMoves(List<Move> moves) {
        Board board = this;
        for (Move move : moves) {
            board = board.applyMove(move);
        }
        return board;
    }

    public List<List<Move>> generateMoves(Roll roll) {
        return MoveGenerator.generateMoves(this, roll);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof Board)) return false;
        Board that = (Board) obj;
        return config.equals(that.config) && Arrays.equals(spotCounts, that.spotCounts);
    }

    @Override
    public int hashCode() {
        return 31 * config.hashCode() + Arrays.hashCode(spotCounts);
    }

    @Override
    public String toString() {
        return "Board" + Arrays.toString(spotCounts);
    }
}
