package max.bgend.engine.game;

import it.unimi.dsi.fastutil.longs.LongIterable;
import it.unimi.dsi.fastutil.longs.LongIterator;
import max.bgend.engine.utils.BitUtils;
import max.bgend.engine.utils.Combinatorics;

import java.util.NoSuchElementException;
import java.util.OptionalLong;

/**
 * Combinatorial parameters of a bearoff game and the bijection between board states and ids.
 * <p>
 * With N markers and M spots (not counting the off pile), a board is written as a bit string of N+M bits, reading from
 * bit 0 upward: a 1 for every marker already off, a 0 as separator, a 1 for every marker on spot 1, a 0, and so on up
 * to spot M which needs no trailing separator. This is the "stars and bars" encoding: exactly N bits are set, so there
 * are C(N+M, M) valid ids.
 * <p>
 * Every legal move brings a marker closer to home, which moves one of its 1s below a separator: the id can only
 * decrease. Sweeping ids in ascending order therefore always meets the successors of a board before the board itself.
 * <p>
 * Instances are immutable and shared by every {@code Board} and store built on them.
 */
public final class GameConfiguration {
    // Ids must stay positive longs, and nextValidId needs one spare bit above the top marker
    public static final int MAX_ID_BITS = 62;

    private final int numMarkers;
    private final int numSpots;
    private final long numValidBoards;
    private final long minBoardId;
    private final long maxBoardId;

    public GameConfiguration(int numMarkers, int numSpots) {
        if (numMarkers < 1) {
            throw new IllegalArgumentException("At least one marker is required, got " + numMarkers);
        }
        if (numSpots < 1) {
            throw new IllegalArgumentException("At least one spot is required, got " + numSpots);
        }
        if (numMarkers + numSpots > MAX_ID_BITS) {
            throw new IllegalArgumentException("Board ids of " + (numMarkers + numSpots) + " bits are not supported (max "
                + MAX_ID_BITS + ")");
        }
        this.numMarkers = numMarkers;
        this.numSpots = numSpots;
        this.numValidBoards = Combinatorics.binomial(numMarkers + numSpots, numSpots);
        this.minBoardId = BitUtils.lowMask(numMarkers);
        // exclusive: all markers on the last spot, plus one
        this.maxBoardId = (BitUtils.lowMask(numMarkers) << numSpots) + 1;
    }

    public int numMarkers() {
        return numMarkers;
    }

    public int numSpots() {
        return numSpots;
    }

    public int idBits() {
        return numMarkers + numSpots;
    }

    public long numValidBoards() {
        return numValidBoards;
    }

    /** The id of the board with every marker off. */
    public long minBoardId() {
        return minBoardId;
    }

    /** Exclusive upper bound of the id space. */
    public long maxBoardId() {
        return maxBoardId;
    }

    public boolean isValidId(long id) {
        return id >= minBoardId && id < maxBoardId && BitUtils.bitCount(id) == numMarkers;
    }

    /**
     * Computes the next larger valid id with bit manipulations only; the id-level twin of
     * {@code Board.nextValidBoard()}.
     * <p>
     * The last 1 of the lowest block of 1s is swapped with the 0 just above it, which puts one marker in the next
     * higher spot. The rest of that block is then packed down to bit 0, i.e. moved to the off pile.
     *
     * @return the next valid id, or empty if {@code id} is the largest valid id
     * @throws InvalidBoardIdException if {@code id} is not valid
     */
    public OptionalLong nextValidId(long id) {
        if (!isValidId(id)) {
            throw new InvalidBoardIdException(id, this);
        }
        if (id >= maxBoardId - 1) {
            return OptionalLong.empty();
        }
        int firstOne = BitUtils.bitScanForward(id);
        int blockEnd = BitUtils.lowestBlockEnd(id);

        long upperMask = -1L << blockEnd;
        long upper = (id & upperMask) ^ (3L << blockEnd);
        long lower = (id & ~upperMask) >>> firstOne;
        return OptionalLong.of(upper | lower);
    }

    /**
     * All valid ids in ascending order. Each call to {@code iterator()} restarts from {@link #minBoardId()}.
     */
    public LongIterable generateValidIds() {
        return ValidIdIterator::new;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof GameConfiguration)) return false;
        GameConfiguration that = (GameConfiguration) obj;
        return numMarkers == that.numMarkers && numSpots == that.numSpots;
    }

    @Override
    public int hashCode() {
        return 31 * numMarkers + numSpots;
    }

    @Override
    public String toString() {
        return "GameConfiguration[markers=" + numMarkers + ", spots=" + numSpots + ']';
    }

    private final class ValidIdIterator implements LongIterator {
        private long next = minBoardId;
        private boolean exhausted = false;

        @Override
        public boolean hasNext() {
            return !exhausted;
        }

        @Override
        public long nextLong() {
            if (exhausted) {
                throw new NoSuchElementException("No valid board id after " + (maxBoardId - 1));
            }
            long current = next;
            OptionalLong successor = nextValidId(current);
            if (successor.isPresent()) {
                next = successor.getAsLong();
            } else {
                exhausted = true;
            }
            return current;
        }
    }
}
