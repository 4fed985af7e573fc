package max.bgend.engine.movegen;

/**
 * A single marker move: the marker leaves {@code spot} and travels {@code count} pips toward home.
 */
public record Move(int spot, int count) {

    // Where the marker lands, 0 for the off pile
    public int destination() {
        return Math.max(spot - count, 0);
    }

    public boolean overflows() {
        return count > spot;
    }

    @Override
    public String toString() {
        return "[" + spot + ", " + count + "]";
    }
}
