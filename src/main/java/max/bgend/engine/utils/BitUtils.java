package max.bgend.engine.utils;

public final class BitUtils {
    private BitUtils() {}

    /**
     * Returns the index of the first (<i>rightmost</i>) bit set to 1 in the id provided in input. The bit is the
     * Least Significant 1-bit (LS1B).
     *
     * @param bits the bit string for which the LS1B is to be returned
     * @return the index of the first bit set to 1, 64 if no bit is set
     */
    public static int bitScanForward(long bits) {
        return Long.numberOfTrailingZeros(bits);
    }

    /**
     * Returns the index of the highest bit of the lowest contiguous run of 1-bits.
     * For {@code 0b0111000} this is 5.
     *
     * @param bits a bit string with at least one bit set
     * @return the index of the last 1 of the lowest block of 1s
     */
    public static int lowestBlockEnd(long bits) {
        int first = bitScanForward(bits);
        return first + Long.numberOfTrailingZeros(~(bits >>> first)) - 1;
    }

    public static long getPositionIndexBitMask(int positionIndex) {
        return 1L << positionIndex;
    }

    // Mask with the lowest `count` bits set, count in [0, 63]
    public static long lowMask(int count) {
        return (1L << count) - 1;
    }

    public static int bitCount(long bits) {
        return Long.bitCount(bits);
    }
}
