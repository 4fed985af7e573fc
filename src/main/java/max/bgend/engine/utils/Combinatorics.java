package max.bgend.engine.utils;

import java.math.BigInteger;

public final class Combinatorics {
    private Combinatorics() {}

    /**
     * Binomial coefficient C(n, k). Intermediate values are kept in a {@link BigInteger} so that the result is exact
     * for any n that still yields a long.
     *
     * @throws ArithmeticException if the result does not fit in a long
     */
    public static long binomial(int n, int k) {
        if (k < 0 || k > n) {
            return 0;
        }
        k = Math.min(k, n - k);
        BigInteger result = BigInteger.ONE;
        for (int i = 1; i <= k; i++) {
            result = result.multiply(BigInteger.valueOf(n - k + i)).divide(BigInteger.valueOf(i));
        }
        return result.longValueExact();
    }
}
