package max.bgend.engine.tb;

import java.util.Arrays;
import java.util.Locale;

/**
 * Probability distribution over the number of turns still needed to bear off: entry {@code i} is the probability of
 * finishing in exactly {@code i} more turns.
 * <p>
 * Immutable; arithmetic returns new instances. Sums and differences are taken after padding the shorter operand with
 * trailing zeros.
 */
public final class MoveCountDistribution {
    public static final double NORMALIZATION_TOLERANCE = 1e-6;

    private static final MoveCountDistribution FINISHED = new MoveCountDistribution(1.0);
    private static final MoveCountDistribution ZERO = new MoveCountDistribution(0.0);

    private final double[] dist;

    /** The already finished distribution, all the mass at 0 turns. */
    public MoveCountDistribution() {
        this(1.0);
    }

    public MoveCountDistribution(double... dist) {
        if (dist.length == 0) {
            throw new IllegalArgumentException("A distribution needs at least one entry");
        }
        this.dist = dist.clone();
    }

    public static MoveCountDistribution finished() {
        return FINISHED;
    }

    public static MoveCountDistribution zero() {
        return ZERO;
    }

    public MoveCountDistribution plus(MoveCountDistribution other) {
        double[] sum = Arrays.copyOf(dist, Math.max(dist.length, other.dist.length));
        for (int i = 0; i < other.dist.length; i++) {
            sum[i] += other.dist[i];
        }
        return wrap(sum);
    }

    public MoveCountDistribution minus(MoveCountDistribution other) {
        double[] difference = Arrays.copyOf(dist, Math.max(dist.length, other.dist.length));
        for (int i = 0; i < other.dist.length; i++) {
            difference[i] -= other.dist[i];
        }
        return wrap(difference);
    }

    public MoveCountDistribution times(double scalar) {
        double[] product = new double[dist.length];
        for (int i = 0; i < dist.length; i++) {
            product[i] = dist[i] * scalar;
        }
        return wrap(product);
    }

    public MoveCountDistribution dividedBy(double scalar) {
        double[] quotient = new double[dist.length];
        for (int i = 0; i < dist.length; i++) {
            quotient[i] = dist[i] / scalar;
        }
        return wrap(quotient);
    }

    /**
     * Shifts the whole distribution by {@code amount} turns: it takes that many more turns to finish from here.
     */
    public MoveCountDistribution increaseCounts(int amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Cannot decrease counts: " + amount);
        }
        double[] shifted = new double[dist.length + amount];
        System.arraycopy(dist, 0, shifted, amount, dist.length);
        return wrap(shifted);
    }

    public MoveCountDistribution append(double... values) {
        double[] appended = Arrays.copyOf(dist, dist.length + values.length);
        System.arraycopy(values, 0, appended, dist.length, values.length);
        return wrap(appended);
    }

    public double sum() {
        double sum = 0;
        for (double p : dist) {
            sum += p;
        }
        return sum;
    }

    public boolean isNormalized() {
        return Math.abs(sum() - 1.0) <= NORMALIZATION_TOLERANCE;
    }

    public double expectedValue() {
        double expected = 0;
        for (int i = 1; i < dist.length; i++) {
            expected += i * dist[i];
        }
        return expected;
    }

    public int size() {
        return dist.length;
    }

    public double get(int turns) {
        return turns < dist.length ? dist[turns] : 0.0;
    }

    public double[] toArray() {
        return dist.clone();
    }

    private static MoveCountDistribution wrap(double[] owned) {
        return new MoveCountDistribution(owned, true);
    }

    // Takes ownership of the array
    private MoveCountDistribution(double[] dist, boolean owned) {
        this.dist = dist;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof MoveCountDistribution)) return false;
        return Arrays.equals(dist, ((MoveCountDistribution) obj).dist);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(dist);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "MCD(%f, %s)", expectedValue(), Arrays.toString(dist));
    }
}
