package max.bgend.engine.movegen;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The dice to play on one turn. A double is played as four moves of the same value.
 * <p>
 * Probabilities are held in thirty-sixths so the 21 canonical rolls add up to exactly one.
 */
public final class Roll {
    public static final int DIE_FACES = 6;
    public static final int OUTCOMES = DIE_FACES * DIE_FACES;

    /** The 21 distinct rolls of two six-sided dice, low die first. */
    public static final List<Roll> ALL = generateRolls();

    private final int[] dice;
    private final int weight;

    private Roll(int[] dice, int weight) {
        this.dice = dice;
        this.weight = weight;
    }

    /**
     * A roll of two dice with its natural weight: 1/36 for a double (played four times), 2/36 otherwise.
     */
    public static Roll of(int firstDie, int secondDie) {
        checkDie(firstDie);
        checkDie(secondDie);
        if (firstDie == secondDie) {
            return new Roll(new int[] {firstDie, firstDie, firstDie, firstDie}, 1);
        }
        return new Roll(new int[] {firstDie, secondDie}, 2);
    }

    /**
     * Explicit dice with no probability attached, for playing out arbitrary sequences.
     */
    public static Roll ofDice(int... dice) {
        if (dice.length == 0) {
            throw new IllegalArgumentException("A roll needs at least one die");
        }
        return new Roll(dice.clone(), 0);
    }

    private static void checkDie(int die) {
        if (die < 1 || die > DIE_FACES) {
            throw new IllegalArgumentException("Die value out of range: " + die);
        }
    }

    private static List<Roll> generateRolls() {
        List<Roll> rolls = new ArrayList<>(21);
        for (int first = 1; first <= DIE_FACES; first++) {
            for (int second = first; second <= DIE_FACES; second++) {
                rolls.add(of(first, second));
            }
        }
        return Collections.unmodifiableList(rolls);
    }

    public int die(int index) {
        return dice[index];
    }

    public int numDice() {
        return dice.length;
    }

    public int[] dice() {
        return dice.clone();
    }

    public boolean isDouble() {
        return dice.length > 1 && dice[0] == dice[1];
    }

    /** Occurrences out of {@link #OUTCOMES}. */
    public int weight() {
        return weight;
    }

    public double probability() {
        return weight / (double) OUTCOMES;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        var that = (Roll) obj;
        return this.weight == that.weight && Arrays.equals(this.dice, that.dice);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(dice) + weight;
    }

    @Override
    public String toString() {
        return "Roll" + Arrays.toString(dice);
    }
}
