package max.bgend.engine.tb;

/**
 * A freshly computed distribution does not sum to one. This is a defect in move generation or in the store, never a
 * condition to recover from: the sweep is aborted.
 */
public class UnnormalizedDistributionException extends IllegalStateException {
    private final long boardId;
    private final MoveCountDistribution distribution;

    public UnnormalizedDistributionException(long boardId, MoveCountDistribution distribution) {
        super("Distribution for board " + boardId + " is not normalized (sum " + distribution.sum() + "): "
            + distribution);
        this.boardId = boardId;
        this.distribution = distribution;
    }

    public long boardId() {
        return boardId;
    }

    public MoveCountDistribution distribution() {
        return distribution;
    }
}
