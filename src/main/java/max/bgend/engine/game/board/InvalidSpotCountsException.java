package max.bgend.engine.game.board;

public class InvalidSpotCountsException extends IllegalArgumentException {
    public InvalidSpotCountsException(String message) {
        super(message);
    }
}
