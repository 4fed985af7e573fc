package max.bgend.engine.movegen;

public class InvalidMoveException extends IllegalArgumentException {
    private final Move move;

    public InvalidMoveException(String message, Move move) {
        super(message);
        this.move = move;
    }

    public Move move() {
        return move;
    }
}
