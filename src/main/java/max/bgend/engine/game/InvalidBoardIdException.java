package max.bgend.engine.game;

public class InvalidBoardIdException extends IllegalArgumentException {
    private final long boardId;

    public InvalidBoardIdException(long boardId, GameConfiguration config) {
        super(boardId + " is not a valid board id for " + config);
        this.boardId = boardId;
    }

    public long boardId() {
        return boardId;
    }
}
