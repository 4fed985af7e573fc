package max.bgend.engine.tb.gnubg;

import max.bgend.engine.game.GameConfiguration;
import max.bgend.engine.game.board.Board;
import max.bgend.engine.utils.BitUtils;

import java.util.Base64;

/**
 * Translates gnubg's Base64 position ids (one side only) to boards.
 * <p>
 * gnubg encodes a side like we do, little-endian over 10 bytes, except that markers already off have no bits: the
 * string starts with the markers of the 1 point. The missing markers are counted from the population count and
 * written back in front, followed by the separator that closes the off pile.
 *
 * @see <a href="https://www.gnu.org/software/gnubg/manual/html_node/A-technical-description-of-the-Position-ID.html">
 * gnubg position id</a>
 */
public final class GnubgPositionId {
    public static final int ID_BYTES = 10;

    private GnubgPositionId() {}

    public static Board toBoard(GameConfiguration config, String positionId) {
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(positionId.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Position id '" + positionId + "' is not Base64", e);
        }
        long posId = 0;
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] == 0) {
                continue;
            }
            if (i >= Long.BYTES) {
                throw new IllegalArgumentException("Position id '" + positionId + "' does not fit " + config);
            }
            posId |= (bytes[i] & 0xFFL) << (8 * i);
        }

        int missingMarkers = config.numMarkers() - BitUtils.bitCount(posId);
        if (missingMarkers < 0) {
            throw new IllegalArgumentException("Position id '" + positionId + "' has more than "
                + config.numMarkers() + " markers");
        }
        int usedBits = Long.SIZE - Long.numberOfLeadingZeros(posId);
        if (usedBits + missingMarkers + 1 > config.idBits()) {
            throw new IllegalArgumentException("Position id '" + positionId + "' does not fit " + config);
        }
        long id = (posId << (missingMarkers + 1)) | BitUtils.lowMask(missingMarkers);
        return Board.fromId(config, id);
    }

    public static String fromBoard(Board board) {
        long posId = board.getId() >>> (board.spotCount(0) + 1);
        byte[] bytes = new byte[ID_BYTES];
        for (int i = 0; i < Long.BYTES; i++) {
            bytes[i] = (byte) (posId >>> (8 * i));
        }
        return Base64.getEncoder().withoutPadding().encodeToString(bytes);
    }
}
