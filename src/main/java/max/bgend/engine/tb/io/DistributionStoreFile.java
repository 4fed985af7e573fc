package max.bgend.engine.tb.io;

import it.unimi.dsi.fastutil.longs.LongList;
import max.bgend.engine.game.GameConfiguration;
import max.bgend.engine.tb.DistributionStore;
import max.bgend.engine.tb.MoveCountDistribution;

import java.io.BufferedOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Binary store format, big-endian:
 * <pre>
 *   int    magic "BGEN"
 *   short  version
 *   int    number of markers
 *   int    number of spots
 *   int    number of entries
 *   entries, ascending by board id:
 *     long    board id
 *     int     distribution length
 *     double* distribution
 * </pre>
 */
public final class DistributionStoreFile {
    public static final int MAGIC = 0x4247454E;
    public static final short VERSION = 1;

    private static final int HEADER_BYTES = 4 + 2 + 4 + 4 + 4;

    private DistributionStoreFile() {}

    public static void save(DistributionStore store, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = Files.newOutputStream(file)) {
            save(store, out);
        }
    }

    public static void save(DistributionStore store, OutputStream out) throws IOException {
        // DataOutputStream is big-endian, like the reader
        DataOutputStream data = new DataOutputStream(new BufferedOutputStream(out));
        GameConfiguration config = store.config();
        LongList ids = store.boardIds();
        data.writeInt(MAGIC);
        data.writeShort(VERSION);
        data.writeInt(config.numMarkers());
        data.writeInt(config.numSpots());
        data.writeInt(ids.size());
        for (int i = 0; i < ids.size(); i++) {
            long id = ids.getLong(i);
            double[] dist = store.probe(id).orElseThrow().toArray();
            data.writeLong(id);
            data.writeInt(dist.length);
            for (double p : dist) {
                data.writeDouble(p);
            }
        }
        data.flush();
    }

    /** Filesystem-backed, memory-mapped while reading. */
    public static DistributionStore load(Path file) throws IOException {
        try (FileChannel ch = FileChannel.open(file)) {
            ByteBuffer buf = ch.map(FileChannel.MapMode.READ_ONLY, 0, ch.size());
            return read(buf, file.toString());
        }
    }

    public static DistributionStore load(InputStream in) throws IOException {
        return read(ByteBuffer.wrap(in.readAllBytes()), "stream");
    }

    private static DistributionStore read(ByteBuffer buf, String source) throws IOException {
        buf.order(ByteOrder.BIG_ENDIAN);
        if (buf.remaining() < HEADER_BYTES) {
            throw new IOException("Invalid bearoff store " + source + ": " + buf.remaining() + " bytes");
        }
        int magic = buf.getInt();
        if (magic != MAGIC) {
            throw new IOException("Invalid bearoff store " + source + ": bad magic 0x" + Integer.toHexString(magic));
        }
        short version = buf.getShort();
        if (version != VERSION) {
            throw new IOException("Unsupported bearoff store version " + version + " in " + source);
        }
        GameConfiguration config;
        try {
            config = new GameConfiguration(buf.getInt(), buf.getInt());
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid configuration in " + source, e);
        }
        int entries = buf.getInt();
        if (entries < 0 || entries > config.numValidBoards()) {
            throw new IOException("Invalid entry count " + entries + " for " + config + " in " + source);
        }

        DistributionStore store = new DistributionStore(config);
        try {
            for (int i = 0; i < entries; i++) {
                long id = buf.getLong();
                int length = buf.getInt();
                if (!config.isValidId(id)) {
                    throw new IOException("Invalid board id " + id + " for " + config + " in " + source);
                }
                if (length < 1) {
                    throw new IOException("Invalid distribution length " + length + " for board " + id + " in "
                        + source);
                }
                double[] dist = new double[length];
                for (int j = 0; j < length; j++) {
                    dist[j] = buf.getDouble();
                }
                store.put(id, new MoveCountDistribution(dist));
            }
        } catch (BufferUnderflowException e) {
            throw new IOException("Truncated bearoff store " + source, e);
        }
        return store;
    }
}
