package max.bgend.engine.tb;

import java.nio.file.Path;
import java.util.Objects;

public final class ComputeConfig {

    // Print a progress line every this many boards, 0 for none
    public final long progressInterval;
    // Stop after this many boards, <= 0 for the whole id space. A limited store is for diagnostics only
    public final long limit;
    // Where the CLI writes store files
    public final Path outputDirectory;

    private ComputeConfig(Builder b) {
        progressInterval = b.progressInterval;
        limit = b.limit;
        outputDirectory = b.outputDirectory;
    }

    public static ComputeConfig defaults() {
        return new Builder().build();
    }

    public boolean isLimited() {
        return limit > 0;
    }

    public Path storeFile(int numMarkers, int numSpots) {
        return outputDirectory.resolve(storeFileName(numMarkers, numSpots));
    }

    public static String storeFileName(int numMarkers, int numSpots) {
        return "bgend_store_" + numMarkers + "_" + numSpots + ".bin";
    }

    // Stopped sweeps never share a name with a complete store
    public Path partialStoreFile(int numMarkers, int numSpots) {
        return outputDirectory.resolve(partialStoreFileName(numMarkers, numSpots));
    }

    public static String partialStoreFileName(int numMarkers, int numSpots) {
        return "bgend_store_" + numMarkers + "_" + numSpots + ".partial.bin";
    }

    @Override
    public String toString() {
        return "ComputeConfig[progressInterval=" + progressInterval + ", limit=" + limit + ", outputDirectory="
            + outputDirectory + ']';
    }

    public static final class Builder {
        private long progressInterval = 500;
        private long limit = -1;
        private Path outputDirectory = Path.of("data");

        public Builder progressInterval(long v) {
            if (v < 0) throw new IllegalArgumentException("progressInterval must be >= 0, got " + v);
            progressInterval = v;
            return this;
        }

        public Builder limit(long v) {
            limit = v;
            return this;
        }

        public Builder outputDirectory(Path v) {
            outputDirectory = Objects.requireNonNull(v);
            return this;
        }

        public ComputeConfig build() {
            return new ComputeConfig(this);
        }
    }
}
