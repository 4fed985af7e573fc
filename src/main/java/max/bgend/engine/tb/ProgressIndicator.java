package max.bgend.engine.tb;

import java.util.Locale;
import java.util.function.Consumer;

/**
 * Counts completed units of work and reports every {@code interval} of them, with an estimate of the total time.
 */
public final class ProgressIndicator {
    private final long total;
    private final long interval;
    private final Consumer<String> out;
    private final long startNs;
    private long completed;

    public ProgressIndicator(long total, long interval, Consumer<String> out) {
        this(total, interval, out, 0);
    }

    public ProgressIndicator(long total, long interval, Consumer<String> out, long alreadyCompleted) {
        this.total = total;
        this.interval = interval;
        this.out = out;
        this.completed = alreadyCompleted;
        this.startNs = System.nanoTime();
    }

    public void completeOne() {
        completed++;
        if (interval > 0 && completed % interval == 0) {
            out.accept(report());
        }
    }

    public long completed() {
        return completed;
    }

    public double elapsedSeconds() {
        return (System.nanoTime() - startNs) / 1e9;
    }

    String report() {
        double fraction = total == 0 ? 1.0 : completed / (double) total;
        double elapsed = elapsedSeconds();
        return String.format(Locale.ROOT, "%d/%d %.1f%%, %fs elapsed, %fs estimated total",
            completed, total, fraction * 100, elapsed, elapsed / fraction);
    }
}
