package net.spookly.hostpilot.availability;

/**
 * Fixed-capacity ring of recent probe outcomes for one host.
 *
 * <p>Starts full of successes. Not thread-safe: the owning scorer serializes access.
 */
public final class SlidingWindow {
    private final boolean[] items;
    private int head;
    private int failureCount;

    public SlidingWindow(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("window size must be at least 1");
        }
        this.items = new boolean[size];
        for (int i = 0; i < size; i++) {
            items[i] = true;
        }
        this.head = 0;
    }

    /**
     * Record one outcome, evicting the oldest.
     */
    public void put(boolean success) {
        boolean evicted = items[head];
        if (!evicted) {
            failureCount--;
        }
        if (!success) {
            failureCount++;
        }
        items[head] = success;
        head = (head + 1) % items.length;
    }

    public double failureRate() {
        return (double) failureCount / items.length;
    }

    public int failureCount() {
        return failureCount;
    }

    public int size() {
        return items.length;
    }

    @Override
    public String toString() {
        return "SlidingWindow{size=" + items.length + ", failures=" + failureCount + "}";
    }
}
