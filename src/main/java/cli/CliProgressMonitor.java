package cli;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Progress / heartbeat logger for model runs.
 */
public final class CliProgressMonitor {

    private static final long HEARTBEAT_MS = 30_000L;

    private static final AtomicInteger currentIndex = new AtomicInteger(0);
    private static volatile String currentKey = "";

    private CliProgressMonitor() {
    }

    public static void setCurrent(String key, int index1Based) {
        currentKey = (key == null) ? "" : key;
        currentIndex.set(Math.max(0, index1Based));
    }

    /**
     * Starts a daemon heartbeat; interrupt the returned thread to stop it.
     */
    public static Thread startHeartbeat(int total) {
        Thread t = new Thread(() -> {
            try {
                while (!Thread.currentThread().isInterrupted()) {
                    Thread.sleep(HEARTBEAT_MS);
                    System.out.println("[HEARTBEAT] running... " + currentIndex.get() + "/" + total + " current=" + currentKey);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "model-run-heartbeat");
        t.setDaemon(true);
        t.start();
        return t;
    }

    public static void logProgress(int done, int total, long loopStartNs, String lastKey) {
        long elapsed = (System.nanoTime() - loopStartNs) / 1_000_000L;

        MemoryMXBean mem = ManagementFactory.getMemoryMXBean();
        MemoryUsage heap = mem.getHeapMemoryUsage();
        long usedMb = heap.getUsed() / (1024 * 1024);
        long maxMb = heap.getMax() / (1024 * 1024);

        System.out.printf("[PROGRESS] %d/%d elapsed=%dms heap=%d/%dMB last=%s%n",
                done, total, elapsed, usedMb, maxMb, lastKey);
    }
}
