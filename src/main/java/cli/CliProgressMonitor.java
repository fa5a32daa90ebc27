package cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;

/**
 * Progress logger for long CLI runs over many files.
 */
public final class CliProgressMonitor {

    private static final Logger log = LoggerFactory.getLogger(CliProgressMonitor.class);

    private CliProgressMonitor() {
    }

    public static boolean due(int done, int total, int logEvery) {
        return done == total || (logEvery > 0 && done % logEvery == 0);
    }

    public static void logProgress(int done, int total, int formatted, int failed,
                                   long loopStartNs, String lastFile) {
        long elapsed = (System.nanoTime() - loopStartNs) / 1_000_000L;

        MemoryMXBean mem = ManagementFactory.getMemoryMXBean();
        MemoryUsage heap = mem.getHeapMemoryUsage();
        long usedMb = heap.getUsed() / (1024 * 1024);
        long maxMb = heap.getMax() / (1024 * 1024);

        log.info("[PROGRESS] {}/{} ok={} failed={} elapsed={}ms heap={}/{}MB last={}",
                done, total, formatted, failed, elapsed, usedMb, maxMb, lastFile);
    }
}
