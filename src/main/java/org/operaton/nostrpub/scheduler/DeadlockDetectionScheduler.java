package org.operaton.nostrpub.scheduler;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.lang.management.ManagementFactory;
import java.lang.management.ThreadInfo;
import java.lang.management.ThreadMXBean;

/**
 * Logs threads stuck in a lock cycle. The keyed locks are plain {@code ReentrantLock}s,
 * so the JVM can see them.
 */
@Component
@Slf4j
public class DeadlockDetectionScheduler {

    private final ThreadMXBean threads = ManagementFactory.getThreadMXBean();

    @Scheduled(fixedDelayString = "PT2M", initialDelayString = "PT2M")
    public void detectDeadlocks() {
        long[] deadlocked = threads.findDeadlockedThreads();
        if (deadlocked == null) {
            return;
        }
        for (ThreadInfo info : threads.getThreadInfo(deadlocked, true, true)) {
            if (info != null) {
                log.error("Deadlocked thread {} waiting for {} held by {}",
                    info.getThreadName(), info.getLockName(), info.getLockOwnerName());
            }
        }
    }
}
