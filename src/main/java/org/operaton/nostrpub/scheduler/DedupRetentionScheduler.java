package org.operaton.nostrpub.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.nostrpub.service.DedupIndex;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduler for pruning the dedup index.
 * Runs hourly and deletes ids first seen before the retention window.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DedupRetentionScheduler {

    private final DedupIndex dedupIndex;

    @Scheduled(cron = "0 15 * * * *")
    public void purgeExpiredIds() {
        log.debug("Starting scheduled purge of expired dedup entries");

        try {
            int deletedCount = dedupIndex.purgeExpired();

            if (deletedCount > 0) {
                log.info("Dedup purge completed. Deleted {} entries", deletedCount);
            } else {
                log.debug("Dedup purge completed. No entries to delete");
            }

        } catch (Exception e) {
            log.error("Dedup purge failed", e);
        }
    }
}
