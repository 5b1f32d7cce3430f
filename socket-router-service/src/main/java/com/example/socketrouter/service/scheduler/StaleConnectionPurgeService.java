package com.example.socketrouter.service.scheduler;

import com.example.socketrouter.shared.config.AppProperties;
import com.example.socketrouter.shared.service.sweep.StaleSweeper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@Slf4j
@RequiredArgsConstructor
public class StaleConnectionPurgeService {

    private final StaleSweeper staleSweeper;
    private final AppProperties appProperties;

    /**
     * Deletes connections that were pinged and never answered within the grace window.
     */
    @Scheduled(fixedDelayString = "${socket-router.sweep.interval:PT60S}",
               initialDelayString = "${socket-router.sweep.interval:PT60S}")
    public void purgeStaleConnections() {
        if (!appProperties.getSweep().isEnabled()) {
            log.trace("Stale connection purge is disabled.");
            return;
        }
        log.trace("Running stale connection purge job...");
        try {
            int purged = staleSweeper.purgeInactive();
            if (purged > 0) {
                log.warn("Purged {} stale connections older than {}.", purged, appProperties.getSweep().getGraceWindow());
            } else {
                log.trace("No stale connections found.");
            }
        } catch (Exception e) {
            log.error("Error during stale connection purge job", e);
        }
    }
}
