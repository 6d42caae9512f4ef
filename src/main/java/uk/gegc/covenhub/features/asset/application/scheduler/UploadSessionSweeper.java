package uk.gegc.covenhub.features.asset.application.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.covenhub.features.asset.application.UploadSessionRegistry;
import uk.gegc.covenhub.features.asset.config.AssetStorageProperties;
import uk.gegc.covenhub.features.asset.domain.model.UploadSession;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Expires idle uploading sessions (aborting their multipart uploads) and evicts
 * terminal sessions once the retention window has passed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UploadSessionSweeper {

    private final UploadSessionRegistry registry;
    private final AssetStorageProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${app.assets.chunked.sweep-interval-ms:60000}")
    public void sweep() {
        log.debug("Running scheduled sweep of {} upload sessions", registry.size());
        try {
            Instant now = clock.instant();
            Duration retention = properties.getChunked().getRetention();
            int expired = 0;
            int evicted = 0;
            for (UploadSession session : registry.sessions()) {
                if (registry.expireIfIdle(session)) {
                    expired++;
                } else if (isPastRetention(session, now, retention)) {
                    registry.remove(session.getUploadId());
                    evicted++;
                }
            }
            if (expired > 0 || evicted > 0) {
                log.info("Upload sweep expired {} and evicted {} sessions", expired, evicted);
            }
        } catch (Exception e) {
            log.error("Error during scheduled sweep of upload sessions", e);
        }
    }

    private boolean isPastRetention(UploadSession session, Instant now, Duration retention) {
        Instant terminalAt = session.getTerminalAt();
        return session.getStatus().isTerminal()
                && terminalAt != null
                && terminalAt.plus(retention).isBefore(now);
    }
}
