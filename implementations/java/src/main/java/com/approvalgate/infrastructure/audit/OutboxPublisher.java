package com.approvalgate.infrastructure.audit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Drains the audit outbox in id order, one batch per tick.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxEventRepository repository;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${approval-gate.audit.publish-interval:10000}")
    @Transactional
    public void publish() {
        List<OutboxEvent> batch = repository.findTop100ByProcessedFalseOrderByIdAsc();
        if (batch.isEmpty()) {
            return;
        }
        Instant now = Instant.now(clock);
        // published events go to the application log; the SIEM forwarder tails it
        for (OutboxEvent event : batch) {
            if (log.isInfoEnabled()) {
                log.info("OUTBOX publish id={} category={} outcome={} action={} resourceId={} principal={} requestId={}",
                        event.getId(), event.getCategory(), event.getOutcome(), event.getToolAction(),
                        event.getResourceId(), event.getPrincipalId(), event.getRequestId());
            }
            event.setProcessed(true);
            event.setPublishedAt(now);
        }
        repository.saveAll(batch);
        log.debug("Published {} outbox events", batch.size());
    }
}
