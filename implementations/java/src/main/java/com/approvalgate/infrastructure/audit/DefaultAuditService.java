package com.approvalgate.infrastructure.audit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Logs each event and appends it to the audit outbox in its own transaction,
 * independent of the RLS-bound unit of work that produced it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DefaultAuditService implements AuditService {

    private final OutboxEventRepository outbox;
    private final Clock clock;

    @Override
    public void record(AuditEvent event) {
        log.info("AUDIT: category={} outcome={} action={} resourceId={} principal={} requestId={} detail={}",
                event.getCategory(), event.getOutcome(), event.getAction(), event.getResourceId(),
                event.getPrincipalId(), event.getRequestId(), event.getDetail());
        try {
            outbox.save(OutboxEvent.of(event, Instant.now(clock)));
        } catch (RuntimeException e) {
            // the log line above is the record of last resort
            log.warn("Audit outbox write failed: category={} outcome={} action={}: {}",
                    event.getCategory(), event.getOutcome(), event.getAction(), e.getMessage());
        }
    }
}
