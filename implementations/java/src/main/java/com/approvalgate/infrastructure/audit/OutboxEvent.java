package com.approvalgate.infrastructure.audit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * Row in {@code audit.outbox_events}, drained by {@link OutboxPublisher}.
 */
@Entity
@Table(name = "outbox_events", schema = "audit")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OutboxEvent {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private AuditCategory category;

    @Column(nullable = false, length = 32)
    private String outcome;

    @Column(name = "tool_action", length = 64)
    private String toolAction;

    @Column(name = "resource_id")
    private String resourceId;

    @Column(nullable = false, name = "principal_id")
    private String principalId;

    @Column(name = "request_id")
    private UUID requestId;

    @Column(nullable = false, length = 1000)
    private String detail;

    @Column(nullable = false, name = "created_at")
    private Instant createdAt;

    @Column(nullable = false)
    private boolean processed;

    @Column(name = "published_at")
    private Instant publishedAt;

    static OutboxEvent of(AuditEvent event, Instant createdAt) {
        return OutboxEvent.builder()
                .category(event.getCategory())
                .outcome(event.getOutcome())
                .toolAction(event.getAction())
                .resourceId(event.getResourceId())
                .principalId(event.getPrincipalId() == null ? "anonymous" : event.getPrincipalId())
                .requestId(event.getRequestId())
                .detail(event.getDetail() == null ? "" : event.getDetail())
                .createdAt(createdAt)
                .processed(false)
                .build();
    }
}
