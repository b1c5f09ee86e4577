package com.approvalgate;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

import java.time.Clock;

/**
 * Main application class for the approval gate.
 *
 * <p>State-changing operations requested by an AI agent or a UI (approve,
 * reject, pay, reimburse, delete) are never applied directly. They go through a
 * two-phase protocol:
 *
 * <ul>
 *   <li><strong>Propose</strong>: authorize, load the entity under Row-Level
 *       Security, check its status machine, stage a pending confirmation with a
 *       fixed TTL and return a human-readable summary</li>
 *   <li><strong>Execute</strong>: after a human approves, re-authorize and apply a
 *       single compare-and-swap write conditioned on the status seen at proposal
 *       time</li>
 * </ul>
 *
 * <p><strong>Deployment:</strong>
 * <ul>
 *   <li>PostgreSQL 15+ with RLS policies reading {@code app.*} session variables</li>
 *   <li>Redis for the shared confirmation store</li>
 *   <li>Behind the gateway that authenticates users and forwards identity</li>
 * </ul>
 *
 * @since 1.0.0
 */
@SpringBootApplication
@EnableTransactionManagement
@EnableScheduling
@EnableAspectJAutoProxy
@ConfigurationPropertiesScan
@Slf4j
public class ApprovalGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(ApprovalGateApplication.class, args);

        log.info("""
            ╔═══════════════════════════════════════════════════════════╗
            ║  Approval Gate                                            ║
            ║  Human-in-the-loop confirmation: ENABLED                  ║
            ║  Row-Level Security binding: TRANSACTION-SCOPED           ║
            ╚═══════════════════════════════════════════════════════════╝
            """);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
