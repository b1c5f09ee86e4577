package com.approvalgate.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.context.annotation.Configuration;
import org.springframework.stereotype.Component;

/**
 * Performance Monitoring Configuration.
 *
 * Tracks:
 * - Entity repository latency (RLS binding included)
 * - Authorization guard latency and outcome
 * - Confirmation store latency and failures
 * - Proposal, execution and cancellation counts
 *
 * Security: no caller identity, entity ids or user-supplied text in metric tags.
 */
@Configuration
@Slf4j
public class PerformanceConfiguration {

    /**
     * Aspect for timing repository operations.
     */
    @Aspect
    @Component
    @Slf4j
    public static class RepositoryPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public RepositoryPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.approvalgate.domain.repository.MutableEntityRepository.*(..))")
        public Object timeRepositoryMethod(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, "repository.operation", "Entity repository operation timing",
                joinPoint, "success", "failure");
        }
    }

    /**
     * Aspect for timing authorization checks.
     */
    @Aspect
    @Component
    @Slf4j
    public static class SecurityPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public SecurityPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.approvalgate.infrastructure.security.AuthorizationGuard.authorize(..))")
        public Object timeSecurityCheck(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, "security.authorization", "Authorization check timing",
                joinPoint, "granted", "denied");
        }
    }

    /**
     * Aspect for timing confirmation store access.
     */
    @Aspect
    @Component
    @Slf4j
    public static class ConfirmationStorePerformanceAspect {

        private final MeterRegistry meterRegistry;

        public ConfirmationStorePerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.approvalgate.infrastructure.confirmation.ConfirmationStore.*(..))")
        public Object timeStoreOperation(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, "confirmation.store.operation", "Confirmation store operation timing",
                joinPoint, "success", "failure");
        }
    }

    private static Object timed(MeterRegistry meterRegistry, String name, String description,
                                ProceedingJoinPoint joinPoint, String successOutcome,
                                String failureOutcome) throws Throwable {
        String methodName = joinPoint.getSignature().toShortString();

        Timer.Sample sample = Timer.start(meterRegistry);

        try {
            Object result = joinPoint.proceed();

            sample.stop(Timer.builder(name)
                .tag("method", methodName)
                .tag("outcome", successOutcome)
                .description(description)
                .register(meterRegistry));

            return result;

        } catch (Exception e) {
            sample.stop(Timer.builder(name)
                .tag("method", methodName)
                .tag("outcome", failureOutcome)
                .description(description)
                .register(meterRegistry));

            throw e;
        }
    }

    /**
     * Custom metrics for business operations.
     */
    @Component
    @Slf4j
    public static class BusinessMetrics {

        private final MeterRegistry meterRegistry;

        public BusinessMetrics(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            log.info("Initialized business metrics");
        }

        /**
         * Record a proposal staged for approval.
         */
        public void recordProposalStaged(String action) {
            meterRegistry.counter("business.confirmations.staged", "action", action).increment();
        }

        /**
         * Record an execution by outcome: success, not_found, rejected, failed.
         */
        public void recordExecution(String action, String outcome) {
            meterRegistry.counter("business.confirmations.executed",
                "action", action, "outcome", outcome).increment();
        }

        /**
         * Record a confirmation declined by the approver.
         */
        public void recordCancellation(String action) {
            meterRegistry.counter("business.confirmations.cancelled", "action", action).increment();
        }
    }
}
