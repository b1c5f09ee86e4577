package com.approvalgate.infrastructure.persistence;

import com.approvalgate.config.SessionProperties;
import com.approvalgate.infrastructure.security.CallerContext;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Function;

/**
 * Binds a caller's identity into the database session for PostgreSQL Row-Level
 * Security.
 *
 * <p>Each unit of work gets a fresh transaction. The {@code app.*} variables are
 * set with {@code set_config(name, value, true)}, which scopes them to that
 * transaction exactly like {@code SET LOCAL}; on commit or rollback they are
 * discarded, so the next borrower of the pooled connection never sees them.
 * The transaction manager returns the connection to the pool on every exit path.
 *
 * <p>Variables bound:
 * <ul>
 *   <li>{@code app.current_user_id}</li>
 *   <li>{@code app.current_user_email}</li>
 *   <li>{@code app.current_user_roles} (comma-separated)</li>
 *   <li>{@code app.current_department_id}</li>
 *   <li>{@code app.current_manager_id}</li>
 * </ul>
 */
@Component
@Slf4j
public class RlsSessionBinder {

    private final EntityManager entityManager;
    private final TransactionTemplate transactionTemplate;
    private final String variablePrefix;

    public RlsSessionBinder(EntityManager entityManager,
                            PlatformTransactionManager transactionManager,
                            SessionProperties properties) {
        this.entityManager = entityManager;
        this.variablePrefix = properties.getVariablePrefix();

        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        template.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        template.setTimeout((int) Math.max(1, properties.getTransactionTimeout().toSeconds()));
        this.transactionTemplate = template;
    }

    /**
     * Run {@code work} in a new transaction with the caller's identity bound.
     * Commits when {@code work} returns, rolls back when anything throws.
     */
    public <T> T withCallerContext(CallerContext context, Function<EntityManager, T> work) {
        return transactionTemplate.execute(status -> {
            bind(context);
            return work.apply(entityManager);
        });
    }

    void bind(CallerContext context) {
        try {
            setLocal("current_user_id", context.getUserId());
            setLocal("current_user_email", context.getEmail());
            setLocal("current_user_roles", context.rolesAsCsv());
            setLocal("current_department_id", context.getDepartmentId());
            setLocal("current_manager_id", context.getManagerId());
        } catch (PersistenceException | DataAccessException e) {
            log.error("Failed to bind RLS context: user={}, requestId={}",
                context.getUserId(), context.getRequestId(), e);
            throw new RlsBindingException("Could not bind caller context to database session", e);
        }

        if (log.isDebugEnabled()) {
            log.debug("RLS context bound: user={}, roles={}", context.getUserId(), context.rolesAsCsv());
        }
    }

    // SET LOCAL takes no bind parameters; set_config(..., true) is its parameterised equivalent
    private void setLocal(String name, String value) {
        entityManager.createNativeQuery("SELECT set_config(:name, :value, true)")
            .setParameter("name", variablePrefix + name)
            .setParameter("value", value == null ? "" : value)
            .getSingleResult();
    }
}
