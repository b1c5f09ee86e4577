package com.approvalgate.domain.repository;

import com.approvalgate.domain.model.EntitySnapshot;
import com.approvalgate.domain.model.EntityType;
import com.approvalgate.domain.model.MutationAction;
import com.approvalgate.domain.model.PendingConfirmation;
import com.approvalgate.infrastructure.security.CallerContext;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository port for row-level-secured records that move through a status machine.
 *
 * <p>Every call runs inside its own transaction with the caller's identity bound
 * for the database's row-level-security policies; rows the caller may not see
 * are indistinguishable from rows that do not exist.
 */
public interface MutableEntityRepository {

    /**
     * Load an entity as visible to the caller.
     */
    Optional<EntitySnapshot> findById(EntityType type, UUID id, CallerContext context);

    /**
     * Apply the action's transition with a single conditional statement that only
     * matches while the entity is still in the status captured at proposal time.
     *
     * @return the affected row's columns, or empty when no row matched (missing,
     *         hidden by RLS, or no longer in the captured status)
     */
    Optional<Map<String, Object>> applyTransition(MutationAction action, PendingConfirmation confirmation,
                                                  CallerContext context);
}
