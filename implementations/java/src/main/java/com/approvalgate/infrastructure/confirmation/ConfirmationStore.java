package com.approvalgate.infrastructure.confirmation;

import com.approvalgate.domain.model.PendingConfirmation;

import java.time.Duration;
import java.util.Optional;

/**
 * Time-bounded staging area for proposals awaiting human approval.
 *
 * <p>Keyed by confirmation id. Entries expire on their own after the TTL given
 * to {@link #put}; there is no renewal. An expired entry is indistinguishable
 * from one that never existed.
 *
 * <p>Every method throws {@link ConfirmationStoreException} when the backing
 * store cannot be reached; callers must fail closed.
 */
public interface ConfirmationStore {

    void put(PendingConfirmation confirmation, Duration ttl);

    Optional<PendingConfirmation> get(String confirmationId);

    /**
     * Atomically read and remove an entry. Of two concurrent callers at most one
     * receives the confirmation.
     */
    Optional<PendingConfirmation> take(String confirmationId);

    void remove(String confirmationId);
}
