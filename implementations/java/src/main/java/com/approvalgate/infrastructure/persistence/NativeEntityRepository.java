package com.approvalgate.infrastructure.persistence;

import com.approvalgate.domain.model.ColumnAssignment;
import com.approvalgate.domain.model.EntitySnapshot;
import com.approvalgate.domain.model.EntityType;
import com.approvalgate.domain.model.MutationAction;
import com.approvalgate.domain.model.PendingConfirmation;
import com.approvalgate.domain.model.StatusTransition;
import com.approvalgate.domain.repository.MutableEntityRepository;
import com.approvalgate.infrastructure.security.CallerContext;
import jakarta.persistence.Query;
import jakarta.persistence.Tuple;
import jakarta.persistence.TupleElement;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Native-SQL access to the mutable business tables.
 *
 * <p>Table and column names come only from {@link EntityType} and
 * {@link MutationAction} constants; every value is a bind parameter.
 *
 * <p>Writes are single compare-and-swap statements:
 * <pre>
 *   UPDATE finance.expenses SET status = :toStatus, updated_at = NOW(), ...
 *   WHERE id = :id AND status = :expectedStatus
 *   RETURNING ...
 * </pre>
 * Two racing executions of the same confirmation cannot both match, since the
 * second sees the status the first wrote. No application-level locking is used.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class NativeEntityRepository implements MutableEntityRepository {

    private final RlsSessionBinder sessionBinder;

    @Override
    public Optional<EntitySnapshot> findById(EntityType type, UUID id, CallerContext context) {
        String sql = "SELECT " + String.join(", ", type.getColumns())
            + " FROM " + type.getTable()
            + " WHERE id = CAST(:id AS uuid)";

        Optional<Map<String, Object>> row = sessionBinder.withCallerContext(context, em -> {
            @SuppressWarnings("unchecked")
            List<Tuple> rows = em.createNativeQuery(sql, Tuple.class)
                .setParameter("id", id.toString())
                .getResultList();
            return rows.stream().findFirst().map(NativeEntityRepository::toRow);
        });

        if (log.isDebugEnabled()) {
            log.debug("Entity lookup: type={}, id={}, user={}, found={}",
                type, id, context.getUserId(), row.isPresent());
        }

        return row.map(columns -> new EntitySnapshot(type, id, (String) columns.get("status"), columns));
    }

    @Override
    public Optional<Map<String, Object>> applyTransition(MutationAction action, PendingConfirmation confirmation,
                                                         CallerContext context) {
        EntityType type = action.getEntityType();
        StatusTransition transition = action.getTransition();
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("id", confirmation.getTargetEntityId());
        parameters.put("expectedStatus", confirmation.getCapturedStatus());

        String sql;
        if (transition.isDeletion()) {
            sql = "DELETE FROM " + type.getTable()
                + " WHERE id = CAST(:id AS uuid) AND status = :expectedStatus"
                + " RETURNING " + String.join(", ", type.getColumns());
        } else {
            List<String> setClauses = new ArrayList<>();
            setClauses.add("status = :toStatus");
            setClauses.add("updated_at = NOW()");
            parameters.put("toStatus", transition.getToStatus());

            Map<String, String> supplied = confirmation.getUserSuppliedFields() == null
                ? Collections.emptyMap()
                : confirmation.getUserSuppliedFields();

            for (ColumnAssignment assignment : action.getAssignments()) {
                switch (assignment.getSource()) {
                    case CALLER_ID:
                        setClauses.add(assignment.getColumn() + " = :callerId");
                        parameters.put("callerId", context.getUserId());
                        break;
                    case CURRENT_TIMESTAMP:
                        setClauses.add(assignment.getColumn() + " = NOW()");
                        break;
                    case CURRENT_DATE:
                        setClauses.add(assignment.getColumn() + " = CURRENT_DATE");
                        break;
                    case INPUT_FIELD:
                        String value = supplied.get(assignment.getInputField());
                        // absent optional input leaves the column untouched
                        if (value != null) {
                            String parameter = "in_" + assignment.getInputField();
                            setClauses.add(assignment.getColumn() + " = :" + parameter);
                            parameters.put(parameter, value);
                        }
                        break;
                    default:
                        throw new IllegalStateException("Unhandled column source: " + assignment.getSource());
                }
            }

            sql = "UPDATE " + type.getTable()
                + " SET " + String.join(", ", setClauses)
                + " WHERE id = CAST(:id AS uuid) AND status = :expectedStatus"
                + " RETURNING " + String.join(", ", type.getColumns());
        }

        Optional<Map<String, Object>> row = sessionBinder.withCallerContext(context, em -> {
            Query query = em.createNativeQuery(sql, Tuple.class);
            parameters.forEach(query::setParameter);
            @SuppressWarnings("unchecked")
            List<Tuple> rows = query.getResultList();
            return rows.stream().findFirst().map(NativeEntityRepository::toRow);
        });

        if (row.isPresent()) {
            log.info("Guarded write applied: action={}, {}={}, from={}, to={}, user={}",
                action, type.getIdField(), confirmation.getTargetEntityId(),
                confirmation.getCapturedStatus(), transition.isDeletion() ? "(deleted)" : transition.getToStatus(),
                context.getUserId());
        } else {
            log.info("Guarded write matched no row: action={}, {}={}, expectedStatus={}, user={}",
                action, type.getIdField(), confirmation.getTargetEntityId(),
                confirmation.getCapturedStatus(), context.getUserId());
        }

        return row;
    }

    private static Map<String, Object> toRow(Tuple tuple) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (TupleElement<?> element : tuple.getElements()) {
            row.put(element.getAlias(), normalize(tuple.get(element)));
        }
        return row;
    }

    /**
     * Temporal and identifier values become strings so snapshots serialize
     * the same way in every store.
     */
    static Object normalize(Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toInstant().toString();
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate().toString();
        }
        return value.toString();
    }
}
