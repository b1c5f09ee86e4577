package com.approvalgate.application;

import com.approvalgate.domain.model.InputField;
import com.approvalgate.domain.model.MutationAction;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Tool input checked against the action's declared fields.
 */
@Value
public class ActionInput {

    UUID entityId;

    /** Supplied text fields only; absent optional fields are omitted. */
    Map<String, String> userSuppliedFields;

    /**
     * @throws InvalidActionInputException on a missing, malformed or out-of-bounds field
     */
    public static ActionInput parse(MutationAction action, Map<String, Object> raw) {
        Map<String, Object> input = raw == null ? Collections.emptyMap() : raw;
        UUID entityId = null;
        Map<String, String> fields = new LinkedHashMap<>();

        for (InputField field : action.getInputFields()) {
            Object value = input.get(field.getName());
            if (value == null || value.toString().isBlank()) {
                if (field.isRequired()) {
                    throw new InvalidActionInputException(field.getName(), field.getName() + " is required");
                }
                continue;
            }
            String text = value.toString();

            if (field.getKind() == InputField.Kind.ENTITY_ID) {
                entityId = parseUuid(field.getName(), text);
                continue;
            }

            if (text.length() < field.getMinLength()) {
                throw new InvalidActionInputException(field.getName(),
                    field.getLabel() + " must be at least " + field.getMinLength() + " characters");
            }
            if (text.length() > field.getMaxLength()) {
                throw new InvalidActionInputException(field.getName(),
                    field.getLabel() + " must be at most " + field.getMaxLength() + " characters");
            }
            fields.put(field.getName(), text);
        }

        return new ActionInput(entityId, Collections.unmodifiableMap(fields));
    }

    private static UUID parseUuid(String name, String text) {
        try {
            UUID id = UUID.fromString(text);
            // fromString accepts shortened groups; require the canonical form
            if (!id.toString().equalsIgnoreCase(text)) {
                throw new IllegalArgumentException(text);
            }
            return id;
        } catch (IllegalArgumentException e) {
            throw new InvalidActionInputException(name, name + " must be a valid UUID");
        }
    }
}
