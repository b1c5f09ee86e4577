package com.approvalgate.domain.model;

import lombok.Value;

/**
 * A named field an action accepts in its tool input.
 */
@Value
public class InputField {

    public enum Kind {
        /** Entity identifier; must parse as a UUID. */
        ENTITY_ID,
        TEXT
    }

    String name;
    String label;
    Kind kind;
    boolean required;
    int minLength;
    int maxLength;

    public static InputField entityId(String name) {
        return new InputField(name, name, Kind.ENTITY_ID, true, 0, 36);
    }

    public static InputField optionalText(String name, String label, int maxLength) {
        return new InputField(name, label, Kind.TEXT, false, 0, maxLength);
    }

    public static InputField requiredText(String name, String label, int minLength, int maxLength) {
        return new InputField(name, label, Kind.TEXT, true, minLength, maxLength);
    }
}
