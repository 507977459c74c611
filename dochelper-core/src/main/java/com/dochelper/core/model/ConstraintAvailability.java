package com.dochelper.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Which constraint types make sense for which field types.
 */
public final class ConstraintAvailability {

    private static final Map<FieldType, Set<ConstraintType>> AVAILABLE = new EnumMap<>(FieldType.class);

    static {
        Set<ConstraintType> text = EnumSet.of(ConstraintType.REQUIRED, ConstraintType.MIN_LENGTH,
            ConstraintType.MAX_LENGTH, ConstraintType.PATTERN, ConstraintType.ALLOWED_VALUES);
        Set<ConstraintType> choice = EnumSet.of(ConstraintType.REQUIRED, ConstraintType.ALLOWED_VALUES);
        Set<ConstraintType> file = EnumSet.of(ConstraintType.REQUIRED, ConstraintType.FILE_EXTENSION,
            ConstraintType.MAX_FILE_SIZE);

        AVAILABLE.put(FieldType.TEXT, text);
        AVAILABLE.put(FieldType.TEXTAREA, text);
        AVAILABLE.put(FieldType.NUMBER, EnumSet.of(ConstraintType.REQUIRED, ConstraintType.MIN_VALUE,
            ConstraintType.MAX_VALUE, ConstraintType.ALLOWED_VALUES));
        AVAILABLE.put(FieldType.DATE, EnumSet.of(ConstraintType.REQUIRED, ConstraintType.MIN_VALUE,
            ConstraintType.MAX_VALUE));
        AVAILABLE.put(FieldType.DROPDOWN, choice);
        AVAILABLE.put(FieldType.RADIO, choice);
        AVAILABLE.put(FieldType.LOOKUP, EnumSet.of(ConstraintType.REQUIRED));
        AVAILABLE.put(FieldType.FILE, file);
        AVAILABLE.put(FieldType.IMAGE, file);
        // Checkbox is always true/false; calculated values come from formulas; tables validate per row
        AVAILABLE.put(FieldType.CHECKBOX, EnumSet.noneOf(ConstraintType.class));
        AVAILABLE.put(FieldType.CALCULATED, EnumSet.noneOf(ConstraintType.class));
        AVAILABLE.put(FieldType.TABLE, EnumSet.noneOf(ConstraintType.class));
    }

    private ConstraintAvailability() {
    }

    public static Set<ConstraintType> availableFor(FieldType fieldType) {
        return Collections.unmodifiableSet(AVAILABLE.get(fieldType));
    }

    public static boolean isAvailable(FieldType fieldType, ConstraintType constraintType) {
        return AVAILABLE.get(fieldType).contains(constraintType);
    }
}
