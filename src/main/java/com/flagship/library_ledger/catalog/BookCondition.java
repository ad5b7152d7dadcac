package com.flagship.library_ledger.catalog;

/**
 * Physical condition of a copy.
 */
public enum BookCondition {
    NEW("New"),
    GOOD("Good"),
    FAIR("Fair"),
    POOR("Poor"),
    DAMAGED("Damaged");

    private final String label;

    BookCondition(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Parses either the enum name or the display label, case-insensitively.
     */
    public static BookCondition parse(String value) {
        if (value == null || value.isBlank()) {
            return GOOD;
        }
        for (BookCondition condition : values()) {
            if (condition.name().equalsIgnoreCase(value.trim()) || condition.label.equalsIgnoreCase(value.trim())) {
                return condition;
            }
        }
        throw new IllegalArgumentException("Unknown book condition: " + value);
    }
}
