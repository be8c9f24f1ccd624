package com.rollupduck.query;

/**
 * Sort direction of an ORDER BY entry.
 */
public enum SortDirection {
    ASC,
    DESC;

    /**
     * Parses a direction, defaulting to ascending when absent.
     *
     * @param value "asc", "desc" or null
     * @return the direction
     * @throws IllegalArgumentException if value is not recognized
     */
    public static SortDirection parse(String value) {
        if (value == null || value.isBlank()) {
            return ASC;
        }
        return switch (value.trim().toLowerCase()) {
            case "asc" -> ASC;
            case "desc" -> DESC;
            default -> throw new IllegalArgumentException(
                "Unknown sort direction: '%s'. Valid values: asc, desc".formatted(value));
        };
    }
}
