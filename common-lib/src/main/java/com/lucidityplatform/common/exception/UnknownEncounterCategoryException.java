package com.lucidityplatform.common.exception;

/**
 * Raised before any state is touched. Callers may retry with a fallback category.
 */
public class UnknownEncounterCategoryException extends LucidityException {
    private final String category;

    public UnknownEncounterCategoryException(String category) {
        super("UNKNOWN_ENCOUNTER_CATEGORY", "Unknown encounter category: " + category);
        this.category = category;
    }

    public String getCategory() {
        return category;
    }
}
