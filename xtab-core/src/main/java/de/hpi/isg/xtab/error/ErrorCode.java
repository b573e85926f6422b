package de.hpi.isg.xtab.error;

/**
 * Machine-readable codes for {@link CrosstabException}s.
 */
public enum ErrorCode {

    INVALID_ARGUMENT(Category.INTERNAL),
    INVALID_TYPE(Category.DATA),
    NEGATIVE_WEIGHTS(Category.DATA),
    INVALID_WEIGHTS(Category.DATA),
    NO_VALID_WEIGHTS(Category.PRECONDITION),
    WEIGHT_COLUMN_NOT_FOUND(Category.CONFIGURATION),
    BANNER_COLUMN_NOT_FOUND(Category.CONFIGURATION),
    BANNER_NO_OPTIONS(Category.CONFIGURATION),
    BANNER_NO_BOX_CATEGORY(Category.CONFIGURATION),
    DUPLICATE_SEGMENT_KEY(Category.CONFIGURATION),
    INVALID_SEGMENT_KEY(Category.CONFIGURATION),
    SEGMENT_KEY_MISMATCH(Category.INTERNAL),
    QUESTION_COLUMN_NOT_FOUND(Category.CONFIGURATION),
    INVALID_CALCULATION_TYPE(Category.CONFIGURATION),
    INVALID_COMPOSITE(Category.CONFIGURATION),
    COMPOSITE_ALL_MISSING(Category.PRECONDITION),
    INVALID_RANKING_FORMAT(Category.CONFIGURATION),
    RANKING_COLUMNS_NOT_FOUND(Category.CONFIGURATION),
    EMPTY_RANKING_MATRIX(Category.PRECONDITION),
    RANKING_QUALITY_THRESHOLD(Category.DATA),
    FILTER_SYNTAX(Category.CONFIGURATION),
    FILTER_COLUMN_NOT_FOUND(Category.CONFIGURATION),
    UNSAFE_FILTER(Category.CONFIGURATION),
    INVALID_CONFIGURATION(Category.CONFIGURATION);

    /**
     * Coarse classification of errors.
     */
    public enum Category {
        CONFIGURATION, DATA, PRECONDITION, INTERNAL
    }

    private final Category category;

    ErrorCode(Category category) {
        this.category = category;
    }

    public Category getCategory() {
        return this.category;
    }
}
