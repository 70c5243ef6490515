package io.github.cyfko.deepfilter.jpa;

import java.util.Optional;

/**
 * Native comparison keywords understood when they end a condition path.
 * <p>
 * These are the keywords the parser emits ({@code gt}, {@code isnull}, {@code iexact}, ...) plus the
 * ones it passes through ({@code contains}, {@code startswith}, ...). A trailing segment that is not
 * listed here is an attribute name compared with {@link #EXACT}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public enum LookupType {
    EXACT("exact"),
    IEXACT("iexact"),
    CONTAINS("contains"),
    ICONTAINS("icontains"),
    STARTSWITH("startswith"),
    ISTARTSWITH("istartswith"),
    ENDSWITH("endswith"),
    IENDSWITH("iendswith"),
    GT("gt"),
    GTE("gte"),
    LT("lt"),
    LTE("lte"),
    ISNULL("isnull");

    private final String keyword;

    LookupType(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    public boolean isPattern() {
        return this == CONTAINS || this == ICONTAINS || this == STARTSWITH
                || this == ISTARTSWITH || this == ENDSWITH || this == IENDSWITH;
    }

    public boolean isCaseInsensitive() {
        return this == IEXACT || this == ICONTAINS || this == ISTARTSWITH || this == IENDSWITH;
    }

    public boolean isOrdering() {
        return this == GT || this == GTE || this == LT || this == LTE;
    }

    public static Optional<LookupType> fromKeyword(String segment) {
        for (LookupType lookup : values()) {
            if (lookup.keyword.equals(segment)) return Optional.of(lookup);
        }
        return Optional.empty();
    }
}
