package io.github.cyfko.deepfilter.core.config;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Pre-compiled patterns and literals of the deep-object parameter grammar.
 * <p>
 * Word characters are ASCII only ({@code [A-Za-z0-9_]}), which is the default meaning of
 * {@code \w} in {@link Pattern}. All patterns are anchored and meant for {@code matcher(..).matches()}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public abstract class PatternConfig {
    private PatternConfig () {}

    /**
     * Full grammar of a deep-object parameter key: one identifier followed by one or more
     * bracket groups of word characters. Group 1 is the root keyword, group 2 the bracket chain.
     * <p>
     * Example valid: "filter[system_profile][sap_system]", "filter[a][b][c][contains]"
     * Example invalid: "filter[system_profile][bogus]key", "filter[system_profile][a-b]", "filter[system_profile][]"
     * </p>
     */
    public static final Pattern DEEP_OBJECT_KEY_PATTERN = Pattern.compile("^(\\w+)((?:\\[\\w+])+)$");

    /**
     * Pattern for a single identifier of word characters.
     */
    public static final Pattern WORD_PATTERN = Pattern.compile("^\\w+$");

    /**
     * Pattern for a non-empty run of ASCII decimal digits.
     */
    public static final Pattern DIGITS_PATTERN = Pattern.compile("^[0-9]+$");

    /**
     * Separator between two bracket groups once the outer brackets are stripped.
     */
    public static final String BRACKET_SEPARATOR = "][";

    /**
     * Raw values read as boolean {@code true}. Matching is case-sensitive.
     */
    public static final Set<String> TRUE_LITERALS = Set.of("true", "True");

    /**
     * Raw values read as boolean {@code false}. Matching is case-sensitive.
     */
    public static final Set<String> FALSE_LITERALS = Set.of("false", "False");
}
