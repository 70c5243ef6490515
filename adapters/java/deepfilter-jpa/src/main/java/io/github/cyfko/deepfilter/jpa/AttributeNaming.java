package io.github.cyfko.deepfilter.jpa;

/**
 * Strategy mapping a path segment of a query parameter to a JPA attribute name.
 *
 * <pre>{@code
 * SNAKE_TO_CAMEL: system_profile -> systemProfile, number_of_sockets -> numberOfSockets
 * IDENTITY:       system_profile -> system_profile
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public enum AttributeNaming {

    /** Query parameters use snake_case, entities use camelCase. */
    SNAKE_TO_CAMEL {
        @Override
        public String toAttributeName(String segment) {
            StringBuilder name = new StringBuilder(segment.length());
            boolean upperNext = false;
            for (char c : segment.toCharArray()) {
                if (c == '_') {
                    upperNext = name.length() > 0;
                } else if (upperNext) {
                    name.append(Character.toUpperCase(c));
                    upperNext = false;
                } else {
                    name.append(c);
                }
            }
            return name.length() == 0 ? segment : name.toString();
        }
    },

    /** Segments are used as attribute names unchanged. */
    IDENTITY {
        @Override
        public String toAttributeName(String segment) {
            return segment;
        }
    };

    /**
     * Maps one path segment to an attribute name.
     *
     * @param segment a word-character segment, never empty
     * @return the attribute name
     */
    public abstract String toAttributeName(String segment);
}
