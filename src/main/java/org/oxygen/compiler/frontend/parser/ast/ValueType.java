package org.oxygen.compiler.frontend.parser.ast;

/**
 * The value types a function can be declared to return.
 */
public enum ValueType {
    /** The {@code int} type. */
    INT("int");

    private final String keyword;

    ValueType(String keyword) {
        this.keyword = keyword;
    }

    /**
     * @return The source keyword of the type.
     */
    public String keyword() {
        return keyword;
    }
}
