package me.christianrobert.ilcodegen.codegen.analysis;

import me.christianrobert.ilcodegen.il.IlNode;

/**
 * A C-style loop recognized as iterating one variable over a bounded range.
 *
 * <p>{@code for (let i = start; i < bound; i++)} is ascending and exclusive;
 * {@code for (let i = start; i >= bound; i--)} is descending and inclusive.</p>
 */
public final class CountedLoop {

    private final String variable;
    private final String typeAnnotation;
    private final IlNode start;
    private final IlNode bound;
    private final boolean ascending;
    private final boolean inclusive;
    private final IlNode body;

    public CountedLoop(String variable, String typeAnnotation, IlNode start, IlNode bound,
                       boolean ascending, boolean inclusive, IlNode body) {
        this.variable = variable;
        this.typeAnnotation = typeAnnotation;
        this.start = start;
        this.bound = bound;
        this.ascending = ascending;
        this.inclusive = inclusive;
        this.body = body;
    }

    public String getVariable() {
        return variable;
    }

    /**
     * Explicit annotation of the loop variable's declarator, may be null.
     */
    public String getTypeAnnotation() {
        return typeAnnotation;
    }

    public IlNode getStart() {
        return start;
    }

    public IlNode getBound() {
        return bound;
    }

    public boolean isAscending() {
        return ascending;
    }

    public boolean isInclusive() {
        return inclusive;
    }

    public IlNode getBody() {
        return body;
    }

    @Override
    public String toString() {
        return "CountedLoop{" + variable + (ascending ? " up " : " down ")
                + (inclusive ? "inclusive" : "exclusive") + "}";
    }
}
