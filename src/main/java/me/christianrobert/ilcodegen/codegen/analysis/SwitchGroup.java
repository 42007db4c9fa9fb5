package me.christianrobert.ilcodegen.codegen.analysis;

import me.christianrobert.ilcodegen.il.IlNode;

import java.util.List;

/**
 * One arm of a switch after grouping: the case labels that share a body, the body without its
 * terminating {@code break}, and whether control falls into the next arm.
 */
public final class SwitchGroup {

    private final List<IlNode> tests;
    private final boolean includesDefault;
    private final List<IlNode> body;
    private final boolean fallsThrough;

    public SwitchGroup(List<IlNode> tests, boolean includesDefault, List<IlNode> body, boolean fallsThrough) {
        this.tests = List.copyOf(tests);
        this.includesDefault = includesDefault;
        this.body = List.copyOf(body);
        this.fallsThrough = fallsThrough;
    }

    /**
     * Case label expressions; empty for a lone {@code default}.
     */
    public List<IlNode> getTests() {
        return tests;
    }

    public boolean includesDefault() {
        return includesDefault;
    }

    public List<IlNode> getBody() {
        return body;
    }

    public boolean isFallsThrough() {
        return fallsThrough;
    }
}
