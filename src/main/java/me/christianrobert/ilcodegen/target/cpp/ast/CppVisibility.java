package me.christianrobert.ilcodegen.target.cpp.ast;

import java.util.Locale;

public enum CppVisibility {
    PUBLIC,
    PROTECTED,
    PRIVATE;

    /**
     * Access-specifier label, e.g. {@code public:}.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT) + ":";
    }
}
