package me.christianrobert.ilcodegen.codegen.analysis;

import me.christianrobert.ilcodegen.codegen.context.SymbolEnvironment;
import me.christianrobert.ilcodegen.codegen.type.TypeDescriptor;
import me.christianrobert.ilcodegen.codegen.type.TypeInferrer;
import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;

/**
 * Reads routine parameters, which are either plain identifiers or {@code AssignmentPattern}s
 * carrying a default value.
 */
public final class Parameters {

    private Parameters() {
    }

    public static String name(IlNode param) {
        IlNode target = target(param);
        return target != null ? target.name() : null;
    }

    public static String annotation(IlNode param) {
        IlNode target = target(param);
        return target != null ? target.text("typeAnnotation") : null;
    }

    /**
     * Default value expression, or null.
     */
    public static IlNode defaultValue(IlNode param) {
        return param != null && param.is(IlKind.ASSIGNMENT_PATTERN) ? param.node("right") : null;
    }

    public static TypeDescriptor type(IlNode param, SymbolEnvironment symbols) {
        return TypeInferrer.inferDeclaration(name(param), annotation(param), defaultValue(param), symbols);
    }

    private static IlNode target(IlNode param) {
        if (param == null) {
            return null;
        }
        return param.is(IlKind.ASSIGNMENT_PATTERN) ? param.node("left") : param;
    }
}
