package me.christianrobert.ilcodegen.codegen.analysis;

import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;

import java.util.Set;

/**
 * Write-access queries over IL subtrees.
 */
public final class Assignments {

    // Instructions that modify their array operand in place
    private static final Set<IlKind> IN_PLACE_ARRAY_WRITES = Set.of(
            IlKind.ARRAY_CLEAR, IlKind.ARRAY_FILL, IlKind.ARRAY_PUSH, IlKind.ARRAY_SPLICE);

    private Assignments() {
    }

    /**
     * True when the subtree assigns, increments or redeclares the variable {@code name}.
     * Nested functions are included, since closures may capture the variable.
     */
    public static boolean assigns(IlNode root, String name) {
        if (root == null || name == null) {
            return false;
        }
        switch (root.getKind()) {
            case ASSIGNMENT_EXPRESSION -> {
                IlNode left = root.node("left");
                if (left != null && left.isIdentifier(name)) {
                    return true;
                }
            }
            case UPDATE_EXPRESSION -> {
                IlNode argument = root.node("argument");
                if (argument != null && argument.isIdentifier(name)) {
                    return true;
                }
            }
            case VARIABLE_DECLARATOR -> {
                if (name.equals(root.name())) {
                    return true;
                }
            }
            default -> {
            }
        }
        for (IlNode child : root.children()) {
            if (assigns(child, name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True when the subtree writes into the elements of the array variable {@code name}
     * ({@code name[i] = x}, {@code name[i]++}, or an in-place array instruction).
     */
    public static boolean writesElements(IlNode root, String name) {
        if (root == null || name == null) {
            return false;
        }
        if (root.is(IlKind.ASSIGNMENT_EXPRESSION) && isElementOf(root.node("left"), name)) {
            return true;
        }
        if (root.is(IlKind.UPDATE_EXPRESSION) && isElementOf(root.node("argument"), name)) {
            return true;
        }
        if (IN_PLACE_ARRAY_WRITES.contains(root.getKind())) {
            IlNode array = root.node("array");
            if (array != null && array.isIdentifier(name)) {
                return true;
            }
        }
        for (IlNode child : root.children()) {
            if (writesElements(child, name)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isElementOf(IlNode target, String name) {
        if (target == null || !target.is(IlKind.MEMBER_EXPRESSION) || !target.flag("computed")) {
            return false;
        }
        IlNode object = target.node("object");
        return object != null && object.isIdentifier(name);
    }
}
