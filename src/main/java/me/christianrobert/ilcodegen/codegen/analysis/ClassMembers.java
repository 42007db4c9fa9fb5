package me.christianrobert.ilcodegen.codegen.analysis;

import me.christianrobert.ilcodegen.codegen.context.Scope;
import me.christianrobert.ilcodegen.codegen.context.SymbolEnvironment;
import me.christianrobert.ilcodegen.codegen.context.SymbolInfo;
import me.christianrobert.ilcodegen.codegen.context.SymbolRole;
import me.christianrobert.ilcodegen.codegen.type.TypeDescriptor;
import me.christianrobert.ilcodegen.codegen.type.TypeInferrer;
import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Member layout of a {@code ClassDeclaration}.
 *
 * <p>Fields come from two places, in this order:</p>
 * <ol>
 *   <li>{@code PropertyDefinition} members</li>
 *   <li>{@code this.x = ...} assignments, constructor first, then the other methods</li>
 * </ol>
 *
 * <p>A field's type is the annotation of its property definition, else the type of the first
 * assignment whose value type can be inferred (constructor parameters are in scope, so
 * {@code this.key = key} takes the parameter's type), else the name heuristic.</p>
 */
public final class ClassMembers {

    /**
     * A collected instance or static field.
     */
    public static final class Field {
        private final String name;
        private final TypeDescriptor type;
        private final boolean isStatic;
        private final IlNode initializer;

        public Field(String name, TypeDescriptor type, boolean isStatic, IlNode initializer) {
            this.name = name;
            this.type = type;
            this.isStatic = isStatic;
            this.initializer = initializer;
        }

        public String getName() {
            return name;
        }

        public TypeDescriptor getType() {
            return type;
        }

        public boolean isStatic() {
            return isStatic;
        }

        /**
         * Initializer of a property definition; null for fields found through assignments.
         */
        public IlNode getInitializer() {
            return initializer;
        }
    }

    private ClassMembers() {
    }

    public static IlNode findConstructor(IlNode classDeclaration) {
        for (IlNode member : classDeclaration.nodes("body")) {
            if (member.is(IlKind.METHOD_DEFINITION) && "constructor".equals(member.text("methodKind"))) {
                return member;
            }
        }
        return null;
    }

    /**
     * Method definitions other than the constructor, in source order.
     */
    public static List<IlNode> methods(IlNode classDeclaration) {
        List<IlNode> methods = new ArrayList<>();
        for (IlNode member : classDeclaration.nodes("body")) {
            if (member.is(IlKind.METHOD_DEFINITION) && !"constructor".equals(member.text("methodKind"))) {
                methods.add(member);
            }
        }
        return methods;
    }

    public static List<Field> collectFields(IlNode classDeclaration, SymbolEnvironment symbols) {
        Map<String, Field> fields = new LinkedHashMap<>();

        for (IlNode member : classDeclaration.nodes("body")) {
            if (!member.is(IlKind.PROPERTY_DEFINITION) || member.name() == null) {
                continue;
            }
            String name = member.name();
            IlNode value = member.node("value");
            TypeDescriptor type = TypeInferrer.inferDeclaration(name, member.text("typeAnnotation"), value, symbols);
            fields.put(name, new Field(name, type, member.flag("static"), value));
        }

        Map<String, TypeDescriptor> assigned = new LinkedHashMap<>();
        IlNode constructor = findConstructor(classDeclaration);
        if (constructor != null) {
            collectAssignments(constructor.node("value"), symbols, assigned);
        }
        for (IlNode method : methods(classDeclaration)) {
            if (!method.flag("static")) {
                collectAssignments(method.node("value"), symbols, assigned);
            }
        }

        for (Map.Entry<String, TypeDescriptor> entry : assigned.entrySet()) {
            String name = entry.getKey();
            if (fields.containsKey(name)) {
                continue;
            }
            TypeDescriptor type = entry.getValue() != null ? entry.getValue() : TypeInferrer.fromName(name);
            fields.put(name, new Field(name, type, false, null));
        }
        return new ArrayList<>(fields.values());
    }

    /**
     * Name of the field a {@code this.x} target refers to, or null when the node is not one.
     */
    public static String thisPropertyName(IlNode target) {
        if (target == null) {
            return null;
        }
        if (target.is(IlKind.THIS_PROPERTY_ACCESS)) {
            return target.text("property");
        }
        if (target.is(IlKind.MEMBER_EXPRESSION) && !target.flag("computed")) {
            IlNode object = target.node("object");
            IlNode property = target.node("property");
            if (object != null && object.is(IlKind.THIS_EXPRESSION) && property != null) {
                return property.name();
            }
        }
        return null;
    }

    private static void collectAssignments(IlNode function, SymbolEnvironment symbols,
                                           Map<String, TypeDescriptor> assigned) {
        if (function == null) {
            return;
        }
        symbols.push(Scope.Kind.FUNCTION, "<fields>");
        try {
            for (IlNode param : function.nodes("params")) {
                String name = Parameters.name(param);
                if (name != null) {
                    symbols.declare(new SymbolInfo(name, name, Parameters.type(param, symbols), SymbolRole.PARAMETER));
                }
            }
            scan(function.node("body"), symbols, assigned);
        } finally {
            symbols.pop();
        }
    }

    private static void scan(IlNode node, SymbolEnvironment symbols, Map<String, TypeDescriptor> assigned) {
        if (node == null) {
            return;
        }
        if (node.is(IlKind.VARIABLE_DECLARATOR) && node.name() != null) {
            IlNode init = node.node("init");
            symbols.declare(new SymbolInfo(node.name(), node.name(),
                    TypeInferrer.inferDeclaration(node.name(), node.text("typeAnnotation"), init, symbols),
                    SymbolRole.LOCAL));
        }
        if (node.is(IlKind.ASSIGNMENT_EXPRESSION) && "=".equals(node.text("operator"))) {
            String field = thisPropertyName(node.node("left"));
            if (field != null && assigned.get(field) == null) {
                assigned.put(field, TypeInferrer.inferExpression(node.node("right"), symbols));
            }
        }
        for (IlNode child : node.children()) {
            scan(child, symbols, assigned);
        }
    }
}
