package me.christianrobert.ilcodegen.codegen.context;

import me.christianrobert.ilcodegen.codegen.runtime.RuntimeHelper;
import me.christianrobert.ilcodegen.codegen.type.TypeDescriptor;
import me.christianrobert.ilcodegen.config.CodegenOptions;
import me.christianrobert.ilcodegen.il.IlNode;
import me.christianrobert.ilcodegen.il.SourceLocation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Per-run state of one transformation.
 *
 * <p>Created inside {@code transform(..)} and threaded through every visitor call; transformers
 * themselves hold no traversal state. The context owns:</p>
 * <ul>
 *   <li>the {@link SymbolEnvironment} (scope stack)</li>
 *   <li>the warning side channel</li>
 *   <li>the imports (C++ includes, Delphi uses) and runtime helpers the output needs</li>
 *   <li>the routine, class and loop frames currently entered</li>
 * </ul>
 *
 * <p>Instances are never shared between runs.</p>
 */
public class TransformationContext {

    /**
     * The routine currently being transformed.
     */
    public static class RoutineFrame {
        private final String name;
        private final TypeDescriptor returnType;
        private final boolean valueReturning;
        private final boolean constructor;
        private TypeDescriptor observedReturnType;

        public RoutineFrame(String name, TypeDescriptor returnType, boolean valueReturning, boolean constructor) {
            this.name = name;
            this.returnType = returnType;
            this.valueReturning = valueReturning;
            this.constructor = constructor;
        }

        public String getName() {
            return name;
        }

        public TypeDescriptor getReturnType() {
            return returnType;
        }

        public boolean isValueReturning() {
            return valueReturning;
        }

        public boolean isConstructor() {
            return constructor;
        }

        /**
         * Type of the first {@code return <value>} whose type could be inferred, or null.
         */
        public TypeDescriptor getObservedReturnType() {
            return observedReturnType;
        }

        public void observeReturn(TypeDescriptor type) {
            if (observedReturnType == null && type != null) {
                observedReturnType = type;
            }
        }
    }

    /**
     * The class currently being transformed.
     */
    public static class ClassFrame {
        private final String name;
        private final String superClassName;

        public ClassFrame(String name, String superClassName) {
            this.name = name;
            this.superClassName = superClassName;
        }

        public String getName() {
            return name;
        }

        public String getSuperClassName() {
            return superClassName;
        }

        public boolean hasSuperClass() {
            return superClassName != null;
        }
    }

    /**
     * A loop being transformed. {@code update} is the C-style update expression that a
     * while-fallback must run before every {@code continue}; null for loops without one.
     */
    public static class LoopFrame {
        private final IlNode update;

        public LoopFrame(IlNode update) {
            this.update = update;
        }

        public IlNode getUpdate() {
            return update;
        }
    }

    private final String targetId;
    private final CodegenOptions options;
    private final SymbolEnvironment symbols = new SymbolEnvironment();
    private final List<CodegenWarning> warnings = new ArrayList<>();
    private final Set<String> imports = new TreeSet<>();
    private final Set<RuntimeHelper> helpers = EnumSet.noneOf(RuntimeHelper.class);
    private final Deque<RoutineFrame> routines = new ArrayDeque<>();
    private final Deque<ClassFrame> classes = new ArrayDeque<>();
    private final Deque<LoopFrame> loops = new ArrayDeque<>();

    public TransformationContext(String targetId, CodegenOptions options) {
        this.targetId = targetId;
        this.options = options != null ? options : CodegenOptions.defaults(targetId);
    }

    // ========== Global ==========

    public String getTargetId() {
        return targetId;
    }

    public CodegenOptions getOptions() {
        return options;
    }

    public SymbolEnvironment getSymbols() {
        return symbols;
    }

    // ========== Side channel ==========

    public void warn(IlNode node, String message) {
        String kind = node != null ? node.getRawKind() : "null";
        SourceLocation location = node != null ? node.getLocation() : null;
        warnings.add(new CodegenWarning(CodegenWarning.Phase.TRANSFORM, kind, message, location));
    }

    /**
     * Records that an IL node has no rule in this target and was dropped.
     */
    public void unsupported(IlNode node) {
        String kind = node != null ? node.getRawKind() : "null";
        warn(node, "Unsupported IL node '" + kind + "' dropped");
    }

    public List<CodegenWarning> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    // ========== Imports and runtime helpers ==========

    /**
     * Requires an include (C++) or a uses entry (Delphi).
     */
    public void requireImport(String name) {
        imports.add(name);
    }

    public Set<String> getImports() {
        return Collections.unmodifiableSet(imports);
    }

    public void useHelper(RuntimeHelper helper) {
        helpers.add(helper);
    }

    public Set<RuntimeHelper> getHelpers() {
        return Collections.unmodifiableSet(helpers);
    }

    public boolean usesHelpers() {
        return !helpers.isEmpty();
    }

    // ========== Routine frames ==========

    public void enterRoutine(RoutineFrame frame) {
        routines.push(frame);
    }

    public void exitRoutine() {
        routines.pop();
    }

    /**
     * The innermost routine, or null at module level.
     */
    public RoutineFrame currentRoutine() {
        return routines.peek();
    }

    // ========== Class frames ==========

    public void enterClass(ClassFrame frame) {
        classes.push(frame);
    }

    public void exitClass() {
        classes.pop();
    }

    public ClassFrame currentClass() {
        return classes.peek();
    }

    // ========== Loop frames ==========

    public void enterLoop(IlNode update) {
        loops.push(new LoopFrame(update));
    }

    public void exitLoop() {
        loops.pop();
    }

    public boolean isInLoop() {
        return !loops.isEmpty();
    }

    /**
     * Update expression of the innermost loop, or null.
     */
    public IlNode currentLoopUpdate() {
        LoopFrame frame = loops.peek();
        return frame != null ? frame.getUpdate() : null;
    }
}
