package me.christianrobert.ilcodegen.target.delphi.ast;

import me.christianrobert.ilcodegen.target.delphi.DelphiType;

import java.util.List;

/**
 * A procedure, function, method or constructor.
 *
 * <p>{@code className} is set for methods and qualifies the implementation heading
 * ({@code function TCipher.Encrypt(...)}). {@code locals} and {@code nestedRoutines} form the
 * declaration part between the heading and {@code begin}. A null body marks a heading-only
 * declaration.</p>
 */
public final class DelphiRoutine extends DelphiNode {

    public enum Kind {
        PROCEDURE("procedure"),
        FUNCTION("function"),
        CONSTRUCTOR("constructor");

        private final String keyword;

        Kind(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }
    }

    private final Kind routineKind;
    private final String className;
    private final String name;
    private final List<DelphiParameter> parameters;
    private final DelphiType returnType;
    private final List<DelphiVariable> locals;
    private final List<DelphiRoutine> nestedRoutines;
    private final DelphiBlock body;
    private final boolean isStatic;
    private final DelphiVisibility visibility;
    private final String directive;
    private final DelphiComment docComment;

    public DelphiRoutine(Kind routineKind, String className, String name, List<DelphiParameter> parameters,
                         DelphiType returnType, List<DelphiVariable> locals, List<DelphiRoutine> nestedRoutines,
                         DelphiBlock body, boolean isStatic, DelphiVisibility visibility, String directive,
                         DelphiComment docComment) {
        this.routineKind = routineKind;
        this.className = className;
        this.name = name;
        this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
        this.returnType = returnType;
        this.locals = locals == null ? List.of() : List.copyOf(locals);
        this.nestedRoutines = nestedRoutines == null ? List.of() : List.copyOf(nestedRoutines);
        this.body = body;
        this.isStatic = isStatic;
        this.visibility = visibility;
        this.directive = directive;
        this.docComment = docComment;
    }

    @Override
    public DelphiNodeKind getKind() {
        return DelphiNodeKind.ROUTINE;
    }

    public Kind getRoutineKind() {
        return routineKind;
    }

    public String getClassName() {
        return className;
    }

    public String getName() {
        return name;
    }

    public List<DelphiParameter> getParameters() {
        return parameters;
    }

    /**
     * Result type of a function, null otherwise.
     */
    public DelphiType getReturnType() {
        return returnType;
    }

    public List<DelphiVariable> getLocals() {
        return locals;
    }

    public List<DelphiRoutine> getNestedRoutines() {
        return nestedRoutines;
    }

    public DelphiBlock getBody() {
        return body;
    }

    public boolean isStatic() {
        return isStatic;
    }

    public DelphiVisibility getVisibility() {
        return visibility;
    }

    /**
     * {@code virtual}, {@code override} or null.
     */
    public String getDirective() {
        return directive;
    }

    public DelphiComment getDocComment() {
        return docComment;
    }
}
