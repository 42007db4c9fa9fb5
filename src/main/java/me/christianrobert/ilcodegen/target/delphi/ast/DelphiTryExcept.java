package me.christianrobert.ilcodegen.target.delphi.ast;

/**
 * {@code try ... except on Name: Type do ... end}. Without a name the handler is a plain
 * {@code except} part.
 */
public final class DelphiTryExcept extends DelphiNode {

    private final DelphiBlock body;
    private final String exceptionName;
    private final String exceptionType;
    private final DelphiBlock handler;

    public DelphiTryExcept(DelphiBlock body, String exceptionName, String exceptionType, DelphiBlock handler) {
        this.body = body;
        this.exceptionName = exceptionName;
        this.exceptionType = exceptionType;
        this.handler = handler;
    }

    @Override
    public DelphiNodeKind getKind() {
        return DelphiNodeKind.TRY_EXCEPT;
    }

    public DelphiBlock getBody() {
        return body;
    }

    public String getExceptionName() {
        return exceptionName;
    }

    public String getExceptionType() {
        return exceptionType;
    }

    public DelphiBlock getHandler() {
        return handler;
    }
}
