package me.christianrobert.ilcodegen.codegen.context;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Stack of lexical scopes for one transformation run.
 *
 * <p>The bottom scope is the module scope and is never popped. Lookups walk from the
 * innermost scope outwards, so inner declarations shadow outer ones.</p>
 */
public class SymbolEnvironment {

    private final Deque<Scope> scopes = new ArrayDeque<>();

    public SymbolEnvironment() {
        scopes.push(new Scope(Scope.Kind.BLOCK, "<module>"));
    }

    public Scope push(Scope.Kind kind, String name) {
        Scope scope = new Scope(kind, name);
        scopes.push(scope);
        return scope;
    }

    /**
     * Pops the innermost scope.
     *
     * @throws IllegalStateException when only the module scope is left
     */
    public Scope pop() {
        if (scopes.size() <= 1) {
            throw new IllegalStateException("Cannot pop the module scope");
        }
        return scopes.pop();
    }

    public void declare(SymbolInfo symbol) {
        scopes.peek().declare(symbol);
    }

    /**
     * Declares a symbol in the module scope, regardless of the current depth.
     */
    public void declareGlobal(SymbolInfo symbol) {
        scopes.peekLast().declare(symbol);
    }

    /**
     * Resolves a bare name. Class scopes are skipped: members are only reachable through
     * {@link #lookupMember(String)}.
     */
    public SymbolInfo lookup(String name) {
        if (name == null) {
            return null;
        }
        for (Scope scope : scopes) {
            if (scope.getKind() == Scope.Kind.CLASS) {
                continue;
            }
            SymbolInfo symbol = scope.lookupLocal(name);
            if (symbol != null) {
                return symbol;
            }
        }
        return null;
    }

    /**
     * Looks up a member of the innermost enclosing class.
     */
    public SymbolInfo lookupMember(String name) {
        Scope classScope = enclosingClass();
        return classScope != null ? classScope.lookupLocal(name) : null;
    }

    public Scope currentScope() {
        return scopes.peek();
    }

    public Scope enclosingClass() {
        for (Scope scope : scopes) {
            if (scope.getKind() == Scope.Kind.CLASS) {
                return scope;
            }
        }
        return null;
    }

    public Scope enclosingFunction() {
        for (Scope scope : scopes) {
            if (scope.getKind() == Scope.Kind.FUNCTION) {
                return scope;
            }
        }
        return null;
    }

    /**
     * True when the name is declared in any scope between the innermost one and the
     * enclosing function scope (inclusive).
     */
    public boolean isDeclaredInFunction(String name) {
        Iterator<Scope> it = scopes.iterator();
        while (it.hasNext()) {
            Scope scope = it.next();
            if (scope.isDeclared(name)) {
                return true;
            }
            if (scope.getKind() == Scope.Kind.FUNCTION) {
                return false;
            }
        }
        return false;
    }

    public int depth() {
        return scopes.size();
    }
}
