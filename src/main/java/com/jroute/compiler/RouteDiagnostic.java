package com.jroute.compiler;

/**
 * A non-fatal problem found while compiling a route. The compiler never throws for route
 * content; it records one of these and carries on with a best-effort result.
 *
 * @param token the token text the problem concerns, may be null
 * @param index token position, or -1 when not tied to one token
 */
public record RouteDiagnostic(Stage stage, String token, int index, String message) {

    public enum Stage {
        LEX,
        PARSE,
        RESOLVE,
        EXPAND
    }

    public static RouteDiagnostic resolve(Token token, String message) {
        return new RouteDiagnostic(Stage.RESOLVE, token.text(), token.index(), message);
    }

    public static RouteDiagnostic expand(Token token, String message) {
        return new RouteDiagnostic(Stage.EXPAND, token != null ? token.text() : null,
                token != null ? token.index() : -1, message);
    }

    @Override
    public String toString() {
        return message;
    }
}
