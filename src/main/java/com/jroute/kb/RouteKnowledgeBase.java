package com.jroute.kb;

/**
 * Read-only navigation data the route compiler consults. Implementations are expected
 * to be pre-built in-memory lookups; the compiler never mutates them and calls them
 * synchronously.
 */
public interface RouteKnowledgeBase {

    /**
     * Classifies an identifier, or returns null when it is unknown.
     */
    TokenType getTokenType(String text);

    /**
     * Returns the inclusive fix path from {@code fromIdent} to {@code toIdent} along the airway.
     */
    AirwayExpansion expandAirway(String fromIdent, String airwayIdent, String toIdent);

    /**
     * Expands a procedure. {@code key} is either {@code TRANSITION.PROCEDURE} or a bare
     * procedure name, in which case the implementation picks the transition itself.
     * Any of the fix arguments may be null.
     */
    ProcedureExpansion expandProcedure(String key, String previousFix, String contextAirport, String nextFix);

    /**
     * Whether a procedure is a departure or an arrival, when known.
     */
    default ProcedureKind procedureKind(String procedureName) {
        return null;
    }
}
