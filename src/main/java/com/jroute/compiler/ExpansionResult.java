package com.jroute.compiler;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Everything one compilation produced. {@code errors} holds the parse, resolve and expand
 * diagnostics in that order, and is null when there were none.
 */
public record ExpansionResult(String original,
                              ImmutableList<Token> tokens,
                              ImmutableList<ParseNode> parseTree,
                              ImmutableList<ResolvedNode> resolvedTree,
                              ImmutableList<String> expanded,
                              String expandedString,
                              ImmutableList<RouteDiagnostic> errors) {

    public static ExpansionResult empty(String original) {
        return new ExpansionResult(original, Lists.immutable.empty(), Lists.immutable.empty(),
                Lists.immutable.empty(), Lists.immutable.empty(), "", null);
    }

    public boolean hasErrors() {
        return errors != null;
    }
}
