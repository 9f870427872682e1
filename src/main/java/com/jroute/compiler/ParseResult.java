package com.jroute.compiler;

import org.eclipse.collections.api.list.ImmutableList;

public record ParseResult(ImmutableList<ParseNode> tree, ImmutableList<RouteDiagnostic> errors) {
}
