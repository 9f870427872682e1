package com.jroute.compiler;

import org.eclipse.collections.api.list.ImmutableList;

public record ResolveResult(ImmutableList<ResolvedNode> tree, ImmutableList<RouteDiagnostic> errors) {
}
