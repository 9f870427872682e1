package com.jroute.compiler;

import org.eclipse.collections.api.list.ImmutableList;

public record ExpandResult(ImmutableList<String> expanded, ImmutableList<RouteDiagnostic> errors) {
}
