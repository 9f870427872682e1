package com.jroute.compiler;

import org.eclipse.collections.api.list.ImmutableList;

public record ValidationResult(boolean valid, ImmutableList<Token> tokens, ImmutableList<RouteDiagnostic> errors) {
}
