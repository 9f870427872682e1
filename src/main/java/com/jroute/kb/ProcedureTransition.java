package com.jroute.kb;

import org.eclipse.collections.api.list.ImmutableList;

public record ProcedureTransition(String name, ImmutableList<String> fixes) {

    public String entryFix() {
        return fixes.isEmpty() ? null : fixes.getFirst();
    }

    public String exitFix() {
        return fixes.isEmpty() ? null : fixes.getLast();
    }
}
