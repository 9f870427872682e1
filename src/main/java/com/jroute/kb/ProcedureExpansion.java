package com.jroute.kb;

import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;

public record ProcedureExpansion(boolean expanded, ImmutableList<String> fixes, String transition) {

    public static ProcedureExpansion of(ImmutableList<String> fixes, String transition) {
        return new ProcedureExpansion(true, fixes, transition);
    }

    public static ProcedureExpansion failed() {
        return new ProcedureExpansion(false, Lists.immutable.empty(), null);
    }
}
