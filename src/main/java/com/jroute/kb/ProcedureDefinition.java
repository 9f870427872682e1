package com.jroute.kb;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

public record ProcedureDefinition(String name,
                                  ProcedureKind kind,
                                  String airport,
                                  ImmutableList<String> body,
                                  ImmutableList<ProcedureTransition> transitions) {

    public ProcedureTransition transition(String transitionName) {
        return transitions.detect(t -> t.name().equals(transitionName));
    }

    // Join fix kept once; null transition yields the body alone
    public ImmutableList<String> assemble(ProcedureTransition transition) {
        if (transition == null) {
            return body;
        }
        MutableList<String> first = Lists.mutable.ofAll(kind == ProcedureKind.DEPARTURE ? body : transition.fixes());
        ImmutableList<String> second = kind == ProcedureKind.DEPARTURE ? transition.fixes() : body;
        if (!first.isEmpty() && !second.isEmpty() && first.getLast().equals(second.getFirst())) {
            first.addAll(second.castToList().subList(1, second.size()));
        } else {
            first.addAllIterable(second);
        }
        return first.toImmutable();
    }
}
