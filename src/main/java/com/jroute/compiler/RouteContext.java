package com.jroute.compiler;

import org.eclipse.collections.api.list.ImmutableList;

public record RouteContext(String departureText, String destinationText) {

    public static RouteContext of(ImmutableList<Token> tokens) {
        String departure = tokens.notEmpty() ? tokens.getFirst().text() : null;
        String destination = tokens.size() > 1 ? tokens.getLast().text() : null;
        return new RouteContext(departure, destination);
    }
}
