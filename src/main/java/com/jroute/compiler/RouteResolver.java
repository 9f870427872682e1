package com.jroute.compiler;

import com.jroute.kb.ProcedureKind;
import com.jroute.kb.RouteKnowledgeBase;
import com.jroute.kb.TokenType;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.regex.Matcher;

public class RouteResolver {
    private static final Logger LOG = LoggerFactory.getLogger(RouteResolver.class);

    private static final int EDGE_WINDOW = 2;

    private final RouteKnowledgeBase knowledgeBase;

    public RouteResolver(RouteKnowledgeBase knowledgeBase) {
        this.knowledgeBase = Objects.requireNonNull(knowledgeBase, "knowledgeBase");
    }

    public ResolveResult resolve(ImmutableList<ParseNode> parseTree, RouteContext context) {
        MutableList<RouteDiagnostic> errors = Lists.mutable.empty();
        MutableList<ResolvedNode> resolved = Lists.mutable.withInitialCapacity(parseTree.size());

        for (int i = 0; i < parseTree.size(); i++) {
            resolved.add(resolveNode(parseTree.get(i), i, parseTree.size(), context, errors));
        }
        return new ResolveResult(resolved.toImmutable(), errors.toImmutable());
    }

    private ResolvedNode resolveNode(ParseNode node, int index, int size, RouteContext context,
                                     MutableList<RouteDiagnostic> errors) {
        return switch (node.kind()) {
            case DIRECT -> new ResolvedNode.Direct(((ParseNode.Direct) node).token());
            case AIRWAY_SEGMENT -> {
                ParseNode.AirwaySegment segment = (ParseNode.AirwaySegment) node;
                yield new ResolvedNode.AirwaySegment(segment.from(), segment.airway(), segment.to());
            }
            case PROCEDURE -> {
                ParseNode.Procedure procedure = (ParseNode.Procedure) node;
                yield new ResolvedNode.Procedure(procedure.token(), procedure.transition(),
                        procedure.procedureName(), procedure.explicit(),
                        procedureKind(procedure.procedureName(), index, size));
            }
            case PROCEDURE_OR_WAYPOINT ->
                    resolveProcedureOrWaypoint((ParseNode.ProcedureOrWaypoint) node, index, size, context, errors);
            case COORDINATE -> resolveCoordinate(((ParseNode.Coordinate) node).token(), errors);
            case WAYPOINT -> {
                Token token = ((ParseNode.Waypoint) node).token();
                yield new ResolvedNode.Waypoint(token, fixType(token.text()));
            }
        };
    }

    private ResolvedNode resolveProcedureOrWaypoint(ParseNode.ProcedureOrWaypoint node, int index, int size,
                                                    RouteContext context, MutableList<RouteDiagnostic> errors) {
        Token token = node.token();
        String text = token.text();
        ProcedureKind kind = procedureKind(text, index, size);
        String airport = kind == ProcedureKind.DEPARTURE ? context.departureText() : context.destinationText();

        MutableList<String> candidates = Lists.mutable.with(text);
        if (!node.procedureNumber().isEmpty()) {
            candidates.add(node.procedureName() + "." + text);
        }
        if (airport != null && !airport.equals(text)) {
            candidates.add(airport + "." + text);
        }

        for (String candidate : candidates) {
            if (knowledgeBase.getTokenType(candidate) == TokenType.PROCEDURE) {
                LOG.debug("Resolved {} as {} procedure via {}", text, kind, candidate);
                return new ResolvedNode.Procedure(token, null, text, false, kind, candidate);
            }
        }

        TokenType type = fixType(text);
        if (type == null) {
            errors.add(RouteDiagnostic.resolve(token, "Unrecognized identifier " + text + ", treated as waypoint"));
        }
        return new ResolvedNode.Waypoint(token, type);
    }

    private ProcedureKind procedureKind(String procedureName, int index, int size) {
        ProcedureKind known = knowledgeBase.procedureKind(procedureName);
        if (known != null) {
            return known;
        }
        int fromStart = index;
        int fromEnd = size - 1 - index;
        if (fromStart <= EDGE_WINDOW && fromStart <= fromEnd) {
            return ProcedureKind.DEPARTURE;
        }
        return ProcedureKind.ARRIVAL;
    }

    private TokenType fixType(String text) {
        TokenType type = knowledgeBase.getTokenType(text);
        return type != null && type.isFix() ? type : null;
    }

    private ResolvedNode resolveCoordinate(Token token, MutableList<RouteDiagnostic> errors) {
        Matcher m = TokenPatterns.COORDINATE.matcher(token.text());
        GeoPoint position = null;
        if (m.matches()) {
            Double lat = decode(m.group(1), 2, 90);
            Double lon = decode(m.group(3), 3, 180);
            if (lat != null && lon != null) {
                if ("S".equals(m.group(2))) {
                    lat = -lat;
                }
                if ("W".equals(m.group(4))) {
                    lon = -lon;
                }
                position = new GeoPoint(lat, lon);
            }
        }
        if (position == null) {
            errors.add(RouteDiagnostic.resolve(token, "Invalid coordinate " + token.text()));
        }
        return new ResolvedNode.Coordinate(token, position);
    }

    // DDMM[SS] or DDDMM[SS]; null when out of range
    private static Double decode(String digits, int degreeDigits, int maxDegrees) {
        int length = digits.length();
        if (length != degreeDigits + 2 && length != degreeDigits + 4) {
            return null;
        }
        int degrees = Integer.parseInt(digits.substring(0, degreeDigits));
        int minutes = Integer.parseInt(digits.substring(degreeDigits, degreeDigits + 2));
        int seconds = length == degreeDigits + 4 ? Integer.parseInt(digits.substring(degreeDigits + 2)) : 0;
        if (minutes >= 60 || seconds >= 60) {
            return null;
        }
        double value = degrees + minutes / 60.0 + seconds / 3600.0;
        return value > maxDegrees ? null : value;
    }
}
