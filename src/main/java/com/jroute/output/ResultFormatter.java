package com.jroute.output;

import com.fasterxml.jackson.core.io.JsonStringEncoder;
import com.jroute.compiler.ExpansionResult;
import com.jroute.compiler.GeoPoint;
import com.jroute.compiler.ResolvedNode;
import com.jroute.compiler.RouteDiagnostic;
import com.jroute.compiler.Token;
import com.jroute.compiler.ValidationResult;
import org.eclipse.collections.api.list.ImmutableList;

/**
 * Renders compilation results as JSON text, pretty-printed or compact.
 */
public class ResultFormatter {
    private static final JsonStringEncoder ENCODER = JsonStringEncoder.getInstance();

    private final boolean prettyPrint;

    public ResultFormatter(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
    }

    public String format(ExpansionResult result) {
        Writer w = new Writer();
        w.beginObject(0);
        w.field(1, "original").string(result.original());
        w.field(1, "tokens");
        w.array(1, result.tokens(), (token, depth) -> w.string(token.text()));
        w.field(1, "resolved");
        w.array(1, result.resolvedTree(), (node, depth) -> writeNode(w, node, depth));
        w.field(1, "expanded");
        w.array(1, result.expanded(), (fix, depth) -> w.string(fix));
        w.field(1, "expandedString").string(result.expandedString());
        w.field(1, "errors");
        writeErrors(w, result.errors());
        w.endObject(0);

        return w.sb.toString();
    }

    public String format(ValidationResult result) {
        Writer w = new Writer();
        w.beginObject(0);
        w.field(1, "valid").raw(Boolean.toString(result.valid()));
        w.field(1, "tokens");
        w.array(1, result.tokens(), (token, depth) -> w.string(token.text()));
        w.field(1, "errors");
        writeErrors(w, result.errors());
        w.endObject(0);

        return w.sb.toString();
    }

    private void writeErrors(Writer w, ImmutableList<RouteDiagnostic> errors) {
        if (errors == null) {
            w.raw("null");
        } else {
            w.array(1, errors, (error, depth) -> w.string(error.stage() + ": " + error.message()));
        }
    }

    private void writeNode(Writer w, ResolvedNode node, int depth) {
        w.beginObject(depth);
        w.field(depth + 1, "type").string(node.kind().name());
        switch (node.kind()) {
            case AIRWAY_SEGMENT -> {
                ResolvedNode.AirwaySegment segment = (ResolvedNode.AirwaySegment) node;
                w.field(depth + 1, "from").string(segment.from().text());
                w.field(depth + 1, "airway").string(segment.airway().text());
                w.field(depth + 1, "to").string(segment.to().text());
            }
            case PROCEDURE -> {
                ResolvedNode.Procedure procedure = (ResolvedNode.Procedure) node;
                w.field(depth + 1, "procedure").string(procedure.procedureName());
                if (procedure.transition() != null) {
                    w.field(depth + 1, "transition").string(procedure.transition());
                }
                w.field(depth + 1, "kind").string(procedure.procedureKind().name());
            }
            case COORDINATE -> {
                ResolvedNode.Coordinate coordinate = (ResolvedNode.Coordinate) node;
                w.field(depth + 1, "token").string(coordinate.token().text());
                GeoPoint position = coordinate.position();
                if (position != null) {
                    w.field(depth + 1, "lat").raw(Double.toString(position.latitude()));
                    w.field(depth + 1, "lon").raw(Double.toString(position.longitude()));
                }
            }
            case WAYPOINT -> {
                ResolvedNode.Waypoint waypoint = (ResolvedNode.Waypoint) node;
                w.field(depth + 1, "token").string(waypoint.token().text());
                if (waypoint.type() != null) {
                    w.field(depth + 1, "fixType").string(waypoint.type().name());
                }
            }
            default -> {
                Token token = node instanceof ResolvedNode.Direct direct ? direct.token() : null;
                if (token != null) {
                    w.field(depth + 1, "token").string(token.text());
                }
            }
        }
        w.field(depth + 1, "expand").raw(Boolean.toString(node.expand()));
        w.endObject(depth);
    }

    private interface ElementWriter<T> {
        void write(T element, int depth);
    }

    // Tracks comma placement between fields
    private final class Writer {
        private final StringBuilder sb = new StringBuilder(512);
        private boolean first = true;

        private void beginObject(int depth) {
            sb.append('{');
            first = true;
        }

        private void endObject(int depth) {
            if (!first) {
                newline(depth);
            }
            sb.append('}');
            first = false;
        }

        private Writer field(int depth, String name) {
            if (!first) {
                sb.append(',');
            }
            first = false;
            newline(depth);
            sb.append('"').append(name).append("\":");
            if (prettyPrint) {
                sb.append(' ');
            }
            return this;
        }

        private <T> void array(int depth, ImmutableList<T> elements, ElementWriter<T> element) {
            if (elements.isEmpty()) {
                sb.append("[]");
                return;
            }
            sb.append('[');
            boolean firstElement = true;
            for (T e : elements) {
                if (!firstElement) {
                    sb.append(',');
                }
                firstElement = false;
                newline(depth + 1);
                element.write(e, depth + 1);
            }
            newline(depth);
            sb.append(']');
            first = false;
        }

        private void string(String value) {
            if (value == null) {
                sb.append("null");
            } else {
                // Escapes quotes, backslashes and every control character
                sb.append('"').append(ENCODER.quoteAsString(value)).append('"');
            }
        }

        private void raw(String value) {
            sb.append(value);
        }

        private void newline(int depth) {
            if (prettyPrint) {
                sb.append('\n').append("  ".repeat(depth));
            }
        }
    }
}
