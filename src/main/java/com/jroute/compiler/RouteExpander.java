package com.jroute.compiler;

import com.jroute.kb.AirwayExpansion;
import com.jroute.kb.ProcedureExpansion;
import com.jroute.kb.ProcedureKind;
import com.jroute.kb.RouteKnowledgeBase;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

public class RouteExpander {
    private static final Logger LOG = LoggerFactory.getLogger(RouteExpander.class);

    private final RouteKnowledgeBase knowledgeBase;

    public RouteExpander(RouteKnowledgeBase knowledgeBase) {
        this.knowledgeBase = Objects.requireNonNull(knowledgeBase, "knowledgeBase");
    }

    public ExpandResult expand(ImmutableList<ResolvedNode> resolvedTree) {
        Accumulator out = new Accumulator();

        for (int i = 0; i < resolvedTree.size(); i++) {
            ResolvedNode node = resolvedTree.get(i);
            switch (node.kind()) {
                case AIRWAY_SEGMENT -> expandAirway((ResolvedNode.AirwaySegment) node, out);
                case PROCEDURE -> expandProcedure((ResolvedNode.Procedure) node, i, resolvedTree, out);
                case WAYPOINT, COORDINATE -> out.appendTerminal(node.leadingIdent());
                case DIRECT -> out.pathEnd = null; // pilot-discretion leg, no fix of its own
                default -> {
                    if (node.leadingIdent() != null) {
                        out.appendTerminal(node.leadingIdent());
                    }
                }
            }
        }
        return new ExpandResult(out.fixes.toImmutable(), out.errors.toImmutable());
    }

    private void expandAirway(ResolvedNode.AirwaySegment node, Accumulator out) {
        String from = node.from().text();
        String airway = node.airway().text();
        String to = node.to().text();

        AirwayExpansion segment = knowledgeBase.expandAirway(from, airway, to);
        if (segment != null && segment.expanded() && segment.fixes().notEmpty()) {
            LOG.debug("Expanded airway {}: {} -> {} ({} fixes)", airway, from, to, segment.fixes().size());
            out.appendPath(segment.fixes());
            return;
        }

        String reason = segment != null && segment.error() != null ? segment.error() : "no path found";
        LOG.warn("Airway expansion failed: {} {} {} ({})", from, airway, to, reason);
        out.errors.add(RouteDiagnostic.expand(node.airway(),
                "Airway " + airway + " expansion failed: " + from + " to " + to + " (" + reason + ")"));
        // Literal endpoints; the "from" fix may already close the previous segment
        out.appendPath(Lists.immutable.with(from, to));
    }

    private void expandProcedure(ResolvedNode.Procedure node, int index, ImmutableList<ResolvedNode> tree,
                                 Accumulator out) {
        String previousFix = out.last();
        String nextFix = index + 1 < tree.size() ? tree.get(index + 1).leadingIdent() : null;
        String contextAirport = node.procedureKind() == ProcedureKind.DEPARTURE
                ? tree.getFirst().leadingIdent()
                : tree.getLast().trailingIdent();

        ProcedureExpansion result = knowledgeBase.expandProcedure(node.lookupKey(), previousFix, contextAirport, nextFix);
        if (result != null && result.expanded() && result.fixes().notEmpty()) {
            LOG.debug("Expanded procedure {} (transition {}) into {} fixes",
                    node.lookupKey(), result.transition(), result.fixes().size());
            out.appendPath(result.fixes());
            return;
        }

        LOG.warn("Procedure expansion failed: {}", node.lookupKey());
        out.errors.add(RouteDiagnostic.expand(node.token(), "Failed to expand procedure " + node.lookupKey()));
        out.appendTerminal(node.token().text());
    }

    private static final class Accumulator {
        private final MutableList<String> fixes = Lists.mutable.empty();
        private final MutableList<RouteDiagnostic> errors = Lists.mutable.empty();
        // Last fix of the most recent spliced path, while nothing has been appended after it
        private String pathEnd;

        private String last() {
            return fixes.isEmpty() ? null : fixes.getLast();
        }

        private void appendPath(ImmutableList<String> path) {
            int start = path.getFirst().equals(last()) ? 1 : 0;
            for (int i = start; i < path.size(); i++) {
                fixes.add(path.get(i));
            }
            pathEnd = last();
        }

        // Drops the fix only when the preceding path already ended on it
        private void appendTerminal(String ident) {
            if (!ident.equals(pathEnd)) {
                fixes.add(ident);
            }
            pathEnd = null;
        }
    }
}
