package com.jroute.compiler;

import com.jroute.kb.RouteKnowledgeBase;
import com.jroute.kb.TokenType;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.regex.Matcher;

/**
 * Single-pass scanner over the token sequence with two tokens of lookahead.
 *
 * <p>Patterns are tried in a fixed order and the first match wins:
 * <ol>
 *   <li>{@code DCT}</li>
 *   <li>airway segment {@code FROM AIRWAY TO}, where the airway is recognized by shape or by the
 *       knowledge base. This is checked before dotted procedure notation, so a token that would
 *       satisfy both is always read as the start of an airway segment.</li>
 *   <li>{@code TRANSITION.PROCEDURE}</li>
 *   <li>bare word that may be a procedure or a fix</li>
 *   <li>coordinate</li>
 *   <li>waypoint, for anything else</li>
 * </ol>
 *
 * <p>Every token is classifiable, so parsing never produces errors in the current grammar.
 */
public class RouteParser {
    private static final Logger LOG = LoggerFactory.getLogger(RouteParser.class);

    private final RouteKnowledgeBase knowledgeBase;

    public RouteParser(RouteKnowledgeBase knowledgeBase) {
        this.knowledgeBase = Objects.requireNonNull(knowledgeBase, "knowledgeBase");
    }

    public ParseResult parse(ImmutableList<Token> tokens) {
        Scan scan = new Scan(tokens);
        while (scan.cursor < tokens.size()) {
            ParseNode node = parseToken(scan);
            scan.tree.add(node);

            if (node instanceof ParseNode.AirwaySegment segment) {
                // The cursor sits on the segment's "to" fix. Keep it there only when it opens
                // another airway segment; otherwise step past it so it is not emitted twice.
                if (!isAirwayAhead(scan)) {
                    scan.cursor++;
                } else {
                    LOG.debug("Chaining airway segment at junction {}", segment.to().text());
                }
            }
        }
        LOG.debug("Parsed {} tokens into {} nodes", tokens.size(), scan.tree.size());
        return new ParseResult(scan.tree.toImmutable(), scan.errors.toImmutable());
    }

    private ParseNode parseToken(Scan scan) {
        Token current = scan.peek(0);

        if (TokenPatterns.DIRECT_KEYWORD.equals(current.text())) {
            scan.cursor++;
            return new ParseNode.Direct(current);
        }

        if (isAirwayAhead(scan)) {
            return parseAirwaySegment(scan);
        }

        Matcher transition = TokenPatterns.PROCEDURE_WITH_TRANSITION.matcher(current.text());
        if (transition.matches()) {
            scan.cursor++;
            return new ParseNode.Procedure(current, transition.group(1), transition.group(2), true);
        }

        Matcher base = TokenPatterns.PROCEDURE_BASE.matcher(current.text());
        if (base.matches()) {
            scan.cursor++;
            return new ParseNode.ProcedureOrWaypoint(current, base.group(1), base.group(2));
        }

        if (TokenPatterns.COORDINATE.matcher(current.text()).matches()) {
            scan.cursor++;
            return new ParseNode.Coordinate(current);
        }

        scan.cursor++;
        return new ParseNode.Waypoint(current);
    }

    private ParseNode parseAirwaySegment(Scan scan) {
        Token from = scan.peek(0);
        Token airway = scan.peek(1);
        Token to = scan.peek(2);

        // Advance to the "to" fix, not past it; parse() decides whether it starts the next segment
        scan.cursor += 2;
        return new ParseNode.AirwaySegment(from, airway, to);
    }

    // True when the token after the cursor is an airway and a fix, not DCT, follows it
    private boolean isAirwayAhead(Scan scan) {
        Token next1 = scan.peek(1);
        Token next2 = scan.peek(2);
        if (next1 == null || next2 == null || TokenPatterns.DIRECT_KEYWORD.equals(next2.text())) {
            return false;
        }
        return TokenPatterns.AIRWAY.matcher(next1.text()).matches()
                || knowledgeBase.getTokenType(next1.text()) == TokenType.AIRWAY;
    }

    private static final class Scan {
        private final ImmutableList<Token> tokens;
        private final MutableList<ParseNode> tree = Lists.mutable.empty();
        private final MutableList<RouteDiagnostic> errors = Lists.mutable.empty();
        private int cursor;

        private Scan(ImmutableList<Token> tokens) {
            this.tokens = tokens;
        }

        private Token peek(int offset) {
            int index = cursor + offset;
            return index < tokens.size() ? tokens.get(index) : null;
        }
    }
}
