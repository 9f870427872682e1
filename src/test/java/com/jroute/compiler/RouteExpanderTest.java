package com.jroute.compiler;

import com.jroute.kb.ProcedureKind;
import com.jroute.kb.TokenType;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RouteExpanderTest {

    // ============================================================
    // Test Infrastructure
    // ============================================================

    private int position;

    private Token token(String text) {
        return new Token(text, text, position++);
    }

    private ResolvedNode waypoint(String text) {
        return new ResolvedNode.Waypoint(token(text), TokenType.FIX);
    }

    private ResolvedNode airway(String from, String airway, String to) {
        return new ResolvedNode.AirwaySegment(token(from), token(airway), token(to));
    }

    private ResolvedNode arrival(String name) {
        return new ResolvedNode.Procedure(token(name), null, name, false, ProcedureKind.ARRIVAL);
    }

    private ExpandResult expand(StubKnowledgeBase knowledgeBase, ResolvedNode... nodes) {
        return new RouteExpander(knowledgeBase).expand(Lists.immutable.of(nodes));
    }

    private static ImmutableList<String> fixes(String route) {
        return Lists.immutable.of(route.split(" "));
    }

    // ============================================================
    // Airways
    // ============================================================

    @Test
    public void testAirwaySplicedAfterWaypoint() {
        StubKnowledgeBase knowledgeBase = new StubKnowledgeBase()
                .airway("GERBS", "J146", "MIP", "GERBS", "FIXO1", "FIXO2", "MIP");

        ExpandResult result = expand(knowledgeBase, waypoint("ADIME"), airway("GERBS", "J146", "MIP"));

        assertEquals(fixes("ADIME GERBS FIXO1 FIXO2 MIP"), result.expanded());
        assertTrue(result.errors().isEmpty());
    }

    @Test
    public void testSegmentJoinIsCollapsed() {
        StubKnowledgeBase knowledgeBase = new StubKnowledgeBase()
                .airway("A", "Q1", "B", "A", "X", "B")
                .airway("B", "Q2", "C", "B", "Y", "C");
        Token junction = token("B");
        ResolvedNode first = new ResolvedNode.AirwaySegment(token("A"), token("Q1"), junction);
        ResolvedNode second = new ResolvedNode.AirwaySegment(junction, token("Q2"), token("C"));

        ExpandResult result = expand(knowledgeBase, first, second);

        assertEquals(fixes("A X B Y C"), result.expanded());
    }

    @Test
    public void testFailedAirwayFallsBackToEndpoints() {
        ExpandResult result = expand(new StubKnowledgeBase(), waypoint("KORD"), airway("GERBS", "J146", "MIP"),
                waypoint("KLGA"));

        assertEquals(fixes("KORD GERBS MIP KLGA"), result.expanded());
        assertEquals(1, result.errors().size());
        RouteDiagnostic error = result.errors().getFirst();
        assertEquals(RouteDiagnostic.Stage.EXPAND, error.stage());
        assertEquals("J146", error.token());
        assertTrue(error.message().contains("J146"));
    }

    @Test
    public void testFailureDoesNotStopLaterSegments() {
        StubKnowledgeBase knowledgeBase = new StubKnowledgeBase()
                .airway("MIP", "J64", "LGA", "MIP", "HAARP", "LGA");

        ExpandResult result = expand(knowledgeBase, airway("GERBS", "J999", "MIP"), airway("MIP", "J64", "LGA"),
                arrival("NOPE1"));

        assertEquals(fixes("GERBS MIP HAARP LGA NOPE1"), result.expanded());
        assertEquals(2, result.errors().size());
        assertEquals("J999", result.errors().get(0).token());
        assertEquals("NOPE1", result.errors().get(1).token());
    }

    // ============================================================
    // Procedures
    // ============================================================

    @Test
    public void testArrivalJoinsAirwayAndSwallowsDestination() {
        StubKnowledgeBase knowledgeBase = new StubKnowledgeBase()
                .airway("GERBS", "J146", "MIP", "GERBS", "MIP")
                .procedure("MIP4", "MIP", "FIXS1", "FIXS2", "KLGA");

        ExpandResult result = expand(knowledgeBase, waypoint("KORD"), airway("GERBS", "J146", "MIP"),
                arrival("MIP4"), waypoint("KLGA"));

        assertEquals(fixes("KORD GERBS MIP FIXS1 FIXS2 KLGA"), result.expanded());
        assertEquals(Lists.immutable.of("MIP4|MIP|KLGA|KLGA"), knowledgeBase.procedureCalls.toImmutable());
    }

    @Test
    public void testExplicitTransitionKey() {
        StubKnowledgeBase knowledgeBase = new StubKnowledgeBase()
                .procedure("KAYYS.WYNDE3", "KAYYS", "WYNDE", "BAAKE", "KLGA");
        ResolvedNode procedure = new ResolvedNode.Procedure(token("KAYYS.WYNDE3"), "KAYYS", "WYNDE3", true,
                ProcedureKind.ARRIVAL);

        ExpandResult result = expand(knowledgeBase, waypoint("KORD"), procedure, waypoint("KLGA"));

        assertEquals(fixes("KORD KAYYS WYNDE BAAKE KLGA"), result.expanded());
        assertFalse(result.expanded().contains("KAYYS.WYNDE3"));
    }

    @Test
    public void testDepartureUsesFirstNodeAsAirport() {
        StubKnowledgeBase knowledgeBase = new StubKnowledgeBase()
                .procedure("ORD6", "KORD", "DENNT", "MOBLE");
        ResolvedNode departure = new ResolvedNode.Procedure(token("ORD6"), null, "ORD6", false, ProcedureKind.DEPARTURE);

        ExpandResult result = expand(knowledgeBase, waypoint("KORD"), departure, waypoint("MOBLE"), waypoint("KLGA"));

        assertEquals(fixes("KORD DENNT MOBLE KLGA"), result.expanded());
        assertEquals("ORD6|KORD|KORD|MOBLE", knowledgeBase.procedureCalls.getOnly());
    }

    @Test
    public void testFailedProcedureKeepsTokenText() {
        ResolvedNode procedure = new ResolvedNode.Procedure(token("MTHEW.CHPPR1"), "MTHEW", "CHPPR1", true,
                ProcedureKind.ARRIVAL);

        ExpandResult result = expand(new StubKnowledgeBase(), waypoint("KORD"), procedure, waypoint("KATL"));

        assertEquals(fixes("KORD MTHEW.CHPPR1 KATL"), result.expanded());
        assertEquals(1, result.errors().size());
    }

    // ============================================================
    // Terminal fixes
    // ============================================================

    @Test
    public void testDirectEmitsNothing() {
        ExpandResult result = expand(new StubKnowledgeBase(), waypoint("KORD"),
                new ResolvedNode.Direct(token("DCT")), waypoint("MOBLE"));

        assertEquals(fixes("KORD MOBLE"), result.expanded());
        assertFalse(result.expanded().contains("DCT"));
    }

    @Test
    public void testCoordinateAppendedVerbatim() {
        ResolvedNode coordinate = new ResolvedNode.Coordinate(token("4200N/08700W"), new GeoPoint(42.0, -87.0));

        ExpandResult result = expand(new StubKnowledgeBase(), waypoint("KORD"), coordinate);

        assertEquals(fixes("KORD 4200N/08700W"), result.expanded());
    }

    @Test
    public void testRepeatedLiteralWaypointsAreKept() {
        ExpandResult result = expand(new StubKnowledgeBase(), waypoint("MOBLE"), waypoint("MOBLE"));

        assertEquals(fixes("MOBLE MOBLE"), result.expanded());
    }

    @Test
    public void testEmptyTree() {
        ExpandResult result = expand(new StubKnowledgeBase());

        assertTrue(result.expanded().isEmpty());
        assertTrue(result.errors().isEmpty());
    }
}
