package com.jroute.compiler;

import com.jroute.kb.InMemoryKnowledgeBase;
import com.jroute.kb.ProcedureKind;
import com.jroute.kb.RouteKnowledgeBase;
import com.jroute.kb.TokenType;
import org.eclipse.collections.api.list.ImmutableList;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class RouteResolverTest {

    private ResolveResult resolve(RouteKnowledgeBase knowledgeBase, String route) {
        ImmutableList<Token> tokens = new RouteLexer().tokenize(route);
        ParseResult parsed = new RouteParser(knowledgeBase).parse(tokens);
        return new RouteResolver(knowledgeBase).resolve(parsed.tree(), RouteContext.of(tokens));
    }

    private InMemoryKnowledgeBase airportsOnly() {
        return InMemoryKnowledgeBase.builder()
                .fix("KORD", TokenType.AIRPORT)
                .fix("KLGA", TokenType.AIRPORT)
                .build();
    }

    @Test
    public void testKnownProcedureBecomesProcedure() {
        StubKnowledgeBase knowledgeBase = new StubKnowledgeBase()
                .type("KORD", TokenType.AIRPORT)
                .type("KLGA", TokenType.AIRPORT)
                .type("MIP4", TokenType.PROCEDURE);

        ResolveResult result = resolve(knowledgeBase, "KORD MIP MIP4 KLGA");

        assertTrue(result.tree().get(2) instanceof ResolvedNode.Procedure);
        ResolvedNode.Procedure procedure = (ResolvedNode.Procedure) result.tree().get(2);
        assertEquals("MIP4", procedure.procedureName());
        assertFalse(procedure.explicit());
        assertNull(procedure.transition());
        assertTrue(procedure.expand());
        // MIP is unknown to the stub
        assertEquals(1, result.errors().size());
        assertEquals("MIP", result.errors().getFirst().token());
    }

    @Test
    public void testKnownFixBecomesTypedWaypoint() {
        ResolveResult result = resolve(airportsOnly(), "KORD KLGA");

        assertTrue(result.errors().isEmpty());
        ResolvedNode.Waypoint departure = (ResolvedNode.Waypoint) result.tree().get(0);
        assertEquals(TokenType.AIRPORT, departure.type());
        assertFalse(departure.expand());
    }

    @Test
    public void testUnknownWordFallsBackToWaypointWithDiagnostic() {
        ResolveResult result = resolve(airportsOnly(), "KORD ZZYZX KLGA");

        ResolvedNode.Waypoint unknown = (ResolvedNode.Waypoint) result.tree().get(1);
        assertNull(unknown.type());
        assertEquals(1, result.errors().size());
        RouteDiagnostic diagnostic = result.errors().getFirst();
        assertEquals(RouteDiagnostic.Stage.RESOLVE, diagnostic.stage());
        assertEquals("ZZYZX", diagnostic.token());
        assertEquals(1, diagnostic.index());
    }

    @Test
    public void testProcedureMatchWinsOverFixMatch() {
        InMemoryKnowledgeBase knowledgeBase = InMemoryKnowledgeBase.builder()
                .fix("KORD", TokenType.AIRPORT)
                .fix("KLGA", TokenType.AIRPORT)
                .fix("WYNDE3", TokenType.FIX)
                .procedure("WYNDE3", ProcedureKind.ARRIVAL, "KLGA").body("WYNDE", "KLGA").add()
                .build();

        ResolveResult result = resolve(knowledgeBase, "KORD WYNDE3 KLGA");

        ResolvedNode.Procedure procedure = (ResolvedNode.Procedure) result.tree().get(1);
        assertEquals(ProcedureKind.ARRIVAL, procedure.procedureKind());
        assertTrue(result.errors().isEmpty());
    }

    @Test
    public void testAirportQualifiedCandidate() {
        StubKnowledgeBase knowledgeBase = new StubKnowledgeBase()
                .type("KORD", TokenType.AIRPORT)
                .type("KLGA", TokenType.AIRPORT)
                .type("MOBLE", TokenType.FIX)
                .type("ADIME", TokenType.FIX)
                .type("GERBS", TokenType.FIX)
                .type("KLGA.HOLDZ2", TokenType.PROCEDURE);

        ResolveResult result = resolve(knowledgeBase, "KORD MOBLE ADIME GERBS HOLDZ2 KLGA");

        assertTrue(result.errors().isEmpty());
        ResolvedNode.Procedure procedure = (ResolvedNode.Procedure) result.tree().get(4);
        assertEquals(ProcedureKind.ARRIVAL, procedure.procedureKind());
        assertEquals("KLGA.HOLDZ2", procedure.lookupKey());
    }

    @Test
    public void testStemQualifiedCandidate() {
        StubKnowledgeBase knowledgeBase = new StubKnowledgeBase()
                .type("KORD", TokenType.AIRPORT)
                .type("CHPPR.CHPPR1", TokenType.PROCEDURE);

        ResolveResult result = resolve(knowledgeBase, "KORD CHPPR1");

        assertEquals(ParseNode.Kind.PROCEDURE, result.tree().get(1).kind());
        assertEquals("CHPPR.CHPPR1", ((ResolvedNode.Procedure) result.tree().get(1)).lookupKey());
    }

    @Test
    public void testDepartureSideUsesDepartureAirport() {
        StubKnowledgeBase knowledgeBase = new StubKnowledgeBase()
                .type("KORD", TokenType.AIRPORT)
                .type("KLGA", TokenType.AIRPORT)
                .type("MOBLE", TokenType.FIX)
                .type("GERBS", TokenType.FIX)
                .type("KORD.ORD6", TokenType.PROCEDURE);

        ResolveResult result = resolve(knowledgeBase, "KORD ORD6 MOBLE GERBS KLGA");

        ResolvedNode.Procedure procedure = (ResolvedNode.Procedure) result.tree().get(1);
        assertEquals(ProcedureKind.DEPARTURE, procedure.procedureKind());
        assertTrue(result.errors().isEmpty());
    }

    @Test
    public void testExplicitProcedurePassesThrough() {
        ResolveResult result = resolve(airportsOnly(), "KORD KAYYS.WYNDE3 KLGA");

        ResolvedNode.Procedure procedure = (ResolvedNode.Procedure) result.tree().get(1);
        assertTrue(procedure.explicit());
        assertEquals("KAYYS.WYNDE3", procedure.lookupKey());
        assertTrue(result.errors().isEmpty());
    }

    @Test
    public void testAirwaySegmentAndDirectPassThrough() {
        ResolveResult result = resolve(airportsOnly(), "KORD DCT GERBS J146 MIP");

        assertEquals(ParseNode.Kind.DIRECT, result.tree().get(1).kind());
        assertFalse(result.tree().get(1).expand());
        ResolvedNode.AirwaySegment segment = (ResolvedNode.AirwaySegment) result.tree().get(2);
        assertEquals("GERBS", segment.leadingIdent());
        assertEquals("MIP", segment.trailingIdent());
        assertTrue(segment.expand());
    }

    @ParameterizedTest
    @CsvSource({
        "4814N/06848W, 48.233333, -68.8",
        "4814/06848, 48.233333, 68.8",
        "481530S/0684500W, -48.258333, -68.75",
        "0000N/00000E, 0.0, 0.0"
    })
    public void testCoordinateDecoding(String text, double lat, double lon) {
        ResolveResult result = resolve(airportsOnly(), text);

        ResolvedNode.Coordinate coordinate = (ResolvedNode.Coordinate) result.tree().getFirst();
        assertNotNull(coordinate.position());
        assertEquals(lat, coordinate.position().latitude(), 0.0001);
        assertEquals(lon, coordinate.position().longitude(), 0.0001);
        assertTrue(result.errors().isEmpty());
    }

    @ParameterizedTest
    @ValueSource(strings = {"4860N/06848W", "9130N/06848W", "48145/06848", "4814/068480", "4814N/18100W"})
    public void testOutOfRangeCoordinateIsReported(String text) {
        ResolveResult result = resolve(airportsOnly(), text);

        ResolvedNode.Coordinate coordinate = (ResolvedNode.Coordinate) result.tree().getFirst();
        assertNull(coordinate.position());
        assertEquals(1, result.errors().size());
        assertEquals(RouteDiagnostic.Stage.RESOLVE, result.errors().getFirst().stage());
    }
}
