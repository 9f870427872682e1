package com.jroute.kb;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;

/**
 * Reads an {@link InMemoryKnowledgeBase} from a JSON document of the form
 * <pre>
 * {
 *   "fixes":      [{"ident": "KLGA", "type": "AIRPORT", "lat": 40.77, "lon": -73.87}],
 *   "airways":    {"J146": ["GERBS", "MIP"]},
 *   "procedures": [{"name": "WYNDE3", "kind": "ARRIVAL", "airport": "KLGA",
 *                   "body": ["WYNDE", "KLGA"],
 *                   "transitions": [{"name": "KAYYS", "fixes": ["KAYYS", "WYNDE"]}]}]
 * }
 * </pre>
 * Unknown top-level fields are skipped.
 */
public class KnowledgeBaseLoader {
    private static final Logger LOG = LoggerFactory.getLogger(KnowledgeBaseLoader.class);

    private final JsonFactory factory = new JsonFactory();

    public InMemoryKnowledgeBase load(InputStream input) throws IOException {
        InMemoryKnowledgeBase.Builder builder = InMemoryKnowledgeBase.builder();
        try (JsonParser parser = factory.createParser(input)) {
            expect(parser, parser.nextToken(), JsonToken.START_OBJECT);
            while (parser.nextToken() != JsonToken.END_OBJECT) {
                String section = parser.getCurrentName();
                JsonToken token = parser.nextToken();
                switch (section) {
                    case "fixes" -> parseFixes(parser, token, builder);
                    case "airways" -> parseAirways(parser, token, builder);
                    case "procedures" -> parseProcedures(parser, token, builder);
                    default -> {
                        LOG.debug("Skipping unknown knowledge base section {}", section);
                        parser.skipChildren();
                    }
                }
            }
        }
        InMemoryKnowledgeBase knowledgeBase = builder.build();
        LOG.info("Loaded knowledge base: {} fixes, {} airways, {} procedures",
                knowledgeBase.fixCount(), knowledgeBase.airwayCount(), knowledgeBase.procedureCount());
        return knowledgeBase;
    }

    private void parseFixes(JsonParser parser, JsonToken token, InMemoryKnowledgeBase.Builder builder) throws IOException {
        expect(parser, token, JsonToken.START_ARRAY);
        while (parser.nextToken() != JsonToken.END_ARRAY) {
            expect(parser, parser.currentToken(), JsonToken.START_OBJECT);
            String ident = null;
            TokenType type = TokenType.FIX;
            Double lat = null;
            Double lon = null;
            while (parser.nextToken() != JsonToken.END_OBJECT) {
                String field = parser.getCurrentName();
                JsonToken value = parser.nextToken();
                switch (field) {
                    case "ident" -> ident = upper(parser.getText());
                    case "type" -> type = parseEnum(parser, TokenType.class);
                    case "lat" -> lat = number(parser, value);
                    case "lon" -> lon = number(parser, value);
                    default -> parser.skipChildren();
                }
            }
            if (ident == null) {
                throw new IOException("Fix without ident at " + parser.getCurrentLocation());
            }
            if (!type.isFix()) {
                throw new IOException("Fix " + ident + " has non-fix type " + type);
            }
            builder.fix(new FixRecord(ident, type, lat, lon));
        }
    }

    private void parseAirways(JsonParser parser, JsonToken token, InMemoryKnowledgeBase.Builder builder) throws IOException {
        expect(parser, token, JsonToken.START_OBJECT);
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String ident = upper(parser.getCurrentName());
            builder.airway(ident, parseIdentList(parser, parser.nextToken()));
        }
    }

    private void parseProcedures(JsonParser parser, JsonToken token, InMemoryKnowledgeBase.Builder builder) throws IOException {
        expect(parser, token, JsonToken.START_ARRAY);
        while (parser.nextToken() != JsonToken.END_ARRAY) {
            expect(parser, parser.currentToken(), JsonToken.START_OBJECT);
            String name = null;
            ProcedureKind kind = ProcedureKind.ARRIVAL;
            String airport = null;
            ImmutableList<String> body = Lists.immutable.empty();
            MutableList<ProcedureTransition> transitions = Lists.mutable.empty();
            while (parser.nextToken() != JsonToken.END_OBJECT) {
                String field = parser.getCurrentName();
                JsonToken value = parser.nextToken();
                switch (field) {
                    case "name" -> name = upper(parser.getText());
                    case "kind" -> kind = parseEnum(parser, ProcedureKind.class);
                    case "airport" -> airport = value == JsonToken.VALUE_NULL ? null : upper(parser.getText());
                    case "body" -> body = parseIdentList(parser, value);
                    case "transitions" -> parseTransitions(parser, value, transitions);
                    default -> parser.skipChildren();
                }
            }
            if (name == null) {
                throw new IOException("Procedure without name at " + parser.getCurrentLocation());
            }
            builder.procedure(new ProcedureDefinition(name, kind, airport, body, transitions.toImmutable()));
        }
    }

    private void parseTransitions(JsonParser parser, JsonToken token, MutableList<ProcedureTransition> into) throws IOException {
        expect(parser, token, JsonToken.START_ARRAY);
        while (parser.nextToken() != JsonToken.END_ARRAY) {
            expect(parser, parser.currentToken(), JsonToken.START_OBJECT);
            String name = null;
            ImmutableList<String> fixes = Lists.immutable.empty();
            while (parser.nextToken() != JsonToken.END_OBJECT) {
                String field = parser.getCurrentName();
                JsonToken value = parser.nextToken();
                switch (field) {
                    case "name" -> name = upper(parser.getText());
                    case "fixes" -> fixes = parseIdentList(parser, value);
                    default -> parser.skipChildren();
                }
            }
            if (name == null) {
                throw new IOException("Transition without name at " + parser.getCurrentLocation());
            }
            into.add(new ProcedureTransition(name, fixes));
        }
    }

    private ImmutableList<String> parseIdentList(JsonParser parser, JsonToken token) throws IOException {
        expect(parser, token, JsonToken.START_ARRAY);
        MutableList<String> idents = Lists.mutable.empty();
        while (true) {
            JsonToken next = parser.nextToken();
            if (next == JsonToken.END_ARRAY) {
                break;
            }
            expect(parser, next, JsonToken.VALUE_STRING);
            idents.add(upper(parser.getText()));
        }
        return idents.toImmutable();
    }

    private static Double number(JsonParser parser, JsonToken token) throws IOException {
        return switch (token) {
            case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getDoubleValue();
            case VALUE_NULL -> null;
            default -> throw new IOException("Expected number but got " + token + " at " + parser.getCurrentLocation());
        };
    }

    private static <E extends Enum<E>> E parseEnum(JsonParser parser, Class<E> type) throws IOException {
        String text = parser.getText();
        try {
            return Enum.valueOf(type, upper(text));
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid " + type.getSimpleName() + ": " + text, e);
        }
    }

    private static void expect(JsonParser parser, JsonToken actual, JsonToken expected) throws IOException {
        if (actual != expected) {
            throw new IOException("Expected " + expected + " but got " + actual + " at " + parser.getCurrentLocation());
        }
    }

    private static String upper(String text) {
        return text.trim().toUpperCase(Locale.ROOT);
    }
}
