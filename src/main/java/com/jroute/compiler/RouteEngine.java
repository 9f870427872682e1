package com.jroute.compiler;

import com.jroute.kb.RouteKnowledgeBase;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs lexer, parser, resolver and expander over a route string.
 *
 * <p>Holds no per-route state, so one engine may be shared between threads as long as the
 * knowledge base is not being modified.
 */
public class RouteEngine {
    private static final Logger LOG = LoggerFactory.getLogger(RouteEngine.class);

    private final RouteLexer lexer;
    private final RouteParser parser;
    private final RouteResolver resolver;
    private final RouteExpander expander;

    public RouteEngine(RouteKnowledgeBase knowledgeBase) {
        this.lexer = new RouteLexer();
        this.parser = new RouteParser(knowledgeBase);
        this.resolver = new RouteResolver(knowledgeBase);
        this.expander = new RouteExpander(knowledgeBase);
    }

    public ExpansionResult parseAndExpand(String routeString) {
        ImmutableList<Token> tokens = lexer.tokenize(routeString);
        if (tokens.isEmpty()) {
            return ExpansionResult.empty(routeString);
        }

        ParseResult parsed = parser.parse(tokens);
        RouteContext context = RouteContext.of(tokens);
        ResolveResult resolved = resolver.resolve(parsed.tree(), context);
        ExpandResult expanded = expander.expand(resolved.tree());

        ImmutableList<RouteDiagnostic> errors = merge(parsed.errors(), resolved.errors(), expanded.errors());
        if (errors != null) {
            LOG.debug("Route '{}' compiled with {} diagnostics", routeString, errors.size());
        }
        return new ExpansionResult(routeString, tokens, parsed.tree(), resolved.tree(),
                expanded.expanded(), expanded.expanded().makeString(" "), errors);
    }

    public ValidationResult validate(String routeString) {
        ImmutableList<Token> tokens = lexer.tokenize(routeString);
        ParseResult parsed = parser.parse(tokens);
        ResolveResult resolved = resolver.resolve(parsed.tree(), RouteContext.of(tokens));

        ImmutableList<RouteDiagnostic> errors = merge(parsed.errors(), resolved.errors());
        return new ValidationResult(errors == null, tokens, errors);
    }

    @SafeVarargs
    private static ImmutableList<RouteDiagnostic> merge(ImmutableList<RouteDiagnostic>... stages) {
        MutableList<RouteDiagnostic> all = Lists.mutable.empty();
        for (ImmutableList<RouteDiagnostic> stage : stages) {
            all.addAllIterable(stage);
        }
        return all.isEmpty() ? null : all.toImmutable();
    }
}
