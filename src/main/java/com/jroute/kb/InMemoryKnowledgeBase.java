package com.jroute.kb;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class InMemoryKnowledgeBase implements RouteKnowledgeBase {
    private static final Logger LOG = LoggerFactory.getLogger(InMemoryKnowledgeBase.class);

    private static final double EARTH_RADIUS_NM = 3440.065;

    private final ImmutableMap<String, FixRecord> fixes;
    private final ImmutableMap<String, ImmutableList<String>> airways;
    private final ImmutableMap<String, ProcedureDefinition> procedures;

    private InMemoryKnowledgeBase(Builder builder) {
        this.fixes = builder.fixes.toImmutable();
        this.airways = builder.airways.toImmutable();
        this.procedures = builder.procedures.toImmutable();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static InMemoryKnowledgeBase empty() {
        return builder().build();
    }

    public int fixCount() {
        return fixes.size();
    }

    public int airwayCount() {
        return airways.size();
    }

    public int procedureCount() {
        return procedures.valuesView().toSet().size();
    }

    public FixRecord fix(String ident) {
        return fixes.get(ident);
    }

    @Override
    public TokenType getTokenType(String text) {
        if (text == null) {
            return null;
        }
        FixRecord fix = fixes.get(text);
        if (fix != null) {
            return fix.type();
        }
        if (airways.containsKey(text)) {
            return TokenType.AIRWAY;
        }
        if (procedures.containsKey(text)) {
            return TokenType.PROCEDURE;
        }
        return null;
    }

    @Override
    public AirwayExpansion expandAirway(String fromIdent, String airwayIdent, String toIdent) {
        ImmutableList<String> path = airways.get(airwayIdent);
        if (path == null) {
            return AirwayExpansion.failed("Airway " + airwayIdent + " not found");
        }
        int fromIdx = path.indexOf(fromIdent);
        if (fromIdx == -1) {
            return AirwayExpansion.failed(fromIdent + " not on " + airwayIdent);
        }
        int toIdx = path.indexOf(toIdent);
        if (toIdx == -1) {
            return AirwayExpansion.failed(toIdent + " not on " + airwayIdent);
        }

        if (fromIdx <= toIdx) {
            return AirwayExpansion.of(Lists.immutable.ofAll(path.castToList().subList(fromIdx, toIdx + 1)));
        }
        // Flown against the published direction
        return AirwayExpansion.of(Lists.immutable.ofAll(path.castToList().subList(toIdx, fromIdx + 1)).toReversed());
    }

    @Override
    public ProcedureExpansion expandProcedure(String key, String previousFix, String contextAirport, String nextFix) {
        if (key == null || key.isEmpty()) {
            return ProcedureExpansion.failed();
        }

        String transitionName = null;
        String procedureName = key;
        ProcedureDefinition procedure = lookup(key, contextAirport);
        int dot = key.indexOf('.');
        if (procedure == null && dot > 0) {
            transitionName = key.substring(0, dot);
            procedureName = key.substring(dot + 1);
            procedure = lookup(procedureName, contextAirport);
        }
        if (procedure == null) {
            LOG.debug("No procedure registered for key {}", key);
            return ProcedureExpansion.failed();
        }

        if (transitionName != null) {
            ProcedureTransition transition = procedure.transition(transitionName);
            if (transition == null) {
                LOG.warn("Transition {} not found for {}", transitionName, procedureName);
                return ProcedureExpansion.failed();
            }
            return ProcedureExpansion.of(procedure.assemble(transition), transition.name());
        }

        ProcedureTransition best = selectTransition(procedure, previousFix, nextFix);
        return ProcedureExpansion.of(procedure.assemble(best), best != null ? best.name() : null);
    }

    @Override
    public ProcedureKind procedureKind(String procedureName) {
        ProcedureDefinition procedure = procedures.get(procedureName);
        return procedure != null ? procedure.kind() : null;
    }

    private ProcedureDefinition lookup(String name, String contextAirport) {
        if (contextAirport != null) {
            ProcedureDefinition scoped = procedures.get(contextAirport + "." + name);
            if (scoped != null) {
                return scoped;
            }
        }
        return procedures.get(name);
    }

    // Nearest transition to the previous fix (arrival) or next fix (departure); null means body only
    private ProcedureTransition selectTransition(ProcedureDefinition procedure, String previousFix, String nextFix) {
        boolean departure = procedure.kind() == ProcedureKind.DEPARTURE;
        String anchorIdent = departure ? nextFix : previousFix;
        if (procedure.transitions().isEmpty() || anchorIdent == null || procedure.body().isEmpty()) {
            return null;
        }
        String joinFix = departure ? procedure.body().getLast() : procedure.body().getFirst();
        if (anchorIdent.equals(joinFix)) {
            return null;
        }

        ProcedureTransition exact = procedure.transitions()
                .detect(t -> anchorIdent.equals(departure ? t.exitFix() : t.entryFix()));
        if (exact != null) {
            return exact;
        }

        FixRecord anchor = fixes.get(anchorIdent);
        if (anchor == null || !anchor.hasPosition()) {
            return null;
        }

        ProcedureTransition best = null;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (ProcedureTransition transition : procedure.transitions()) {
            FixRecord endpoint = fixes.get(departure ? transition.exitFix() : transition.entryFix());
            if (endpoint == null || !endpoint.hasPosition()) {
                continue;
            }
            double distance = greatCircleNm(anchor, endpoint);
            if (distance < bestDistance) {
                bestDistance = distance;
                best = transition;
            }
        }
        return best;
    }

    private static double greatCircleNm(FixRecord a, FixRecord b) {
        double lat1 = Math.toRadians(a.latitude());
        double lat2 = Math.toRadians(b.latitude());
        double dLat = lat2 - lat1;
        double dLon = Math.toRadians(b.longitude() - a.longitude());
        double h = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(lat1) * Math.cos(lat2) * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        return 2 * EARTH_RADIUS_NM * Math.atan2(Math.sqrt(h), Math.sqrt(1 - h));
    }

    public static final class Builder {
        private final MutableMap<String, FixRecord> fixes = Maps.mutable.empty();
        private final MutableMap<String, ImmutableList<String>> airways = Maps.mutable.empty();
        private final MutableMap<String, ProcedureDefinition> procedures = Maps.mutable.empty();

        private Builder() {
        }

        public Builder fix(String ident, TokenType type) {
            return fix(new FixRecord(ident, type, null, null));
        }

        public Builder fix(String ident, TokenType type, double latitude, double longitude) {
            return fix(new FixRecord(ident, type, latitude, longitude));
        }

        public Builder fix(FixRecord fix) {
            fixes.put(fix.ident(), fix);
            return this;
        }

        public Builder airway(String ident, String... path) {
            return airway(ident, Lists.immutable.of(path));
        }

        public Builder airway(String ident, ImmutableList<String> path) {
            airways.put(ident, path);
            return this;
        }

        public Builder procedure(ProcedureDefinition procedure) {
            procedures.put(procedure.name(), procedure);
            if (procedure.airport() != null) {
                procedures.put(procedure.airport() + "." + procedure.name(), procedure);
            }
            return this;
        }

        public ProcedureBuilder procedure(String name, ProcedureKind kind, String airport) {
            return new ProcedureBuilder(this, name, kind, airport);
        }

        public InMemoryKnowledgeBase build() {
            return new InMemoryKnowledgeBase(this);
        }
    }

    public static final class ProcedureBuilder {
        private final Builder owner;
        private final String name;
        private final ProcedureKind kind;
        private final String airport;
        private ImmutableList<String> body = Lists.immutable.empty();
        private final MutableList<ProcedureTransition> transitions = Lists.mutable.empty();

        private ProcedureBuilder(Builder owner, String name, ProcedureKind kind, String airport) {
            this.owner = owner;
            this.name = name;
            this.kind = kind;
            this.airport = airport;
        }

        public ProcedureBuilder body(String... fixes) {
            this.body = Lists.immutable.of(fixes);
            return this;
        }

        public ProcedureBuilder transition(String transitionName, String... fixes) {
            transitions.add(new ProcedureTransition(transitionName, Lists.immutable.of(fixes)));
            return this;
        }

        public Builder add() {
            return owner.procedure(new ProcedureDefinition(name, kind, airport, body, transitions.toImmutable()));
        }
    }
}
