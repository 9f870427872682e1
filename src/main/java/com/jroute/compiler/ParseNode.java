package com.jroute.compiler;

public sealed interface ParseNode {

    enum Kind {
        DIRECT,
        AIRWAY_SEGMENT,
        PROCEDURE,
        PROCEDURE_OR_WAYPOINT,
        COORDINATE,
        WAYPOINT
    }

    Kind kind();

    record Direct(Token token) implements ParseNode {
        @Override
        public Kind kind() {
            return Kind.DIRECT;
        }
    }

    record AirwaySegment(Token from, Token airway, Token to) implements ParseNode {
        @Override
        public Kind kind() {
            return Kind.AIRWAY_SEGMENT;
        }
    }

    record Procedure(Token token, String transition, String procedureName, boolean explicit) implements ParseNode {
        @Override
        public Kind kind() {
            return Kind.PROCEDURE;
        }
    }

    record ProcedureOrWaypoint(Token token, String procedureName, String procedureNumber) implements ParseNode {
        @Override
        public Kind kind() {
            return Kind.PROCEDURE_OR_WAYPOINT;
        }
    }

    record Coordinate(Token token) implements ParseNode {
        @Override
        public Kind kind() {
            return Kind.COORDINATE;
        }
    }

    record Waypoint(Token token) implements ParseNode {
        @Override
        public Kind kind() {
            return Kind.WAYPOINT;
        }
    }
}
