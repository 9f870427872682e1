package com.jroute.compiler;

import com.jroute.kb.ProcedureKind;
import com.jroute.kb.TokenType;

public sealed interface ResolvedNode {

    ParseNode.Kind kind();

    boolean expand();

    // First and last fix the node stands for, null for DCT
    String leadingIdent();

    String trailingIdent();

    record Direct(Token token) implements ResolvedNode {
        @Override
        public ParseNode.Kind kind() {
            return ParseNode.Kind.DIRECT;
        }

        @Override
        public boolean expand() {
            return false;
        }

        @Override
        public String leadingIdent() {
            return null;
        }

        @Override
        public String trailingIdent() {
            return null;
        }
    }

    record AirwaySegment(Token from, Token airway, Token to) implements ResolvedNode {
        @Override
        public ParseNode.Kind kind() {
            return ParseNode.Kind.AIRWAY_SEGMENT;
        }

        @Override
        public boolean expand() {
            return true;
        }

        @Override
        public String leadingIdent() {
            return from.text();
        }

        @Override
        public String trailingIdent() {
            return to.text();
        }
    }

    record Procedure(Token token, String transition, String procedureName, boolean explicit,
                     ProcedureKind procedureKind, String lookupKey) implements ResolvedNode {

        public Procedure(Token token, String transition, String procedureName, boolean explicit,
                         ProcedureKind procedureKind) {
            this(token, transition, procedureName, explicit, procedureKind,
                    explicit ? transition + "." + procedureName : procedureName);
        }

        @Override
        public ParseNode.Kind kind() {
            return ParseNode.Kind.PROCEDURE;
        }

        @Override
        public boolean expand() {
            return true;
        }

        @Override
        public String leadingIdent() {
            return token.text();
        }

        @Override
        public String trailingIdent() {
            return token.text();
        }
    }

    record Coordinate(Token token, GeoPoint position) implements ResolvedNode {
        @Override
        public ParseNode.Kind kind() {
            return ParseNode.Kind.COORDINATE;
        }

        @Override
        public boolean expand() {
            return false;
        }

        @Override
        public String leadingIdent() {
            return token.text();
        }

        @Override
        public String trailingIdent() {
            return token.text();
        }
    }

    record Waypoint(Token token, TokenType type) implements ResolvedNode {
        @Override
        public ParseNode.Kind kind() {
            return ParseNode.Kind.WAYPOINT;
        }

        @Override
        public boolean expand() {
            return false;
        }

        @Override
        public String leadingIdent() {
            return token.text();
        }

        @Override
        public String trailingIdent() {
            return token.text();
        }
    }
}
