package com.jroute.kb;

public enum TokenType {
    AIRPORT,
    NAVAID,
    FIX,
    AIRWAY,
    PROCEDURE;

    public boolean isFix() {
        return this == AIRPORT || this == NAVAID || this == FIX;
    }
}
