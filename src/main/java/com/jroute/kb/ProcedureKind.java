package com.jroute.kb;

public enum ProcedureKind {
    DEPARTURE,  // SID / DP
    ARRIVAL     // STAR
}
