package com.jroute.compiler;

import java.util.regex.Pattern;

final class TokenPatterns {
    static final Pattern PROCEDURE_WITH_TRANSITION = Pattern.compile("^([A-Z]{3,})\\.([A-Z]{3,}\\d*)$");

    static final Pattern PROCEDURE_BASE = Pattern.compile("^([A-Z]{3,})(\\d*)$");

    static final Pattern AIRWAY = Pattern.compile("^[JVQTABGR]\\d+$");

    // 4814N/06848W, optionally with seconds
    static final Pattern COORDINATE = Pattern.compile("^(\\d{4,6})([NS])?/(\\d{5,7})([EW])?$");

    static final String DIRECT_KEYWORD = "DCT";

    private TokenPatterns() {
    }
}
