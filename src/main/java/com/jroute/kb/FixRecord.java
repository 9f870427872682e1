package com.jroute.kb;

public record FixRecord(String ident, TokenType type, Double latitude, Double longitude) {

    public FixRecord {
        if (type != null && !type.isFix()) {
            throw new IllegalArgumentException("Not a fix type: " + type);
        }
    }

    public boolean hasPosition() {
        return latitude != null && longitude != null;
    }
}
