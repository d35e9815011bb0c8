package com.flagship.pledge_ledger.ledger;

public enum ActorRole {
    ADMIN,
    OPERATOR;

    public static ActorRole fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Actor role is required");
        }
        try {
            return valueOf(code.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown actor role: " + code);
        }
    }
}
