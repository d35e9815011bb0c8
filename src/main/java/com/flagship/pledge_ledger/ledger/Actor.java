package com.flagship.pledge_ledger.ledger;

import lombok.Value;

/**
 * The authenticated caller behind a mutation, as passed in by the gateway.
 * Used for audit attribution and the operator edit restrictions only.
 */
@Value
public class Actor {

    public static final String ID_HEADER = "X-Actor-Id";
    public static final String NAME_HEADER = "X-Actor-Name";
    public static final String ROLE_HEADER = "X-Actor-Role";

    long id;
    String name;
    ActorRole role;

    public static Actor of(long id, String name, ActorRole role) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Actor name is required");
        }
        if (role == null) {
            throw new IllegalArgumentException("Actor role is required");
        }
        return new Actor(id, name, role);
    }

    /**
     * Builds the actor from the raw header values.
     */
    public static Actor fromHeaders(long id, String name, String role) {
        return of(id, name, ActorRole.fromCode(role));
    }

    public boolean isAdmin() {
        return role == ActorRole.ADMIN;
    }
}
