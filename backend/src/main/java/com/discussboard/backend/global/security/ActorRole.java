package com.discussboard.backend.global.security;

/**
 * Role codes carried in access tokens and mapped to {@code ROLE_*} authorities.
 */
public final class ActorRole {

    public static final String MEMBER = "MEMBER";
    public static final String MODERATOR = "MODERATOR";
    public static final String ADMINISTRATOR = "ADMINISTRATOR";

    private ActorRole() {
    }
}
