package com.discussboard.backend.modules.auth.domain;

/**
 * Which role an authentication flow signs in as.
 */
public enum ActorType {
    MEMBER,
    MODERATOR,
    ADMINISTRATOR
}
