package com.discussboard.backend.modules.auth.presentation.dto;

import java.util.List;
import java.util.UUID;

public record AuthorizedActorResponse(
        String actorType,
        UUID actorId,
        UUID userAccountId,
        UUID memberId,
        String email,
        String nickname,
        List<String> roles,
        AuthorizationToken token
) {
}
