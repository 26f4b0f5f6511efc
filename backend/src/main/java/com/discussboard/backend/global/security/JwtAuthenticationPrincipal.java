package com.discussboard.backend.global.security;

import java.util.List;
import java.util.UUID;

public record JwtAuthenticationPrincipal(UUID userAccountId, UUID memberId, String email, List<String> roles) {
}
