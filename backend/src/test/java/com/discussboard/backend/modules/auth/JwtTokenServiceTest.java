package com.discussboard.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import com.discussboard.backend.modules.auth.application.JwtTokenService;
import com.discussboard.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.discussboard.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.discussboard.backend.modules.auth.application.JwtTokenService.TokenSubject;
import com.discussboard.backend.modules.auth.domain.ActorType;
import com.discussboard.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.discussboard.backend.modules.auth.presentation.dto.AuthorizationToken;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JwtTokenServiceTest {

    private static final String SECRET = "unit-test-discussboard-secret-0123456789abcdef";

    private JwtTokenService tokenService;
    private Clock clock;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(OffsetDateTime.now(ZoneOffset.UTC).toInstant(), ZoneOffset.UTC);
        tokenService = new JwtTokenService(new JwtTokenProvider(SECRET), 3_600_000L, 604_800_000L, clock);
    }

    @Test
    void issuedAccessTokenCarriesSubjectClaims() {
        UUID accountId = UUID.randomUUID();
        UUID memberId = UUID.randomUUID();
        AuthorizationToken token = tokenService.issueTokens(
                new TokenSubject(accountId, memberId, "mod@example.com", ActorType.MODERATOR,
                        List.of("member", "moderator")),
                "refresh-1"
        );

        ParsedToken parsed = tokenService.parseAccessToken(token.access());

        assertThat(parsed.userAccountId()).isEqualTo(accountId);
        assertThat(parsed.memberId()).isEqualTo(memberId);
        assertThat(parsed.actorType()).isEqualTo(ActorType.MODERATOR);
        assertThat(parsed.roles()).containsExactly("member", "moderator");
        assertThat(token.refresh()).isEqualTo("refresh-1");
        assertThat(token.expiredAt()).isEqualTo(OffsetDateTime.now(clock).plusHours(1));
        assertThat(token.refreshableUntil()).isEqualTo(OffsetDateTime.now(clock).plusDays(7));
    }

    @Test
    void tokenSignedWithAnotherKeyIsRejected() {
        JwtTokenService other = new JwtTokenService(
                new JwtTokenProvider("another-discussboard-secret-0123456789abcdef"), 3_600_000L, 604_800_000L, clock);
        String foreign = other.issueTokens(
                new TokenSubject(UUID.randomUUID(), UUID.randomUUID(), "x@example.com", ActorType.MEMBER, List.of()),
                "r"
        ).access();

        assertThatThrownBy(() -> tokenService.parseAccessToken(foreign)).isInstanceOf(InvalidTokenException.class);
        assertThatThrownBy(() -> tokenService.parseAccessToken("not-a-jwt")).isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void refreshTokenHashIsStableHex() {
        String hash = tokenService.hashRefreshToken("token");

        assertThat(hash).hasSize(64).isEqualTo(tokenService.hashRefreshToken("token"));
        assertThat(tokenService.newRefreshToken()).isNotEqualTo(tokenService.newRefreshToken());
    }
}
