package com.discussboard.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.discussboard.backend.global.error.ProblemException;
import com.discussboard.backend.modules.auth.application.ActorLookupService;
import com.discussboard.backend.modules.auth.application.AuthService;
import com.discussboard.backend.modules.auth.application.AuthService.ClientInfo;
import com.discussboard.backend.modules.auth.application.JwtTokenService;
import com.discussboard.backend.modules.auth.domain.ActorType;
import com.discussboard.backend.modules.auth.domain.ConsentRecord;
import com.discussboard.backend.modules.auth.domain.JwtSession;
import com.discussboard.backend.modules.auth.domain.Member;
import com.discussboard.backend.modules.auth.domain.UserAccount;
import com.discussboard.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.discussboard.backend.modules.auth.infrastructure.persistence.AdministratorRepository;
import com.discussboard.backend.modules.auth.infrastructure.persistence.ConsentRecordRepository;
import com.discussboard.backend.modules.auth.infrastructure.persistence.JwtSessionRepository;
import com.discussboard.backend.modules.auth.infrastructure.persistence.MemberRepository;
import com.discussboard.backend.modules.auth.infrastructure.persistence.ModeratorRepository;
import com.discussboard.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.discussboard.backend.modules.auth.presentation.dto.AuthorizedActorResponse;
import com.discussboard.backend.modules.auth.presentation.dto.ConsentRequest;
import com.discussboard.backend.modules.auth.presentation.dto.LoginRequest;
import com.discussboard.backend.modules.auth.presentation.dto.MemberJoinRequest;
import com.discussboard.backend.modules.auth.presentation.dto.RefreshRequest;
import com.discussboard.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.web.server.ResponseStatusException;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    private static final ClientInfo CLIENT = new ClientInfo("junit", "127.0.0.1");

    @Mock
    private UserAccountRepository userAccountRepository;
    @Mock
    private MemberRepository memberRepository;
    @Mock
    private AdministratorRepository administratorRepository;
    @Mock
    private ModeratorRepository moderatorRepository;
    @Mock
    private ConsentRecordRepository consentRecordRepository;
    @Mock
    private JwtSessionRepository jwtSessionRepository;
    @Mock
    private ActorLookupService actorLookupService;
    @Mock
    private PasswordEncoder passwordEncoder;

    private JwtTokenService jwtTokenService;
    private AuthService authService;
    private Clock clock;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(OffsetDateTime.parse("2025-01-01T00:00:00Z").toInstant(), ZoneOffset.UTC);
        jwtTokenService = new JwtTokenService(
                new JwtTokenProvider("unit-test-discussboard-secret-0123456789abcdef"), 3_600_000L, 604_800_000L,
                clock);
        authService = new AuthService(
                userAccountRepository,
                memberRepository,
                administratorRepository,
                moderatorRepository,
                consentRecordRepository,
                jwtSessionRepository,
                actorLookupService,
                passwordEncoder,
                jwtTokenService,
                clock
        );

        lenient().when(passwordEncoder.encode(anyString())).thenAnswer(inv -> "hashed:" + inv.getArgument(0));
        lenient().when(userAccountRepository.save(any(UserAccount.class)))
                .thenAnswer(inv -> TestEntities.withId(inv.getArgument(0), UUID.randomUUID()));
        lenient().when(memberRepository.save(any(Member.class)))
                .thenAnswer(inv -> TestEntities.withId(inv.getArgument(0), UUID.randomUUID()));
        lenient().when(jwtSessionRepository.save(any(JwtSession.class))).thenAnswer(inv -> inv.getArgument(0));
        lenient().when(actorLookupService.activeRoles(any(Member.class))).thenReturn(List.of("member"));
    }

    @Test
    @DisplayName("joining stores a normalized account, the member, its consents and an open session")
    void joinMemberCreatesAccountAndSession() {
        AuthorizedActorResponse response = authService.joinMember(new MemberJoinRequest(
                "  Alice@Example.COM ",
                "member-pass-1",
                " alice ",
                List.of(
                        new ConsentRequest("privacy_policy", "v1", "granted"),
                        new ConsentRequest("terms_of_service", "v1", "granted"),
                        new ConsentRequest("marketing", "v1", "revoked")
                )
        ), CLIENT);

        assertThat(response.actorType()).isEqualTo("member");
        assertThat(response.email()).isEqualTo("alice@example.com");
        assertThat(response.nickname()).isEqualTo("alice");
        assertThat(response.actorId()).isEqualTo(response.memberId());
        assertThat(response.token().access()).isNotBlank();
        assertThat(response.token().refreshableUntil()).isEqualTo(OffsetDateTime.now(clock).plusDays(7));
        verify(consentRecordRepository, times(3)).save(any(ConsentRecord.class));

        ArgumentCaptor<JwtSession> session = ArgumentCaptor.forClass(JwtSession.class);
        verify(jwtSessionRepository).save(session.capture());
        assertThat(session.getValue().getRefreshTokenHash())
                .isEqualTo(jwtTokenService.hashRefreshToken(response.token().refresh()));
        assertThat(session.getValue().getUserAgent()).isEqualTo("junit");
    }

    @Test
    @DisplayName("joining without both required consents is rejected before anything is stored")
    void joinMemberRequiresConsents() {
        MemberJoinRequest request = new MemberJoinRequest("bob@example.com", "member-pass-1", "bob",
                List.of(new ConsentRequest("privacy_policy", "v1", "granted")));

        assertThatThrownBy(() -> authService.joinMember(request, CLIENT))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("CONSENT_REQUIRED");
        verify(userAccountRepository, never()).save(any());
    }

    @Test
    void joinMemberRejectsDuplicateEmail() {
        when(userAccountRepository.existsActiveByEmail("bob@example.com")).thenReturn(true);
        MemberJoinRequest request = new MemberJoinRequest("bob@example.com", "member-pass-1", "bob",
                List.of(new ConsentRequest("privacy_policy", "v1", "granted"),
                        new ConsentRequest("terms_of_service", "v1", "granted")));

        assertThatThrownBy(() -> authService.joinMember(request, CLIENT))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).getStatusCode()).isEqualTo(HttpStatus.CONFLICT))
                .extracting("code")
                .isEqualTo("DUPLICATE_EMAIL");
    }

    @Test
    void loginWithWrongPasswordIsUnauthorized() {
        Member member = TestEntities.member("carol");
        when(userAccountRepository.findActiveByEmail("carol@example.com"))
                .thenReturn(Optional.of(member.getUserAccount()));
        when(passwordEncoder.matches("wrong", "hash")).thenReturn(false);

        assertThatThrownBy(() -> authService.login(ActorType.MEMBER, new LoginRequest("carol@example.com", "wrong"),
                CLIENT))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("INVALID_CREDENTIALS");
    }

    @Test
    @DisplayName("refresh revokes the presented session and opens a new one")
    void refreshRotatesSession() {
        Member member = TestEntities.member("dave");
        JwtSession current = new JwtSession();
        current.setUserAccount(member.getUserAccount());
        current.setRefreshTokenHash(jwtTokenService.hashRefreshToken("old-refresh"));
        current.setIssuedAt(OffsetDateTime.now(clock).minusHours(1));
        current.setExpiresAt(OffsetDateTime.now(clock).plusDays(1));
        current.setUserAgent("browser");
        when(jwtSessionRepository.findByRefreshTokenHash(current.getRefreshTokenHash()))
                .thenReturn(Optional.of(current));
        when(memberRepository.findActiveByUserAccountId(member.getUserAccount().getId()))
                .thenReturn(Optional.of(member));

        AuthorizedActorResponse response = authService.refresh(ActorType.MEMBER, new RefreshRequest("old-refresh"),
                null);

        assertThat(current.getRevokedReason()).isEqualTo("ROTATED");
        assertThat(current.getRevokedAt()).isEqualTo(OffsetDateTime.now(clock));
        assertThat(response.token().refresh()).isNotEqualTo("old-refresh");
        verify(jwtSessionRepository).revokeExpiredSessions(eq(member.getUserAccount().getId()), any(), eq("EXPIRED"));
    }

    @Test
    void refreshWithRevokedSessionIsRejected() {
        JwtSession revoked = new JwtSession();
        revoked.setUserAccount(TestEntities.member("erin").getUserAccount());
        revoked.setExpiresAt(OffsetDateTime.now(clock).plusDays(1));
        revoked.revoke(OffsetDateTime.now(clock).minusMinutes(5), "LOGOUT");
        when(jwtSessionRepository.findByRefreshTokenHash(anyString())).thenReturn(Optional.of(revoked));

        assertThatThrownBy(() -> authService.refresh(ActorType.MEMBER, new RefreshRequest("any"), CLIENT))
                .isInstanceOf(ResponseStatusException.class)
                .extracting("reason")
                .isEqualTo("INVALID_REFRESH_TOKEN");
    }
}
