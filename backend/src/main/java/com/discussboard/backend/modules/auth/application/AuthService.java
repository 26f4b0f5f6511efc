package com.discussboard.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import com.discussboard.backend.global.common.EnumValues;
import com.discussboard.backend.global.error.ProblemException;
import com.discussboard.backend.modules.auth.domain.AccountStatus;
import com.discussboard.backend.modules.auth.domain.ActorType;
import com.discussboard.backend.modules.auth.domain.Administrator;
import com.discussboard.backend.modules.auth.domain.ConsentAction;
import com.discussboard.backend.modules.auth.domain.ConsentRecord;
import com.discussboard.backend.modules.auth.domain.JwtSession;
import com.discussboard.backend.modules.auth.domain.Member;
import com.discussboard.backend.modules.auth.domain.MemberStatus;
import com.discussboard.backend.modules.auth.domain.Moderator;
import com.discussboard.backend.modules.auth.domain.StaffStatus;
import com.discussboard.backend.modules.auth.domain.UserAccount;
import com.discussboard.backend.modules.auth.application.JwtTokenService.TokenSubject;
import com.discussboard.backend.modules.auth.infrastructure.persistence.AdministratorRepository;
import com.discussboard.backend.modules.auth.infrastructure.persistence.ConsentRecordRepository;
import com.discussboard.backend.modules.auth.infrastructure.persistence.JwtSessionRepository;
import com.discussboard.backend.modules.auth.infrastructure.persistence.MemberRepository;
import com.discussboard.backend.modules.auth.infrastructure.persistence.ModeratorRepository;
import com.discussboard.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.discussboard.backend.modules.auth.presentation.dto.AdministratorJoinRequest;
import com.discussboard.backend.modules.auth.presentation.dto.AuthorizationToken;
import com.discussboard.backend.modules.auth.presentation.dto.AuthorizedActorResponse;
import com.discussboard.backend.modules.auth.presentation.dto.ConsentRequest;
import com.discussboard.backend.modules.auth.presentation.dto.LoginRequest;
import com.discussboard.backend.modules.auth.presentation.dto.LogoutRequest;
import com.discussboard.backend.modules.auth.presentation.dto.MemberJoinRequest;
import com.discussboard.backend.modules.auth.presentation.dto.ModeratorJoinRequest;
import com.discussboard.backend.modules.auth.presentation.dto.ModeratorResponse;
import com.discussboard.backend.modules.auth.presentation.dto.RefreshRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    static final String REASON_EXPIRED = "EXPIRED";
    static final String REASON_ROTATED = "ROTATED";
    static final String REASON_LOGOUT = "LOGOUT";
    static final String REASON_USER_INACTIVE = "USER_INACTIVE";
    static final Set<String> REQUIRED_CONSENTS = Set.of("privacy_policy", "terms_of_service");
    private static final int USER_AGENT_MAX_LENGTH = 512;
    private static final int IP_ADDRESS_MAX_LENGTH = 64;

    private final UserAccountRepository userAccountRepository;
    private final MemberRepository memberRepository;
    private final AdministratorRepository administratorRepository;
    private final ModeratorRepository moderatorRepository;
    private final ConsentRecordRepository consentRecordRepository;
    private final JwtSessionRepository jwtSessionRepository;
    private final ActorLookupService actorLookupService;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;
    private final Clock clock;

    public AuthService(
            UserAccountRepository userAccountRepository,
            MemberRepository memberRepository,
            AdministratorRepository administratorRepository,
            ModeratorRepository moderatorRepository,
            ConsentRecordRepository consentRecordRepository,
            JwtSessionRepository jwtSessionRepository,
            ActorLookupService actorLookupService,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService,
            Clock clock
    ) {
        this.userAccountRepository = userAccountRepository;
        this.memberRepository = memberRepository;
        this.administratorRepository = administratorRepository;
        this.moderatorRepository = moderatorRepository;
        this.consentRecordRepository = consentRecordRepository;
        this.jwtSessionRepository = jwtSessionRepository;
        this.actorLookupService = actorLookupService;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
        this.clock = clock;
    }

    public AuthorizedActorResponse joinMember(MemberJoinRequest request, ClientInfo client) {
        PasswordPolicy.checkMemberPassword(request.password());
        List<ConsentRecord> consents = toConsentRecords(request.consent());

        UserAccount account = createAccount(request.email(), request.password(), request.nickname());
        Member member = createMember(account, request.nickname());

        for (ConsentRecord record : consents) {
            record.setUserAccount(account);
            consentRecordRepository.save(record);
        }

        log.info("Member {} joined with account {}", member.getId(), account.getId());
        return openSession(ActorType.MEMBER, member.getId(), account, member, client);
    }

    public AuthorizedActorResponse joinAdministrator(AdministratorJoinRequest request, ClientInfo client) {
        PasswordPolicy.checkAdministratorPassword(request.password());

        UserAccount account = createAccount(request.email(), request.password(), request.nickname());
        Member member = createMember(account, request.nickname());

        OffsetDateTime now = OffsetDateTime.now(clock);
        Administrator administrator = new Administrator();
        administrator.setMember(member);
        administrator.setEscalatedAt(now);
        administrator.setStatus(StaffStatus.ACTIVE);
        administrator = administratorRepository.save(administrator);
        // bootstrap administrators escalate themselves
        administrator.setEscalatedBy(administrator);

        log.info("Administrator {} joined with account {}", administrator.getId(), account.getId());
        return openSession(ActorType.ADMINISTRATOR, administrator.getId(), account, member, client);
    }

    public ModeratorResponse joinModerator(UUID callerMemberId, ModeratorJoinRequest request) {
        Administrator assigner = actorLookupService.requireAdministrator(callerMemberId);
        Member member = memberRepository.findActiveById(request.memberId())
                .orElseThrow(() -> ProblemException.notFound("MEMBER_NOT_FOUND", "Member not found"));
        if (!member.isActive()) {
            throw ProblemException.conflict("MEMBER_NOT_ACTIVE", "Only active members can become moderators");
        }
        if (moderatorRepository.findCurrentByMemberId(member.getId()).isPresent()) {
            throw ProblemException.conflict("DUPLICATE_MODERATOR", "Member is already a moderator");
        }

        Moderator moderator = new Moderator();
        moderator.setMember(member);
        moderator.setAssignedBy(assigner);
        moderator.setAssignedAt(OffsetDateTime.now(clock));
        moderator.setStatus(StaffStatus.ACTIVE);
        moderator = moderatorRepository.save(moderator);

        log.info("Administrator {} assigned moderator {} to member {}", assigner.getId(), moderator.getId(),
                member.getId());
        return ModeratorResponse.from(moderator);
    }

    public AuthorizedActorResponse login(ActorType actorType, LoginRequest request, ClientInfo client) {
        UserAccount account = userAccountRepository.findActiveByEmail(normalizeEmail(request.email()))
                .orElseThrow(() -> invalidCredentials(request.email()));

        if (!passwordEncoder.matches(request.password(), account.getPasswordHash())) {
            throw invalidCredentials(request.email());
        }
        if (account.getStatus() != AccountStatus.ACTIVE) {
            throw ProblemException.forbidden("ACCOUNT_NOT_ACTIVE", "Account is " + EnumValues.wire(account.getStatus()));
        }

        Member member = memberRepository.findActiveByUserAccountId(account.getId())
                .orElseThrow(() -> ProblemException.forbidden("MEMBER_NOT_FOUND", "No member profile for account"));
        if (!member.isActive()) {
            throw ProblemException.forbidden("MEMBER_NOT_ACTIVE", "Member is " + EnumValues.wire(member.getStatus()));
        }

        UUID actorId = resolveActorId(actorType, member);
        OffsetDateTime now = OffsetDateTime.now(clock);
        account.setLastLoginAt(now);
        jwtSessionRepository.revokeExpiredSessions(account.getId(), now, REASON_EXPIRED);

        return openSession(actorType, actorId, account, member, client);
    }

    public AuthorizedActorResponse refresh(ActorType actorType, RefreshRequest request, ClientInfo client) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        String hash = jwtTokenService.hashRefreshToken(request.refreshToken());
        JwtSession session = jwtSessionRepository.findByRefreshTokenHash(hash)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "INVALID_REFRESH_TOKEN"));

        if (session.getRevokedAt() != null || session.isDeleted()) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "INVALID_REFRESH_TOKEN");
        }

        if (!session.getExpiresAt().isAfter(now)) {
            session.revoke(now, REASON_EXPIRED);
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "REFRESH_TOKEN_EXPIRED");
        }

        UserAccount account = session.getUserAccount();
        Member member = memberRepository.findActiveByUserAccountId(account.getId()).orElse(null);
        if (!account.isActive() || member == null || !member.isActive()) {
            session.revoke(now, REASON_USER_INACTIVE);
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "USER_INACTIVE");
        }

        UUID actorId = resolveActorId(actorType, member);

        // rotation: the presented token can never be used again
        session.revoke(now, REASON_ROTATED);
        jwtSessionRepository.revokeExpiredSessions(account.getId(), now, REASON_EXPIRED);

        ClientInfo effectiveClient = client != null && client.userAgent() != null
                ? client
                : new ClientInfo(session.getUserAgent(), session.getIpAddress());
        return openSession(actorType, actorId, account, member, effectiveClient);
    }

    public void logout(LogoutRequest request) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        String hash = jwtTokenService.hashRefreshToken(request.refreshToken());
        // unknown tokens get the same answer so token validity is not disclosed
        jwtSessionRepository.revokeByRefreshTokenHash(hash, now, REASON_LOGOUT);
    }

    private UserAccount createAccount(String rawEmail, String rawPassword, String nickname) {
        String email = normalizeEmail(rawEmail);
        if (userAccountRepository.existsActiveByEmail(email)) {
            throw ProblemException.conflict("DUPLICATE_EMAIL", "Email is already registered");
        }
        if (memberRepository.existsActiveByNickname(nickname.trim())) {
            throw ProblemException.conflict("DUPLICATE_NICKNAME", "Nickname is already taken");
        }
        UserAccount account = new UserAccount();
        account.setEmail(email);
        account.setPasswordHash(passwordEncoder.encode(rawPassword));
        account.setEmailVerified(false);
        account.setStatus(AccountStatus.ACTIVE);
        return userAccountRepository.save(account);
    }

    private Member createMember(UserAccount account, String nickname) {
        Member member = new Member();
        member.setUserAccount(account);
        member.setNickname(nickname.trim());
        member.setStatus(MemberStatus.ACTIVE);
        return memberRepository.save(member);
    }

    private List<ConsentRecord> toConsentRecords(List<ConsentRequest> consents) {
        List<ConsentRecord> records = consents.stream().map(consent -> {
            ConsentRecord record = new ConsentRecord();
            record.setPolicyType(consent.policyType().trim().toLowerCase(Locale.ROOT));
            record.setPolicyVersion(consent.policyVersion().trim());
            record.setConsentAction(EnumValues.parse(ConsentAction.class, consent.consentAction(),
                    "INVALID_CONSENT_ACTION"));
            return record;
        }).toList();

        Set<String> granted = records.stream()
                .filter(record -> record.getConsentAction() == ConsentAction.GRANTED)
                .map(ConsentRecord::getPolicyType)
                .collect(Collectors.toSet());
        if (!granted.containsAll(REQUIRED_CONSENTS)) {
            throw ProblemException.badRequest("CONSENT_REQUIRED",
                    "privacy_policy and terms_of_service must be granted");
        }
        return records;
    }

    private UUID resolveActorId(ActorType actorType, Member member) {
        return switch (actorType) {
            case MEMBER -> member.getId();
            case MODERATOR -> actorLookupService.requireModerator(member.getId()).getId();
            case ADMINISTRATOR -> actorLookupService.requireAdministrator(member.getId()).getId();
        };
    }

    private AuthorizedActorResponse openSession(ActorType actorType, UUID actorId, UserAccount account,
                                                Member member, ClientInfo client) {
        List<String> roles = actorLookupService.activeRoles(member);
        String refreshToken = jwtTokenService.newRefreshToken();
        AuthorizationToken token = jwtTokenService.issueTokens(
                new TokenSubject(account.getId(), member.getId(), account.getEmail(), actorType, roles),
                refreshToken
        );

        JwtSession session = new JwtSession();
        session.setUserAccount(account);
        session.setRefreshTokenHash(jwtTokenService.hashRefreshToken(refreshToken));
        session.setIssuedAt(OffsetDateTime.now(clock));
        session.setExpiresAt(token.refreshableUntil());
        if (client != null) {
            session.setUserAgent(truncate(client.userAgent(), USER_AGENT_MAX_LENGTH));
            session.setIpAddress(truncate(client.ipAddress(), IP_ADDRESS_MAX_LENGTH));
        }
        jwtSessionRepository.save(session);

        return new AuthorizedActorResponse(
                EnumValues.wire(actorType),
                actorId,
                account.getId(),
                member.getId(),
                account.getEmail(),
                member.getNickname(),
                roles,
                token
        );
    }

    private ProblemException invalidCredentials(String email) {
        log.warn("Rejected login for {}", email);
        return new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS", "Invalid email or password");
    }

    private static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    private static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        return value.length() > max ? value.substring(0, max) : value;
    }

    public record ClientInfo(String userAgent, String ipAddress) {
    }
}
