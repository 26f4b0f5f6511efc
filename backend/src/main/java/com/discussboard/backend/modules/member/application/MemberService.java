package com.discussboard.backend.modules.member.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.discussboard.backend.global.common.EnumValues;
import com.discussboard.backend.global.common.paging.PageQuery;
import com.discussboard.backend.global.common.paging.PageResponse;
import com.discussboard.backend.global.error.ProblemException;
import com.discussboard.backend.modules.audit.application.AuditLogService;
import com.discussboard.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.discussboard.backend.modules.auth.domain.AccountStatus;
import com.discussboard.backend.modules.auth.domain.Member;
import com.discussboard.backend.modules.auth.domain.MemberStatus;
import com.discussboard.backend.modules.auth.domain.UserAccount;
import com.discussboard.backend.modules.auth.infrastructure.persistence.MemberRepository;
import com.discussboard.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.discussboard.backend.modules.member.presentation.dto.MemberCreateRequest;
import com.discussboard.backend.modules.member.presentation.dto.MemberProfileResponse;
import com.discussboard.backend.modules.member.presentation.dto.MemberProfileUpdateRequest;
import com.discussboard.backend.modules.member.presentation.dto.MemberResponse;
import com.discussboard.backend.modules.member.presentation.dto.MemberSearchRequest;
import com.discussboard.backend.modules.member.presentation.dto.MemberUpdateRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class MemberService {

    private static final Logger log = LoggerFactory.getLogger(MemberService.class);
    static final Set<String> SORT_FIELDS = Set.of("createdAt", "nickname", "status");
    private static final String TABLE = "discuss_board_members";

    private final MemberRepository memberRepository;
    private final UserAccountRepository userAccountRepository;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public MemberService(
            MemberRepository memberRepository,
            UserAccountRepository userAccountRepository,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.memberRepository = memberRepository;
        this.userAccountRepository = userAccountRepository;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public MemberProfileResponse getProfile(UUID memberId) {
        return MemberProfileResponse.from(load(memberId));
    }

    public MemberProfileResponse updateOwnProfile(UUID callerMemberId, UUID memberId,
                                                  MemberProfileUpdateRequest request) {
        if (!memberId.equals(callerMemberId)) {
            throw ProblemException.forbidden("PROFILE_FORBIDDEN", "Only the member may edit this profile");
        }
        Member member = load(memberId);
        member.setNickname(uniqueNickname(request.nickname(), member.getId()));
        return MemberProfileResponse.from(memberRepository.saveAndFlush(member));
    }

    @Transactional(readOnly = true)
    public PageResponse<MemberResponse> search(MemberSearchRequest request) {
        return PageResponse.from(memberRepository.search(
                PageQuery.likePattern(request.nickname()),
                EnumValues.parseOptional(MemberStatus.class, request.status(), "INVALID_MEMBER_STATUS"),
                request.createdFrom(),
                request.createdTo(),
                PageQuery.of(request.page(), request.limit(), request.sortBy(), request.sortDirection(), SORT_FIELDS)
        ), MemberResponse::from);
    }

    @Transactional(readOnly = true)
    public MemberResponse get(UUID memberId) {
        return MemberResponse.from(load(memberId));
    }

    public MemberResponse create(UUID actorMemberId, MemberCreateRequest request) {
        UserAccount account = userAccountRepository.findActiveById(request.userAccountId())
                .orElseThrow(() -> ProblemException.notFound("USER_ACCOUNT_NOT_FOUND", "User account not found"));
        if (memberRepository.existsActiveByUserAccountId(account.getId())) {
            throw ProblemException.conflict("MEMBER_ALREADY_EXISTS", "Account already has a member profile");
        }
        Member member = new Member();
        member.setUserAccount(account);
        member.setNickname(uniqueNickname(request.nickname(), null));
        MemberStatus status = EnumValues.parseOptional(MemberStatus.class, request.status(), "INVALID_MEMBER_STATUS");
        member.setStatus(status != null ? status : MemberStatus.ACTIVE);
        member = memberRepository.save(member);
        audit(actorMemberId, "member_create", member, Map.of("nickname", member.getNickname()));
        return MemberResponse.from(member);
    }

    public MemberResponse update(UUID actorMemberId, UUID memberId, MemberUpdateRequest request) {
        Member member = load(memberId);
        Map<String, Object> changes = new HashMap<>();
        if (request.nickname() != null && !request.nickname().isBlank()) {
            member.setNickname(uniqueNickname(request.nickname(), member.getId()));
            changes.put("nickname", member.getNickname());
        }
        MemberStatus status = EnumValues.parseOptional(MemberStatus.class, request.status(), "INVALID_MEMBER_STATUS");
        if (status != null && status != member.getStatus()) {
            changes.put("previousStatus", EnumValues.wire(member.getStatus()));
            changes.put("status", EnumValues.wire(status));
            member.setStatus(status);
            UserAccount account = member.getUserAccount();
            account.setStatus(AccountStatus.valueOf(status.name()));
            userAccountRepository.save(account);
        }
        memberRepository.saveAndFlush(member);
        if (changes.containsKey("status")) {
            audit(actorMemberId, "member_status_change", member, changes);
        }
        return MemberResponse.from(member);
    }

    public void erase(UUID actorMemberId, UUID memberId) {
        Member member = load(memberId);
        member.markDeleted(OffsetDateTime.now(clock));
        memberRepository.save(member);
        audit(actorMemberId, "member_delete", member, Map.of("nickname", member.getNickname()));
        log.info("Member {} deleted by {}", memberId, actorMemberId);
    }

    private Member load(UUID memberId) {
        return memberRepository.findActiveById(memberId)
                .orElseThrow(() -> ProblemException.notFound("MEMBER_NOT_FOUND", "Member not found"));
    }

    private String uniqueNickname(String raw, UUID excludedId) {
        String nickname = raw.trim();
        boolean taken = excludedId == null
                ? memberRepository.existsActiveByNickname(nickname)
                : memberRepository.existsActiveByNicknameExcluding(nickname, excludedId);
        if (taken) {
            throw ProblemException.conflict("DUPLICATE_NICKNAME", "Nickname is already taken");
        }
        return nickname;
    }

    private void audit(UUID actorMemberId, String category, Member member, Map<String, Object> payload) {
        auditLogService.record(new AuditLogCommand(
                actorMemberId,
                "administrator",
                category,
                TABLE,
                member.getId(),
                "Member " + member.getNickname(),
                payload
        ));
    }
}
