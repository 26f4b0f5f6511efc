package com.discussboard.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.discussboard.backend.global.error.ProblemException;
import com.discussboard.backend.global.security.ActorRole;
import com.discussboard.backend.modules.auth.domain.ActorType;
import com.discussboard.backend.modules.auth.domain.Administrator;
import com.discussboard.backend.modules.auth.domain.Member;
import com.discussboard.backend.modules.auth.domain.Moderator;
import com.discussboard.backend.modules.auth.domain.StaffStatus;
import com.discussboard.backend.modules.auth.infrastructure.persistence.AdministratorRepository;
import com.discussboard.backend.modules.auth.infrastructure.persistence.MemberRepository;
import com.discussboard.backend.modules.auth.infrastructure.persistence.ModeratorRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Resolves the member, moderator and administrator records behind an authenticated principal.
 */
@Service
@Transactional
public class ActorLookupService {

    private static final Logger log = LoggerFactory.getLogger(ActorLookupService.class);

    private final MemberRepository memberRepository;
    private final ModeratorRepository moderatorRepository;
    private final AdministratorRepository administratorRepository;
    private final Clock clock;

    public ActorLookupService(
            MemberRepository memberRepository,
            ModeratorRepository moderatorRepository,
            AdministratorRepository administratorRepository,
            Clock clock
    ) {
        this.memberRepository = memberRepository;
        this.moderatorRepository = moderatorRepository;
        this.administratorRepository = administratorRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public Member requireMember(UUID memberId) {
        return memberRepository.findActiveById(memberId)
                .orElseThrow(() -> ProblemException.notFound("MEMBER_NOT_FOUND", "Member not found"));
    }

    @Transactional(readOnly = true)
    public Moderator requireModerator(UUID memberId) {
        return moderatorRepository.findCurrentByMemberId(memberId)
                .orElseThrow(() -> ProblemException.forbidden("NOT_A_MODERATOR", "Caller is not an active moderator"));
    }

    @Transactional(readOnly = true)
    public Administrator requireAdministrator(UUID memberId) {
        return administratorRepository.findCurrentByMemberId(memberId)
                .orElseThrow(() -> ProblemException.forbidden("NOT_AN_ADMINISTRATOR",
                        "Caller is not an active administrator"));
    }

    /**
     * Resolves the member behind a moderator or administrator caller, rejecting revoked staff.
     */
    @Transactional(readOnly = true)
    public Member requireStaff(ActorType actorType, UUID memberId) {
        if (actorType == ActorType.ADMINISTRATOR) {
            return requireAdministrator(memberId).getMember();
        }
        return requireModerator(memberId).getMember();
    }

    /**
     * Returns the administrator's moderator record, assigning one on first use.
     */
    public Moderator ensureModeratorForAdministrator(UUID memberId) {
        Administrator administrator = requireAdministrator(memberId);
        return moderatorRepository.findCurrentByMemberId(memberId).orElseGet(() -> {
            Moderator moderator = new Moderator();
            moderator.setMember(administrator.getMember());
            moderator.setAssignedBy(administrator);
            moderator.setAssignedAt(OffsetDateTime.now(clock));
            moderator.setStatus(StaffStatus.ACTIVE);
            Moderator saved = moderatorRepository.save(moderator);
            log.info("Assigned implicit moderator record {} to administrator {}", saved.getId(), administrator.getId());
            return saved;
        });
    }

    @Transactional(readOnly = true)
    public List<String> activeRoles(Member member) {
        List<String> roles = new ArrayList<>();
        if (member.isActive()) {
            roles.add(ActorRole.MEMBER);
        }
        if (moderatorRepository.findCurrentByMemberId(member.getId()).isPresent()) {
            roles.add(ActorRole.MODERATOR);
        }
        if (administratorRepository.findCurrentByMemberId(member.getId()).isPresent()) {
            roles.add(ActorRole.ADMINISTRATOR);
        }
        return roles;
    }
}
