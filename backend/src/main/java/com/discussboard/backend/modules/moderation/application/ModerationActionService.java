package com.discussboard.backend.modules.moderation.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.discussboard.backend.global.common.EnumValues;
import com.discussboard.backend.global.common.paging.PageQuery;
import com.discussboard.backend.global.common.paging.PageResponse;
import com.discussboard.backend.global.error.ProblemException;
import com.discussboard.backend.modules.audit.application.AuditLogService;
import com.discussboard.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.discussboard.backend.modules.auth.application.ActorLookupService;
import com.discussboard.backend.modules.auth.domain.AccountStatus;
import com.discussboard.backend.modules.auth.domain.ActorType;
import com.discussboard.backend.modules.auth.domain.Member;
import com.discussboard.backend.modules.auth.domain.MemberStatus;
import com.discussboard.backend.modules.auth.domain.Moderator;
import com.discussboard.backend.modules.auth.infrastructure.persistence.MemberRepository;
import com.discussboard.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.discussboard.backend.modules.comment.application.CommentService;
import com.discussboard.backend.modules.comment.domain.Comment;
import com.discussboard.backend.modules.comment.infrastructure.persistence.CommentRepository;
import com.discussboard.backend.modules.moderation.domain.ModerationAction;
import com.discussboard.backend.modules.moderation.domain.ModerationActionStatus;
import com.discussboard.backend.modules.moderation.domain.ModerationActionType;
import com.discussboard.backend.modules.moderation.infrastructure.persistence.ModerationActionRepository;
import com.discussboard.backend.modules.moderation.presentation.dto.ModerationActionRequest;
import com.discussboard.backend.modules.moderation.presentation.dto.ModerationActionResponse;
import com.discussboard.backend.modules.moderation.presentation.dto.ModerationActionSearchRequest;
import com.discussboard.backend.modules.moderation.presentation.dto.ModerationActionUpdateRequest;
import com.discussboard.backend.modules.notification.application.NotificationService;
import com.discussboard.backend.modules.post.application.PostService;
import com.discussboard.backend.modules.post.domain.Post;
import com.discussboard.backend.modules.post.infrastructure.persistence.PostRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class ModerationActionService {

    private static final Logger log = LoggerFactory.getLogger(ModerationActionService.class);
    static final Set<String> SORT_FIELDS = Set.of("createdAt", "updatedAt", "actionType", "status");
    private static final String TABLE = "discuss_board_moderation_actions";

    private final ModerationActionRepository actionRepository;
    private final ActorLookupService actorLookupService;
    private final PostService postService;
    private final CommentService commentService;
    private final PostRepository postRepository;
    private final CommentRepository commentRepository;
    private final MemberRepository memberRepository;
    private final UserAccountRepository userAccountRepository;
    private final ModerationLogService moderationLogService;
    private final NotificationService notificationService;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public ModerationActionService(
            ModerationActionRepository actionRepository,
            ActorLookupService actorLookupService,
            PostService postService,
            CommentService commentService,
            PostRepository postRepository,
            CommentRepository commentRepository,
            MemberRepository memberRepository,
            UserAccountRepository userAccountRepository,
            ModerationLogService moderationLogService,
            NotificationService notificationService,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.actionRepository = actionRepository;
        this.actorLookupService = actorLookupService;
        this.postService = postService;
        this.commentService = commentService;
        this.postRepository = postRepository;
        this.commentRepository = commentRepository;
        this.memberRepository = memberRepository;
        this.userAccountRepository = userAccountRepository;
        this.moderationLogService = moderationLogService;
        this.notificationService = notificationService;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    /**
     * Records a moderation decision and applies it: removes content, suspends or bans the member,
     * logs the event and notifies the affected member.
     */
    public ModerationActionResponse create(ActorType actorType, UUID actorMemberId, ModerationActionRequest request) {
        Moderator moderator = actorType == ActorType.ADMINISTRATOR
                ? actorLookupService.ensureModeratorForAdministrator(actorMemberId)
                : actorLookupService.requireModerator(actorMemberId);
        ModerationActionType actionType = EnumValues.parse(ModerationActionType.class, request.actionType(),
                "INVALID_ACTION_TYPE");
        ModerationActionStatus status = EnumValues.parseOptional(ModerationActionStatus.class, request.status(),
                "INVALID_ACTION_STATUS");

        ModerationAction action = new ModerationAction();
        action.setModerator(moderator);
        action.setActionType(actionType);
        action.setActionReason(request.actionReason().trim());
        action.setDecisionNarrative(request.decisionNarrative());
        action.setStatus(status != null ? status : ModerationActionStatus.ACTIVE);
        if (request.targetMemberId() != null) {
            action.setTargetMember(actorLookupService.requireMember(request.targetMemberId()));
        }
        if (request.targetPostId() != null) {
            action.setTargetPost(postService.loadActive(request.targetPostId()));
        }
        if (request.targetCommentId() != null) {
            action.setTargetComment(commentService.loadActive(request.targetCommentId()));
        }
        requireTargetsFor(action);
        action = actionRepository.save(action);

        apply(action, OffsetDateTime.now(clock));
        moderationLogService.record(moderator.getMember(), action, null, null,
                ModerationLogService.EVENT_ACTION_CREATED, EnumValues.wire(actionType) + ": " + action.getActionReason());
        Member recipient = affectedMember(action);
        if (recipient != null) {
            notificationService.notify(
                    recipient.getUserAccount().getId(),
                    NotificationService.EVENT_MODERATION_ACTION,
                    "A moderation action was taken: " + EnumValues.wire(actionType),
                    action.getActionReason()
            );
        }
        log.info("Moderation action {} ({}) created by moderator {}", action.getId(), actionType, moderator.getId());
        return ModerationActionResponse.from(action);
    }

    @Transactional(readOnly = true)
    public PageResponse<ModerationActionResponse> search(ModerationActionSearchRequest request) {
        return PageResponse.from(actionRepository.search(
                request.moderatorId(),
                request.targetMemberId(),
                request.targetPostId(),
                request.targetCommentId(),
                EnumValues.parseOptional(ModerationActionType.class, request.actionType(), "INVALID_ACTION_TYPE"),
                EnumValues.parseOptional(ModerationActionStatus.class, request.status(), "INVALID_ACTION_STATUS"),
                request.createdFrom(),
                request.createdTo(),
                PageQuery.of(request.page(), request.limit(), request.sortBy(), request.sortDirection(), SORT_FIELDS)
        ), ModerationActionResponse::from);
    }

    @Transactional(readOnly = true)
    public ModerationActionResponse get(UUID actionId) {
        return ModerationActionResponse.from(loadActive(actionId));
    }

    public ModerationActionResponse update(ActorType actorType, UUID actorMemberId, UUID actionId,
                                           ModerationActionUpdateRequest request) {
        Member actor = actorLookupService.requireStaff(actorType, actorMemberId);
        ModerationAction action = loadActive(actionId);
        if (request.actionReason() != null && !request.actionReason().isBlank()) {
            action.setActionReason(request.actionReason().trim());
        }
        if (request.decisionNarrative() != null) {
            action.setDecisionNarrative(request.decisionNarrative());
        }
        ModerationActionStatus status = EnumValues.parseOptional(ModerationActionStatus.class, request.status(),
                "INVALID_ACTION_STATUS");
        if (status != null) {
            action.setStatus(status);
        }
        actionRepository.saveAndFlush(action);
        moderationLogService.record(actor, action, null, null, ModerationLogService.EVENT_ACTION_UPDATED,
                "status=" + EnumValues.wire(action.getStatus()));
        return ModerationActionResponse.from(action);
    }

    /**
     * Soft delete; appeals, reports and logs keep pointing at the row.
     */
    public void erase(UUID administratorMemberId, UUID actionId) {
        actorLookupService.requireAdministrator(administratorMemberId);
        ModerationAction action = loadActive(actionId);
        action.markDeleted(OffsetDateTime.now(clock));
        actionRepository.save(action);
        auditLogService.record(new AuditLogCommand(
                administratorMemberId,
                "administrator",
                "moderation_action_delete",
                TABLE,
                action.getId(),
                "Moderation action " + EnumValues.wire(action.getActionType()),
                Map.of("actionType", EnumValues.wire(action.getActionType()))
        ));
    }

    public ModerationAction loadActive(UUID actionId) {
        return actionRepository.findActiveById(actionId)
                .orElseThrow(() -> ProblemException.notFound("MODERATION_ACTION_NOT_FOUND",
                        "Moderation action not found"));
    }

    /**
     * Undoes the action's side effects and marks it reverted.
     */
    public void revert(ModerationAction action) {
        switch (action.getActionType()) {
            case REMOVE_CONTENT -> {
                if (action.getTargetPost() != null) {
                    action.getTargetPost().restore();
                    postRepository.save(action.getTargetPost());
                }
                if (action.getTargetComment() != null) {
                    action.getTargetComment().restore();
                    commentRepository.save(action.getTargetComment());
                }
            }
            case SUSPEND_USER, BAN_USER -> changeMemberStatus(action.getTargetMember(), MemberStatus.ACTIVE,
                    AccountStatus.ACTIVE);
            default -> {
            }
        }
        action.setStatus(ModerationActionStatus.REVERTED);
        actionRepository.save(action);
    }

    /**
     * The member a decision lands on: the explicit target, else the author of the targeted content.
     */
    public Member affectedMember(ModerationAction action) {
        if (action.getTargetMember() != null) {
            return action.getTargetMember();
        }
        if (action.getTargetComment() != null) {
            return action.getTargetComment().getAuthor();
        }
        if (action.getTargetPost() != null) {
            return action.getTargetPost().getAuthor();
        }
        return null;
    }

    private void apply(ModerationAction action, OffsetDateTime now) {
        switch (action.getActionType()) {
            case REMOVE_CONTENT -> {
                Post post = action.getTargetPost();
                if (post != null) {
                    post.markDeleted(now);
                    postRepository.save(post);
                }
                Comment comment = action.getTargetComment();
                if (comment != null) {
                    comment.markDeleted(now);
                    commentRepository.save(comment);
                }
            }
            case SUSPEND_USER -> changeMemberStatus(action.getTargetMember(), MemberStatus.SUSPENDED,
                    AccountStatus.SUSPENDED);
            case BAN_USER -> changeMemberStatus(action.getTargetMember(), MemberStatus.BANNED, AccountStatus.BANNED);
            default -> {
            }
        }
    }

    private void changeMemberStatus(Member member, MemberStatus memberStatus, AccountStatus accountStatus) {
        if (member == null) {
            return;
        }
        member.setStatus(memberStatus);
        memberRepository.save(member);
        member.getUserAccount().setStatus(accountStatus);
        userAccountRepository.save(member.getUserAccount());
    }

    private static void requireTargetsFor(ModerationAction action) {
        String required = switch (action.getActionType()) {
            case REMOVE_CONTENT, EDIT_CONTENT -> action.getTargetPost() == null && action.getTargetComment() == null
                    ? "targetPostId or targetCommentId"
                    : null;
            case SUSPEND_USER, BAN_USER -> action.getTargetMember() == null ? "targetMemberId" : null;
            default -> null;
        };
        if (required != null) {
            throw ProblemException.badRequest("TARGET_REQUIRED",
                    EnumValues.wire(action.getActionType()) + " requires " + required);
        }
    }
}
