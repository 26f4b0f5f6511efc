package com.discussboard.backend.modules.moderation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import com.discussboard.backend.global.error.ProblemException;
import com.discussboard.backend.modules.audit.application.AuditLogService;
import com.discussboard.backend.modules.auth.application.ActorLookupService;
import com.discussboard.backend.modules.auth.domain.AccountStatus;
import com.discussboard.backend.modules.auth.domain.ActorType;
import com.discussboard.backend.modules.auth.domain.Member;
import com.discussboard.backend.modules.auth.domain.MemberStatus;
import com.discussboard.backend.modules.auth.domain.Moderator;
import com.discussboard.backend.modules.auth.infrastructure.persistence.MemberRepository;
import com.discussboard.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.discussboard.backend.modules.comment.application.CommentService;
import com.discussboard.backend.modules.comment.infrastructure.persistence.CommentRepository;
import com.discussboard.backend.modules.moderation.application.ModerationActionService;
import com.discussboard.backend.modules.moderation.application.ModerationLogService;
import com.discussboard.backend.modules.moderation.domain.ModerationAction;
import com.discussboard.backend.modules.moderation.domain.ModerationActionStatus;
import com.discussboard.backend.modules.moderation.domain.ModerationActionType;
import com.discussboard.backend.modules.moderation.infrastructure.persistence.ModerationActionRepository;
import com.discussboard.backend.modules.moderation.presentation.dto.ModerationActionRequest;
import com.discussboard.backend.modules.moderation.presentation.dto.ModerationActionResponse;
import com.discussboard.backend.modules.notification.application.NotificationService;
import com.discussboard.backend.modules.post.application.PostService;
import com.discussboard.backend.modules.post.domain.Post;
import com.discussboard.backend.modules.post.infrastructure.persistence.PostRepository;
import com.discussboard.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ModerationActionServiceTest {

    @Mock
    private ModerationActionRepository actionRepository;
    @Mock
    private ActorLookupService actorLookupService;
    @Mock
    private PostService postService;
    @Mock
    private CommentService commentService;
    @Mock
    private PostRepository postRepository;
    @Mock
    private CommentRepository commentRepository;
    @Mock
    private MemberRepository memberRepository;
    @Mock
    private UserAccountRepository userAccountRepository;
    @Mock
    private ModerationLogService moderationLogService;
    @Mock
    private NotificationService notificationService;
    @Mock
    private AuditLogService auditLogService;

    private ModerationActionService actionService;
    private Clock clock;
    private Member moderatorMember;
    private Moderator moderator;
    private Member target;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(OffsetDateTime.parse("2025-01-01T00:00:00Z").toInstant(), ZoneOffset.UTC);
        actionService = new ModerationActionService(actionRepository, actorLookupService, postService, commentService,
                postRepository, commentRepository, memberRepository, userAccountRepository, moderationLogService,
                notificationService, auditLogService, clock);

        moderatorMember = TestEntities.member("mod");
        moderator = TestEntities.withId(new Moderator(), UUID.randomUUID());
        moderator.setMember(moderatorMember);
        target = TestEntities.member("troll");

        lenient().when(actorLookupService.requireModerator(moderatorMember.getId())).thenReturn(moderator);
        lenient().when(actorLookupService.requireMember(target.getId())).thenReturn(target);
        lenient().when(actionRepository.save(any(ModerationAction.class)))
                .thenAnswer(inv -> {
                    ModerationAction action = inv.getArgument(0);
                    return action.getId() != null ? action : TestEntities.withId(action, UUID.randomUUID());
                });
    }

    @Test
    @DisplayName("suspending a member changes member and account status, logs and notifies")
    void suspendUserAppliesSideEffects() {
        ModerationActionResponse response = actionService.create(ActorType.MODERATOR, moderatorMember.getId(),
                new ModerationActionRequest(target.getId(), null, null, "suspend_user", "Spamming", null, null));

        assertThat(response.status()).isEqualTo("active");
        assertThat(target.getStatus()).isEqualTo(MemberStatus.SUSPENDED);
        assertThat(target.getUserAccount().getStatus()).isEqualTo(AccountStatus.SUSPENDED);
        verify(moderationLogService).record(eq(moderatorMember), any(ModerationAction.class), isNull(), isNull(),
                eq(ModerationLogService.EVENT_ACTION_CREATED), anyString());
        verify(notificationService).notify(eq(target.getUserAccount().getId()),
                eq(NotificationService.EVENT_MODERATION_ACTION), anyString(), eq("Spamming"));
    }

    @Test
    void removeContentSoftDeletesPostAndNotifiesItsAuthor() {
        Post post = TestEntities.post(target, "Offending");
        when(postService.loadActive(post.getId())).thenReturn(post);

        actionService.create(ActorType.MODERATOR, moderatorMember.getId(),
                new ModerationActionRequest(null, post.getId(), null, "remove_content", "Off topic", null, null));

        assertThat(post.getDeletedAt()).isEqualTo(OffsetDateTime.now(clock));
        verify(postRepository).save(post);
        verify(notificationService).notify(eq(target.getUserAccount().getId()), anyString(), anyString(),
                anyString());
    }

    @Test
    void banWithoutTargetMemberIsRejected() {
        assertThatThrownBy(() -> actionService.create(ActorType.MODERATOR, moderatorMember.getId(),
                new ModerationActionRequest(null, null, null, "ban_user", "Abuse", null, null)))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("TARGET_REQUIRED");
        verify(actionRepository, never()).save(any());
    }

    @Test
    void administratorsActThroughAnImplicitModeratorRecord() {
        when(actorLookupService.ensureModeratorForAdministrator(moderatorMember.getId())).thenReturn(moderator);

        ModerationActionResponse response = actionService.create(ActorType.ADMINISTRATOR, moderatorMember.getId(),
                new ModerationActionRequest(target.getId(), null, null, "warn", "Be nice", "first warning", null));

        assertThat(response.moderatorId()).isEqualTo(moderator.getId());
        verify(actorLookupService, never()).requireModerator(any());
    }

    @Test
    @DisplayName("reverting a ban reactivates the member and marks the action reverted")
    void revertRestoresMember() {
        target.setStatus(MemberStatus.BANNED);
        target.getUserAccount().setStatus(AccountStatus.BANNED);
        ModerationAction action = TestEntities.withId(new ModerationAction(), UUID.randomUUID());
        action.setModerator(moderator);
        action.setTargetMember(target);
        action.setActionType(ModerationActionType.BAN_USER);
        action.setStatus(ModerationActionStatus.ACTIVE);

        actionService.revert(action);

        assertThat(target.getStatus()).isEqualTo(MemberStatus.ACTIVE);
        assertThat(target.getUserAccount().getStatus()).isEqualTo(AccountStatus.ACTIVE);
        assertThat(action.getStatus()).isEqualTo(ModerationActionStatus.REVERTED);
    }
}
