package com.discussboard.backend.modules.moderation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Optional;
import java.util.UUID;

import com.discussboard.backend.global.error.ProblemException;
import com.discussboard.backend.modules.auth.application.ActorLookupService;
import com.discussboard.backend.modules.auth.domain.Administrator;
import com.discussboard.backend.modules.auth.domain.Member;
import com.discussboard.backend.modules.auth.domain.Moderator;
import com.discussboard.backend.modules.moderation.application.AppealService;
import com.discussboard.backend.modules.moderation.application.ModerationActionService;
import com.discussboard.backend.modules.moderation.application.ModerationLogService;
import com.discussboard.backend.modules.moderation.domain.Appeal;
import com.discussboard.backend.modules.moderation.domain.AppealStatus;
import com.discussboard.backend.modules.moderation.domain.ModerationAction;
import com.discussboard.backend.modules.moderation.domain.ModerationActionStatus;
import com.discussboard.backend.modules.moderation.domain.ModerationActionType;
import com.discussboard.backend.modules.moderation.infrastructure.persistence.AppealRepository;
import com.discussboard.backend.modules.moderation.infrastructure.persistence.ModerationActionRepository;
import com.discussboard.backend.modules.moderation.presentation.dto.AppealDecisionRequest;
import com.discussboard.backend.modules.moderation.presentation.dto.AppealRequest;
import com.discussboard.backend.modules.moderation.presentation.dto.AppealResponse;
import com.discussboard.backend.modules.moderation.presentation.dto.AppealUpdateRequest;
import com.discussboard.backend.modules.notification.application.NotificationService;
import com.discussboard.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AppealServiceTest {

    @Mock
    private AppealRepository appealRepository;
    @Mock
    private ModerationActionRepository actionRepository;
    @Mock
    private ModerationActionService moderationActionService;
    @Mock
    private ModerationLogService moderationLogService;
    @Mock
    private ActorLookupService actorLookupService;
    @Mock
    private NotificationService notificationService;

    private AppealService appealService;
    private Member appellant;
    private ModerationAction action;

    @BeforeEach
    void setUp() {
        appealService = new AppealService(appealRepository, actionRepository, moderationActionService,
                moderationLogService, actorLookupService, notificationService);
        appellant = TestEntities.member("troll");

        Moderator moderator = TestEntities.withId(new Moderator(), UUID.randomUUID());
        moderator.setMember(TestEntities.member("mod"));
        action = TestEntities.withId(new ModerationAction(), UUID.randomUUID());
        action.setModerator(moderator);
        action.setTargetMember(appellant);
        action.setActionType(ModerationActionType.SUSPEND_USER);
        action.setActionReason("Spamming");
        action.setStatus(ModerationActionStatus.ACTIVE);

        lenient().when(actorLookupService.requireMember(appellant.getId())).thenReturn(appellant);
        lenient().when(moderationActionService.loadActive(action.getId())).thenReturn(action);
        lenient().when(moderationActionService.affectedMember(action)).thenReturn(appellant);
        lenient().when(appealRepository.save(any(Appeal.class)))
                .thenAnswer(inv -> TestEntities.withId(inv.getArgument(0), UUID.randomUUID()));
        lenient().when(appealRepository.saveAndFlush(any(Appeal.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private Appeal pendingAppeal() {
        Appeal appeal = TestEntities.withId(new Appeal(), UUID.randomUUID());
        appeal.setModerationAction(action);
        appeal.setAppellant(appellant);
        appeal.setAppealRationale("I was not spamming");
        appeal.setStatus(AppealStatus.PENDING);
        return appeal;
    }

    @Test
    @DisplayName("the affected member can appeal, which links the appeal to the action and logs it")
    void createLinksAppealToAction() {
        AppealResponse response = appealService.create(appellant.getId(),
                new AppealRequest(action.getId(), "  I was not spamming "));

        assertThat(response.status()).isEqualTo("pending");
        assertThat(response.appealRationale()).isEqualTo("I was not spamming");
        assertThat(action.getAppeal()).isNotNull();
        verify(actionRepository).save(action);
        verify(moderationLogService).record(eq(appellant), eq(action), any(Appeal.class), any(),
                eq(ModerationLogService.EVENT_APPEAL_SUBMITTED), any());
    }

    @Test
    void bystandersCannotAppeal() {
        Member bystander = TestEntities.member("bystander");
        when(actorLookupService.requireMember(bystander.getId())).thenReturn(bystander);

        assertThatThrownBy(() -> appealService.create(bystander.getId(), new AppealRequest(action.getId(), "why")))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("APPEAL_FORBIDDEN");
    }

    @Test
    void openAppealBlocksASecondOne() {
        when(appealRepository.existsForActionWithStatus(eq(action.getId()), anyCollection())).thenReturn(true);

        assertThatThrownBy(() -> appealService.create(appellant.getId(), new AppealRequest(action.getId(), "again")))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("DUPLICATE_APPEAL");
        verify(appealRepository, never()).save(any());
    }

    @Test
    void reviewedAppealCanNoLongerBeEdited() {
        Appeal appeal = pendingAppeal();
        appeal.setStatus(AppealStatus.REVIEWED);
        when(appealRepository.findActiveById(appeal.getId())).thenReturn(Optional.of(appeal));

        assertThatThrownBy(() -> appealService.updateOwn(appellant.getId(), appeal.getId(),
                new AppealUpdateRequest("more detail")))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("APPEAL_NOT_PENDING");
    }

    @Test
    @DisplayName("accepting an appeal reverts the action, logs the decision and notifies the appellant")
    void acceptingRevertsAction() {
        Member adminMember = TestEntities.member("admin");
        Administrator administrator = TestEntities.withId(new Administrator(), UUID.randomUUID());
        administrator.setMember(adminMember);
        Appeal appeal = pendingAppeal();
        when(actorLookupService.requireAdministrator(adminMember.getId())).thenReturn(administrator);
        when(appealRepository.findActiveById(appeal.getId())).thenReturn(Optional.of(appeal));

        AppealResponse response = appealService.decide(adminMember.getId(), appeal.getId(),
                new AppealDecisionRequest("accepted", "Evidence was weak"));

        assertThat(response.status()).isEqualTo("accepted");
        assertThat(response.resolutionNotes()).isEqualTo("Evidence was weak");
        verify(moderationActionService).revert(action);
        verify(moderationLogService).record(eq(adminMember), eq(action), eq(appeal), any(),
                eq(ModerationLogService.EVENT_APPEAL_DECIDED), eq("status=accepted"));
        verify(notificationService).notify(eq(appellant.getUserAccount().getId()),
                eq(NotificationService.EVENT_APPEAL_DECISION), anyString(), eq("Evidence was weak"));
    }

    @Test
    void rejectingLeavesTheActionInPlace() {
        Member adminMember = TestEntities.member("admin");
        Administrator administrator = TestEntities.withId(new Administrator(), UUID.randomUUID());
        administrator.setMember(adminMember);
        Appeal appeal = pendingAppeal();
        when(actorLookupService.requireAdministrator(adminMember.getId())).thenReturn(administrator);
        when(appealRepository.findActiveById(appeal.getId())).thenReturn(Optional.of(appeal));

        appealService.decide(adminMember.getId(), appeal.getId(), new AppealDecisionRequest("rejected", null));

        verify(moderationActionService, never()).revert(any());
        assertThat(appeal.getStatus()).isEqualTo(AppealStatus.REJECTED);
    }
}
