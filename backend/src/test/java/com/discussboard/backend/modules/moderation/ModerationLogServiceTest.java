package com.discussboard.backend.modules.moderation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Optional;
import java.util.UUID;

import com.discussboard.backend.global.error.ProblemException;
import com.discussboard.backend.modules.auth.application.ActorLookupService;
import com.discussboard.backend.modules.moderation.application.ModerationLogService;
import com.discussboard.backend.modules.moderation.domain.ModerationAction;
import com.discussboard.backend.modules.moderation.domain.ModerationLog;
import com.discussboard.backend.modules.moderation.infrastructure.persistence.AppealRepository;
import com.discussboard.backend.modules.moderation.infrastructure.persistence.ContentReportRepository;
import com.discussboard.backend.modules.moderation.infrastructure.persistence.ModerationActionRepository;
import com.discussboard.backend.modules.moderation.infrastructure.persistence.ModerationLogRepository;
import com.discussboard.backend.modules.moderation.presentation.dto.ModerationLogResponse;
import com.discussboard.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ModerationLogServiceTest {

    @Mock
    private ModerationLogRepository logRepository;
    @Mock
    private ModerationActionRepository actionRepository;
    @Mock
    private AppealRepository appealRepository;
    @Mock
    private ContentReportRepository reportRepository;
    @Mock
    private ActorLookupService actorLookupService;

    private ModerationLogService logService;
    private ModerationAction action;

    @BeforeEach
    void setUp() {
        logService = new ModerationLogService(logRepository, actionRepository, appealRepository, reportRepository,
                actorLookupService);
        action = TestEntities.withId(new ModerationAction(), UUID.randomUUID());
        when(actionRepository.findActiveById(action.getId())).thenReturn(Optional.of(action));
    }

    @Test
    @DisplayName("a log filed under another action is not found through this one")
    void logOfAnotherActionIsNotFound() {
        UUID foreignLogId = UUID.randomUUID();
        when(logRepository.findByIdAndActionId(foreignLogId, action.getId())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> logService.get(action.getId(), foreignLogId))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("MODERATION_LOG_NOT_FOUND");
    }

    @Test
    void deleteThroughTheWrongActionRemovesNothing() {
        UUID administratorId = UUID.randomUUID();
        UUID foreignLogId = UUID.randomUUID();
        when(logRepository.findByIdAndActionId(foreignLogId, action.getId())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> logService.erase(administratorId, action.getId(), foreignLogId))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("MODERATION_LOG_NOT_FOUND");
        verify(actorLookupService).requireAdministrator(administratorId);
        verify(logRepository, never()).delete(any(ModerationLog.class));
    }

    @Test
    void readsLogOfItsOwnAction() {
        ModerationLog log = TestEntities.withId(new ModerationLog(), UUID.randomUUID());
        log.setActor(TestEntities.member("mod"));
        log.setRelatedAction(action);
        log.setEventType(ModerationLogService.EVENT_ACTION_CREATED);
        when(logRepository.findByIdAndActionId(log.getId(), action.getId())).thenReturn(Optional.of(log));

        ModerationLogResponse response = logService.get(action.getId(), log.getId());

        assertThat(response.relatedActionId()).isEqualTo(action.getId());
        assertThat(response.eventType()).isEqualTo("action_created");
    }
}
