package com.discussboard.backend.modules.platform;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import com.discussboard.backend.global.error.ProblemException;
import com.discussboard.backend.modules.audit.application.AuditLogService;
import com.discussboard.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.discussboard.backend.modules.platform.application.ForbiddenWordService;
import com.discussboard.backend.modules.platform.domain.ForbiddenWord;
import com.discussboard.backend.modules.platform.infrastructure.persistence.ForbiddenWordRepository;
import com.discussboard.backend.modules.platform.presentation.dto.ForbiddenWordRequest;
import com.discussboard.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class ForbiddenWordServiceTest {

    @Mock
    private ForbiddenWordRepository forbiddenWordRepository;

    @Mock
    private AuditLogService auditLogService;

    private ForbiddenWordService forbiddenWordService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(OffsetDateTime.parse("2025-01-01T00:00:00Z").toInstant(), ZoneOffset.UTC);
        forbiddenWordService = new ForbiddenWordService(forbiddenWordRepository, auditLogService, clock);
    }

    private static ForbiddenWord word(String expression) {
        ForbiddenWord word = TestEntities.withId(new ForbiddenWord(), UUID.randomUUID());
        word.setExpression(expression);
        return word;
    }

    @Test
    void rejectsContentContainingExpressionIgnoringCase() {
        when(forbiddenWordRepository.findAllActive()).thenReturn(List.of(word("spam")));

        assertThatThrownBy(() -> forbiddenWordService.assertClean("Clean title", "Buy SPAM now"))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).getStatusCode())
                        .isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY))
                .extracting("code")
                .isEqualTo("FORBIDDEN_WORD");
    }

    @Test
    void acceptsCleanAndMissingText() {
        when(forbiddenWordRepository.findAllActive()).thenReturn(List.of(word("spam")));

        assertThatCode(() -> forbiddenWordService.assertClean("hello", null)).doesNotThrowAnyException();
    }

    @Test
    void duplicateExpressionConflicts() {
        when(forbiddenWordRepository.existsActiveByExpression("spam")).thenReturn(true);

        assertThatThrownBy(() -> forbiddenWordService.create(UUID.randomUUID(), new ForbiddenWordRequest(" spam ", null)))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("DUPLICATE_FORBIDDEN_WORD");
        verify(forbiddenWordRepository, never()).save(any());
    }

    @Test
    void creatingAWordIsAudited() {
        UUID adminId = UUID.randomUUID();
        when(forbiddenWordRepository.save(any(ForbiddenWord.class)))
                .thenAnswer(inv -> TestEntities.withId(inv.getArgument(0), UUID.randomUUID()));

        forbiddenWordService.create(adminId, new ForbiddenWordRequest("scam", "fraud"));

        ArgumentCaptor<AuditLogCommand> command = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(command.capture());
        assertThat(command.getValue().actorId()).isEqualTo(adminId);
        assertThat(command.getValue().actionCategory()).isEqualTo("forbidden_word_create");
    }
}
