package com.discussboard.backend.modules.member;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import com.discussboard.backend.global.error.ProblemException;
import com.discussboard.backend.modules.audit.application.AuditLogService;
import com.discussboard.backend.modules.auth.domain.Administrator;
import com.discussboard.backend.modules.auth.domain.Member;
import com.discussboard.backend.modules.auth.domain.StaffStatus;
import com.discussboard.backend.modules.auth.infrastructure.persistence.AdministratorRepository;
import com.discussboard.backend.modules.auth.infrastructure.persistence.ModeratorRepository;
import com.discussboard.backend.modules.member.application.StaffService;
import com.discussboard.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class StaffServiceTest {

    @Mock
    private ModeratorRepository moderatorRepository;
    @Mock
    private AdministratorRepository administratorRepository;
    @Mock
    private AuditLogService auditLogService;

    private StaffService staffService;
    private OffsetDateTime now;

    @BeforeEach
    void setUp() {
        now = OffsetDateTime.parse("2025-01-01T00:00:00Z");
        staffService = new StaffService(moderatorRepository, administratorRepository, auditLogService,
                Clock.fixed(now.toInstant(), ZoneOffset.UTC));
    }

    private static Administrator administrator(Member member) {
        Administrator administrator = TestEntities.withId(new Administrator(), UUID.randomUUID());
        administrator.setMember(member);
        return administrator;
    }

    @Test
    void administratorCannotDeleteThemselves() {
        Member self = TestEntities.member("root");
        Administrator administrator = administrator(self);
        when(administratorRepository.findActiveById(administrator.getId())).thenReturn(Optional.of(administrator));

        assertThatThrownBy(() -> staffService.eraseAdministrator(self.getId(), administrator.getId()))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("CANNOT_DELETE_SELF");
        verify(administratorRepository, never()).save(any(Administrator.class));
        verifyNoInteractions(auditLogService);
    }

    @Test
    void deletingAnotherAdministratorRevokesAndAudits() {
        Administrator other = administrator(TestEntities.member("second"));
        when(administratorRepository.findActiveById(other.getId())).thenReturn(Optional.of(other));

        staffService.eraseAdministrator(UUID.randomUUID(), other.getId());

        assertThat(other.getStatus()).isEqualTo(StaffStatus.REVOKED);
        assertThat(other.getRevokedAt()).isEqualTo(now);
        assertThat(other.getDeletedAt()).isEqualTo(now);
        verify(administratorRepository).save(other);
        verify(auditLogService).record(any());
    }
}
