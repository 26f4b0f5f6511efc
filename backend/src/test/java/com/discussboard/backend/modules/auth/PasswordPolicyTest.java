package com.discussboard.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.discussboard.backend.global.error.ProblemException;
import com.discussboard.backend.modules.auth.application.PasswordPolicy;

import org.junit.jupiter.api.Test;

class PasswordPolicyTest {

    @Test
    void memberPasswordNeedsEightCharacters() {
        assertThatCode(() -> PasswordPolicy.checkMemberPassword("abcdefgh")).doesNotThrowAnyException();
        assertThatThrownBy(() -> PasswordPolicy.checkMemberPassword("short"))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("PASSWORD_POLICY_VIOLATION");
    }

    @Test
    void administratorPasswordNeedsAllCharacterClasses() {
        assertThatCode(() -> PasswordPolicy.checkAdministratorPassword("Admin-pass-1!")).doesNotThrowAnyException();
        assertThatThrownBy(() -> PasswordPolicy.checkAdministratorPassword("adminpass12345"))
                .isInstanceOf(ProblemException.class);
        assertThatThrownBy(() -> PasswordPolicy.checkAdministratorPassword("Ab1!"))
                .isInstanceOf(ProblemException.class);
    }
}
