package com.discussboard.backend.modules.auth.application;

import com.discussboard.backend.global.error.ProblemException;

/**
 * Password strength rules. Administrators get the strict rule set.
 */
public final class PasswordPolicy {

    static final int MEMBER_MIN_LENGTH = 8;
    static final int ADMINISTRATOR_MIN_LENGTH = 10;

    private PasswordPolicy() {
    }

    public static void checkMemberPassword(String password) {
        if (password == null || password.length() < MEMBER_MIN_LENGTH) {
            throw ProblemException.badRequest("PASSWORD_POLICY_VIOLATION",
                    "Password must be at least " + MEMBER_MIN_LENGTH + " characters");
        }
    }

    public static void checkAdministratorPassword(String password) {
        if (password == null || password.length() < ADMINISTRATOR_MIN_LENGTH) {
            throw ProblemException.badRequest("PASSWORD_POLICY_VIOLATION",
                    "Password must be at least " + ADMINISTRATOR_MIN_LENGTH + " characters");
        }
        boolean upper = false;
        boolean lower = false;
        boolean digit = false;
        boolean special = false;
        for (char c : password.toCharArray()) {
            if (Character.isUpperCase(c)) {
                upper = true;
            } else if (Character.isLowerCase(c)) {
                lower = true;
            } else if (Character.isDigit(c)) {
                digit = true;
            } else if (!Character.isWhitespace(c)) {
                special = true;
            }
        }
        if (!(upper && lower && digit && special)) {
            throw ProblemException.badRequest("PASSWORD_POLICY_VIOLATION",
                    "Password needs upper-case, lower-case, digit and special characters");
        }
    }
}
