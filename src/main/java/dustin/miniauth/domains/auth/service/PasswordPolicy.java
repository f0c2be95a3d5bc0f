package dustin.miniauth.domains.auth.service;

import dustin.miniauth.domains.auth.exception.InvalidRequestException;

/**
 * 비밀번호 정책
 * Password policy: confirmation must match; at least 8 characters with
 * upper case, lower case, digit and symbol.
 */
public final class PasswordPolicy {

    static final int MIN_LENGTH = 8;

    private PasswordPolicy() {
    }

    public static void requireMatching(String password, String confirmPassword) {
        if (password == null || !password.equals(confirmPassword)) {
            throw new InvalidRequestException("Passwords do not match");
        }
    }

    public static void requireStrong(String password) {
        if (!isStrong(password)) {
            throw new InvalidRequestException("Password is not strong enough");
        }
    }

    public static boolean isStrong(String password) {
        if (password == null || password.length() < MIN_LENGTH) {
            return false;
        }
        boolean upper = false;
        boolean lower = false;
        boolean digit = false;
        boolean symbol = false;
        for (int i = 0; i < password.length(); i++) {
            char c = password.charAt(i);
            if (Character.isUpperCase(c)) {
                upper = true;
            } else if (Character.isLowerCase(c)) {
                lower = true;
            } else if (Character.isDigit(c)) {
                digit = true;
            } else if (!Character.isWhitespace(c)) {
                symbol = true;
            }
        }
        return upper && lower && digit && symbol;
    }
}
