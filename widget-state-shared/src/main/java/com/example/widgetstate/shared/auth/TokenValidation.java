package com.example.widgetstate.shared.auth;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.Optional;

@Getter
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class TokenValidation {

    private final boolean valid;
    private final String subject;
    private final String error;

    public static TokenValidation valid(String subject) {
        return new TokenValidation(true, subject, null);
    }

    public static TokenValidation invalid(String error) {
        return new TokenValidation(false, null, error);
    }

    /** The user id (or widget id) the token was issued for. */
    public Optional<String> getSubject() {
        return Optional.ofNullable(subject);
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }
}
