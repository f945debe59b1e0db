package com.example.widgetstate.shared.callback;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.Optional;

@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class CallbackResult {

    private static final CallbackResult NOT_HANDLED = new CallbackResult(false, null);

    private final boolean handled;
    private final Object result;

    public static CallbackResult handled(Object result) {
        return new CallbackResult(true, result);
    }

    public static CallbackResult notHandled() {
        return NOT_HANDLED;
    }

    public Optional<Object> getResult() {
        return Optional.ofNullable(result);
    }
}
