package com.naturaltime.plugin;

import com.naturaltime.token.TimeToken;

public class TimeFormatException extends RuntimeException {
    private final transient TimeToken token;

    public TimeFormatException(String message, TimeToken token) {
        super(message + ": " + token.representation());
        this.token = token;
    }

    public TimeToken getToken() {
        return token;
    }
}
