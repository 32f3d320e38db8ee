package com.heroku.relay.realtime;

public class ChangeFeedException extends RuntimeException {

    public ChangeFeedException(String message) {
        super(message);
    }

    public ChangeFeedException(String message, Throwable cause) {
        super(message, cause);
    }
}
