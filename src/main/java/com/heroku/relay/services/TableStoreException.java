package com.heroku.relay.services;

public class TableStoreException extends RuntimeException {

    public TableStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
