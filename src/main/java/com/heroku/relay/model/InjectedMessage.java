package com.heroku.relay.model;

/**
 * Body of the administrative injection endpoint
 */
public class InjectedMessage {
    public String message;
}
