package com.heroku.relay.realtime;

/**
 * Upstream source of row-level change notifications.
 */
public interface ChangeFeedSource {

    /**
     * Opens and authenticates the connection. Returns once the connection is usable.
     * @throws ChangeFeedException if the upstream rejects the credentials or cannot be reached
     */
    void connect();

    /**
     * Registers a push subscription. "*" matches every table or operation.
     */
    ChangeFeedChannel subscribe(String schema, String table, String event, ChangeFeedListener listener);

    boolean isConnected();

    /**
     * Drops the connection and every channel on it.
     */
    void disconnect();
}
