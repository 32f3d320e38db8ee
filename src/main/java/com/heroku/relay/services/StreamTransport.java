package com.heroku.relay.services;

import java.io.IOException;

/**
 * Write side of one client's push connection.
 */
public interface StreamTransport {

    /**
     * @return true once the peer has gone away
     */
    boolean isDisconnected();

    /**
     * Writes one payload as a discrete message frame.
     * @throws IOException if the frame can no longer be delivered
     */
    void send(String payload) throws IOException;

    /**
     * Ends the stream from the server side. Called once when the handler exits.
     */
    void close();
}
