package com.heroku.relay.realtime;

import com.fasterxml.jackson.databind.JsonNode;

@FunctionalInterface
public interface ChangeFeedListener {

    /**
     * Receives one raw change notification, shaped {data: {...}, ids: [...]}.
     */
    void onNotification(JsonNode payload);
}
