package com.heroku.relay.realtime;

/**
 * A subscription registered with a {@link ChangeFeedSource}.
 */
public interface ChangeFeedChannel {

    String getTopic();

    /**
     * @return true while the upstream confirms the subscription is live
     */
    boolean isJoined();
}
