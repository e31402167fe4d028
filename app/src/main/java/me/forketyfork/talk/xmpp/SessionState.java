package me.forketyfork.talk.xmpp;

/**
 * Steps of the connect-time handshake, in the order a session passes through them.
 */
public enum SessionState {
    DISCONNECTED,
    STREAM_OPENED,
    AWAITING_STREAM_ROOT,
    AWAITING_FEATURES,
    AUTH_SENT,
    AUTHENTICATED,
    AUTH_FAILED,
    STREAM_RESTARTED,
    BIND_SENT,
    BOUND,
    PRESENCE_SENT,
    READY,
    CLOSED
}
