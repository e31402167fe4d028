package me.forketyfork.talk.xmpp;

/**
 * SASL mechanisms this client can perform.
 */
public enum SaslMechanism {
    /**
     * Identity established by the transport, typically a client certificate; no payload.
     */
    EXTERNAL,
    /**
     * RFC 4616: base64 of {@code authzid NUL authcid NUL password}, with an empty authzid.
     */
    PLAIN
}
