package me.forketyfork.talk.xmpp;

/**
 * Reading from or writing to the transport failed, or the bytes read were not well-formed XML.
 */
public class TransportException extends XmppException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
