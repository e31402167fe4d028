package me.forketyfork.talk.xmpp;

/**
 * Base class of every failure raised by the XMPP client engine.
 */
public class XmppException extends Exception {

    public XmppException(String message) {
        super(message);
    }

    public XmppException(String message, Throwable cause) {
        super(message, cause);
    }
}
