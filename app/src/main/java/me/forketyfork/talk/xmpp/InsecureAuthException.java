package me.forketyfork.talk.xmpp;

/**
 * Raised instead of sending credentials over a transport that is not encrypted,
 * unless the configuration explicitly allows it.
 */
public class InsecureAuthException extends XmppException {

    public InsecureAuthException(String message) {
        super(message);
    }
}
