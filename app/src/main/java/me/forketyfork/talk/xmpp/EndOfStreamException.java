package me.forketyfork.talk.xmpp;

/**
 * The transport was closed cleanly while the reader was waiting for the next element.
 * This is the normal way a stream ends and is deliberately not a {@link TransportException}.
 */
public class EndOfStreamException extends XmppException {

    public EndOfStreamException() {
        super("end of XMPP stream");
    }
}
