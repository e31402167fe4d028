package me.forketyfork.talk.xmpp;

/**
 * A deadline set on the transport expired while a read or write was in progress.
 */
public class TransportTimeoutException extends TransportException {

    public TransportTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
