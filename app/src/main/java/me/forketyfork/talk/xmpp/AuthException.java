package me.forketyfork.talk.xmpp;

/**
 * SASL authentication could not be completed: either no mechanism is acceptable to both
 * sides or the server answered with a failure.
 */
public class AuthException extends XmppException {

    private final String reason;

    public AuthException(String message) {
        this(message, null);
    }

    public AuthException(String message, String reason) {
        super(message);
        this.reason = reason;
    }

    /**
     * @return the SASL failure condition reported by the server, e.g. {@code not-authorized},
     * or {@code null} when the failure was detected locally
     */
    public String getReason() {
        return reason;
    }
}
