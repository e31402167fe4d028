package me.forketyfork.talk.xmpp;

import javax.xml.namespace.QName;

/**
 * The peer sent an element that is not allowed at this point of the stream,
 * or an element is missing a child the protocol requires.
 */
public class ProtocolException extends XmppException {

    private final QName element;

    public ProtocolException(String message) {
        this(message, (QName) null);
    }

    public ProtocolException(String message, QName element) {
        super(message);
        this.element = element;
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
        this.element = null;
    }

    /**
     * Creates the failure raised when an element has no decoder.
     */
    public static ProtocolException unexpected(QName element) {
        return new ProtocolException("unexpected XMPP element " + element.getNamespaceURI()
                + " <" + element.getLocalPart() + "/>", element);
    }

    /**
     * @return the offending element name, or {@code null} when the failure is not tied to one
     */
    public QName getElement() {
        return element;
    }
}
