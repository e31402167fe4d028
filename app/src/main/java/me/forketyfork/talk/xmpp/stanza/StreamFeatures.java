package me.forketyfork.talk.xmpp.stanza;

import me.forketyfork.talk.xmpp.Namespaces;

import javax.xml.namespace.QName;
import java.util.List;

/**
 * Capabilities the server offers for the current stream instance.
 *
 * @param startTls         whether STARTTLS is offered
 * @param startTlsRequired whether the server insists on STARTTLS
 * @param mechanisms       SASL mechanisms, in the order advertised
 * @param bind             whether resource binding is offered
 * @param session          whether session establishment is offered
 * @param other            features this client does not model
 */
public record StreamFeatures(boolean startTls, boolean startTlsRequired, List<String> mechanisms,
                             boolean bind, boolean session, List<RawElement> other) implements Stanza {

    public static final QName NAME = new QName(Namespaces.STREAM, "features");

    /**
     * Stands in for a features block that was absent or could not be decoded.
     */
    public static final StreamFeatures NONE = new StreamFeatures(false, false, List.of(), false, false, List.of());

    public StreamFeatures {
        mechanisms = mechanisms == null ? List.of() : List.copyOf(mechanisms);
        other = other == null ? List.of() : List.copyOf(other);
    }

    public boolean offersMechanism(String mechanism) {
        return mechanisms.contains(mechanism);
    }

    @Override
    public QName name() {
        return NAME;
    }
}
