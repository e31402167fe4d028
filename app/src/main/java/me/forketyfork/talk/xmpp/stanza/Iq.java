package me.forketyfork.talk.xmpp.stanza;

import me.forketyfork.talk.xmpp.Namespaces;

import javax.xml.namespace.QName;
import java.util.List;

/**
 * An info/query stanza.
 *
 * @param type    get, set, result or error
 * @param bind    the resource binding child, if present
 * @param payload children other than {@code <bind>} and {@code <error>}, captured raw
 */
public record Iq(String from, String id, String to, String type,
                 StanzaError error, Bind bind, List<RawElement> payload) implements Stanza {

    public static final QName NAME = new QName(Namespaces.CLIENT, "iq");

    public Iq {
        payload = payload == null ? List.of() : List.copyOf(payload);
    }

    public boolean isResult() {
        return "result".equals(type);
    }

    @Override
    public QName name() {
        return NAME;
    }
}
