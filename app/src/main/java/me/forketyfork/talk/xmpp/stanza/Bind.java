package me.forketyfork.talk.xmpp.stanza;

import me.forketyfork.talk.xmpp.Namespaces;

import javax.xml.namespace.QName;

/**
 * Resource binding payload. Requests carry an optional {@code resource}; results carry the
 * full {@code jid} the server assigned.
 */
public record Bind(String resource, String jid) implements Stanza {

    public static final QName NAME = new QName(Namespaces.BIND, "bind");

    @Override
    public QName name() {
        return NAME;
    }
}
