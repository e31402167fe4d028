package me.forketyfork.talk.xmpp.stanza;

import me.forketyfork.talk.xmpp.Namespaces;

import javax.xml.namespace.QName;

/**
 * A {@code <stream:error>}; the stream is unusable once the server sends one.
 *
 * @param condition local name of the defined condition child, e.g. {@code host-unknown}
 * @param text      optional human-readable description
 */
public record StreamError(String condition, String text) implements Stanza {

    public static final QName NAME = new QName(Namespaces.STREAM, "error");

    @Override
    public QName name() {
        return NAME;
    }
}
