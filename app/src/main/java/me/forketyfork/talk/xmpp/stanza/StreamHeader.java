package me.forketyfork.talk.xmpp.stanza;

import me.forketyfork.talk.xmpp.Namespaces;

import javax.xml.namespace.QName;

/**
 * Attributes of the {@code <stream:stream>} root sent by the server. The root stays open for
 * the life of the stream, so only its start tag is decoded.
 */
public record StreamHeader(String from, String id, String version, String lang) implements Stanza {

    public static final QName NAME = new QName(Namespaces.STREAM, "stream");

    @Override
    public QName name() {
        return NAME;
    }
}
