package me.forketyfork.talk.xmpp.stanza;

import me.forketyfork.talk.xmpp.Namespaces;

import javax.xml.namespace.QName;

/**
 * @param condition local name of the first child other than {@code <text>}, e.g. {@code not-authorized}
 * @param text      optional description
 */
public record SaslFailure(String condition, String text) implements Stanza {

    public static final QName NAME = new QName(Namespaces.SASL, "failure");

    @Override
    public QName name() {
        return NAME;
    }
}
