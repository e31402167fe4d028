package me.forketyfork.talk.xmpp.stanza;

import me.forketyfork.talk.xmpp.Namespaces;

import javax.xml.namespace.QName;

/**
 * The {@code <error>} child of a stanza, also accepted as a top-level element.
 *
 * @param code      legacy numeric code, may be {@code null}
 * @param type      one of auth, cancel, continue, modify, wait
 * @param condition local name of the defined condition, e.g. {@code bad-request}
 * @param text      optional description
 */
public record StanzaError(String code, String type, String condition, String text) implements Stanza {

    public static final QName NAME = new QName(Namespaces.CLIENT, "error");

    @Override
    public QName name() {
        return NAME;
    }
}
