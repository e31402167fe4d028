package me.forketyfork.talk.xmpp.stanza;

import me.forketyfork.talk.xmpp.Namespaces;

import javax.xml.namespace.QName;

/**
 * @param data additional data with success, usually empty
 */
public record SaslSuccess(String data) implements Stanza {

    public static final QName NAME = new QName(Namespaces.SASL, "success");

    @Override
    public QName name() {
        return NAME;
    }
}
