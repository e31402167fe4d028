package me.forketyfork.talk.xmpp.stanza;

import me.forketyfork.talk.xmpp.Namespaces;

import javax.xml.namespace.QName;

public record SaslResponse(String data) implements Stanza {

    public static final QName NAME = new QName(Namespaces.SASL, "response");

    @Override
    public QName name() {
        return NAME;
    }
}
