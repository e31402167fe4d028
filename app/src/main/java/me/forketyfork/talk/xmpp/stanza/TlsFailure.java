package me.forketyfork.talk.xmpp.stanza;

import me.forketyfork.talk.xmpp.Namespaces;

import javax.xml.namespace.QName;

public record TlsFailure() implements Stanza {

    public static final QName NAME = new QName(Namespaces.TLS, "failure");

    @Override
    public QName name() {
        return NAME;
    }
}
