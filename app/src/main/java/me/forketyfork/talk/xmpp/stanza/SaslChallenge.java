package me.forketyfork.talk.xmpp.stanza;

import me.forketyfork.talk.xmpp.Namespaces;

import javax.xml.namespace.QName;

/**
 * @param data base64 text exactly as sent, possibly empty
 */
public record SaslChallenge(String data) implements Stanza {

    public static final QName NAME = new QName(Namespaces.SASL, "challenge");

    @Override
    public QName name() {
        return NAME;
    }
}
