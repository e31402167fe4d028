package me.forketyfork.talk.xmpp;

/**
 * The client was configured with a value it cannot use, such as an identifier without a domain.
 */
public class ConfigException extends XmppException {

    public ConfigException(String message) {
        super(message);
    }
}
