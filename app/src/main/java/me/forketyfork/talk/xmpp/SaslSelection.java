package me.forketyfork.talk.xmpp;

/**
 * @param mechanism the chosen mechanism
 * @param payload   base64 initial response, or {@code null} when the mechanism sends none
 */
public record SaslSelection(SaslMechanism mechanism, String payload) {

    @Override
    public String toString() {
        return "SaslSelection{" + mechanism + (payload == null ? "" : ", payload=***") + "}";
    }
}
