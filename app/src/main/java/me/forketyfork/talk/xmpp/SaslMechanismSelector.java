package me.forketyfork.talk.xmpp;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Collection;

/**
 * Decides how to authenticate given what the server offers. No I/O happens here.
 */
public final class SaslMechanismSelector {

    private SaslMechanismSelector() {
    }

    /**
     * Picks EXTERNAL when the caller prefers it and the server offers it, otherwise PLAIN when
     * offered and a password is available.
     *
     * @param advertised     mechanism names from the server's features
     * @param preferExternal caller policy
     * @param credential     who to authenticate as
     * @throws AuthException if neither mechanism can be used
     */
    public static SaslSelection select(Collection<String> advertised, boolean preferExternal,
                                       Credential credential) throws AuthException {
        if (preferExternal && advertised.contains(SaslMechanism.EXTERNAL.name())) {
            return new SaslSelection(SaslMechanism.EXTERNAL, null);
        }
        if (advertised.contains(SaslMechanism.PLAIN.name()) && credential.hasSecret()) {
            return new SaslSelection(SaslMechanism.PLAIN, plainPayload(credential));
        }
        throw new AuthException("No usable SASL mechanism among " + advertised
                + (credential.hasSecret() ? "" : " for a credential without password"));
    }

    static String plainPayload(Credential credential) {
        String raw = '\u0000' + credential.localpart() + '\u0000' + credential.secret();
        return Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }
}
