package me.forketyfork.talk.xmpp;

/**
 * Who the client authenticates as.
 *
 * @param localpart the part of the identifier before the first {@code @}
 * @param domain    everything after it; the stream is addressed to this domain
 * @param secret    password for PLAIN, or {@code null} when the transport already established
 *                  the identity (client certificate) and only EXTERNAL makes sense
 */
public record Credential(String localpart, String domain, String secret) {

    /**
     * Splits {@code user@domain} on its first {@code @}.
     *
     * @throws ConfigException if the identifier contains no {@code @}
     */
    public static Credential parse(String identifier, String secret) throws ConfigException {
        int at = identifier == null ? -1 : identifier.indexOf('@');
        if (at < 0) {
            throw new ConfigException("xmpp: invalid username (want user@domain): " + identifier);
        }
        return new Credential(identifier.substring(0, at), identifier.substring(at + 1), secret);
    }

    public boolean hasSecret() {
        return secret != null;
    }

    @Override
    public String toString() {
        return "Credential{" + localpart + "@" + domain + (hasSecret() ? ", secret=***" : ", external") + "}";
    }
}
