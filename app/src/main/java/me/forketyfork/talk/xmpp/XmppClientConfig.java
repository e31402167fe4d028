package me.forketyfork.talk.xmpp;

/**
 * Settings for one {@link XmppSession}. Every session gets its own value; nothing here is
 * shared between connections.
 */
public record XmppClientConfig(
        String jid,
        String password,
        String resource,
        boolean preferExternal,
        boolean allowInsecureAuth,
        boolean establishSession,
        String presenceShow,
        String presenceStatus,
        String language,
        int readTimeoutMs
) {

    public static final String DEFAULT_PRESENCE_SHOW = "chat";
    public static final String DEFAULT_PRESENCE_STATUS = "Online";
    public static final String DEFAULT_LANGUAGE = "en";
    public static final int DEFAULT_READ_TIMEOUT_MS = 0;

    /**
     * Create configuration with default settings for password authentication.
     *
     * @param jid      the bare identifier, {@code user@domain}
     * @param password the password
     */
    public XmppClientConfig(String jid, String password) {
        this(jid, password, null, false, false, true,
                DEFAULT_PRESENCE_SHOW, DEFAULT_PRESENCE_STATUS, DEFAULT_LANGUAGE, DEFAULT_READ_TIMEOUT_MS);
    }

    /**
     * Create a configuration with custom settings.
     *
     * @param jid               the bare identifier, {@code user@domain} (cannot be null or empty)
     * @param password          password for PLAIN, {@code null} for certificate-only identities
     * @param resource          resource to request when binding, {@code null} to let the server pick
     * @param preferExternal    try SASL EXTERNAL first when the server offers it
     * @param allowInsecureAuth send credentials over an unencrypted transport
     * @param establishSession  send the RFC 3921 session request when the server offers it
     * @param presenceShow      show value of the initial presence (cannot be null)
     * @param presenceStatus    status text of the initial presence (cannot be null)
     * @param language          xml:lang of the initial presence (cannot be null or empty)
     * @param readTimeoutMs     read timeout applied to the transport, 0 for none (>= 0)
     * @throws IllegalArgumentException if any parameter is invalid
     */
    public XmppClientConfig {
        if (jid == null || jid.trim().isEmpty()) {
            throw new IllegalArgumentException("JID cannot be null or empty");
        }
        if (presenceShow == null || presenceStatus == null) {
            throw new IllegalArgumentException("Presence show and status cannot be null");
        }
        if (language == null || language.trim().isEmpty()) {
            throw new IllegalArgumentException("Language cannot be null or empty");
        }
        if (readTimeoutMs < 0) {
            throw new IllegalArgumentException("Read timeout must be non-negative, got: " + readTimeoutMs);
        }
        jid = jid.trim();
        if (resource != null && resource.trim().isEmpty()) {
            resource = null;
        }
    }

    /**
     * @throws ConfigException if the JID has no domain part
     */
    public Credential credential() throws ConfigException {
        return Credential.parse(jid, password);
    }

    @Override
    public String toString() {
        return "XmppClientConfig{jid=" + jid + ", resource=" + resource
                + ", preferExternal=" + preferExternal + ", allowInsecureAuth=" + allowInsecureAuth
                + ", establishSession=" + establishSession + ", readTimeoutMs=" + readTimeoutMs + "}";
    }

    /**
     * Builder for {@link XmppClientConfig}.
     */
    public static class Builder {
        private String jid;
        private String password;
        private String resource;
        private boolean preferExternal;
        private boolean allowInsecureAuth;
        private boolean establishSession = true;
        private String presenceShow = DEFAULT_PRESENCE_SHOW;
        private String presenceStatus = DEFAULT_PRESENCE_STATUS;
        private String language = DEFAULT_LANGUAGE;
        private int readTimeoutMs = DEFAULT_READ_TIMEOUT_MS;

        public Builder jid(String jid) {
            this.jid = jid;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder resource(String resource) {
            this.resource = resource;
            return this;
        }

        public Builder preferExternal(boolean preferExternal) {
            this.preferExternal = preferExternal;
            return this;
        }

        public Builder allowInsecureAuth(boolean allowInsecureAuth) {
            this.allowInsecureAuth = allowInsecureAuth;
            return this;
        }

        public Builder establishSession(boolean establishSession) {
            this.establishSession = establishSession;
            return this;
        }

        public Builder presence(String show, String status) {
            this.presenceShow = show;
            this.presenceStatus = status;
            return this;
        }

        public Builder language(String language) {
            this.language = language;
            return this;
        }

        public Builder readTimeoutMs(int readTimeoutMs) {
            this.readTimeoutMs = readTimeoutMs;
            return this;
        }

        public XmppClientConfig build() {
            return new XmppClientConfig(jid, password, resource, preferExternal, allowInsecureAuth,
                    establishSession, presenceShow, presenceStatus, language, readTimeoutMs);
        }
    }

    /**
     * Create a builder for the configuration.
     */
    public static Builder builder() {
        return new Builder();
    }
}
