package me.forketyfork.talk.xmpp;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class SaslMechanismSelectorTest {

    private static final List<String> ALL = List.of("EXTERNAL", "PLAIN", "X-OAUTH2");
    private static final Credential WITH_PASSWORD = new Credential("juliet", "example.com", "secret");

    @Test
    public void picksExternalWhenPreferredAndOffered() throws Exception {
        SaslSelection selection = SaslMechanismSelector.select(ALL, true, WITH_PASSWORD);

        assertThat(selection.mechanism(), is(SaslMechanism.EXTERNAL));
        assertThat(selection.payload(), is(nullValue()));
    }

    @Test
    public void picksPlainWhenExternalIsNotPreferred() throws Exception {
        SaslSelection selection = SaslMechanismSelector.select(ALL, false, WITH_PASSWORD);

        assertThat(selection.mechanism(), is(SaslMechanism.PLAIN));
        assertThat(new String(Base64.getDecoder().decode(selection.payload()), StandardCharsets.UTF_8),
                equalTo("\0juliet\0secret"));
    }

    @Test
    public void fallsBackToPlainWhenExternalIsNotOffered() throws Exception {
        SaslSelection selection = SaslMechanismSelector.select(List.of("PLAIN", "X-OAUTH2"), true, WITH_PASSWORD);

        assertThat(selection.mechanism(), is(SaslMechanism.PLAIN));
    }

    @Test
    public void failsWhenNothingUsableIsOffered() {
        assertThrows(AuthException.class,
                () -> SaslMechanismSelector.select(List.of("X-OAUTH2"), true, WITH_PASSWORD));
        assertThrows(AuthException.class,
                () -> SaslMechanismSelector.select(List.of("X-OAUTH2"), false, WITH_PASSWORD));
    }

    @Test
    public void plainNeedsAPassword() {
        Credential certificateOnly = new Credential("juliet", "example.com", null);

        AuthException e = assertThrows(AuthException.class,
                () -> SaslMechanismSelector.select(List.of("PLAIN"), false, certificateOnly));

        assertThat(e.getReason(), is(nullValue()));
    }

    @Test
    public void encodesNonAsciiPasswordsAsUtf8() {
        String payload = SaslMechanismSelector.plainPayload(new Credential("jülia", "example.com", "pässword"));

        assertThat(new String(Base64.getDecoder().decode(payload), StandardCharsets.UTF_8),
                equalTo("\0jülia\0pässword"));
    }
}
