package me.forketyfork.talk.xmpp;

import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;

public class SwitchableInputStreamTest {

    private static ByteArrayInputStream bytes(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void aReaderOnTopContinuesWithTheNextStream() throws Exception {
        SwitchableInputStream input = new SwitchableInputStream(bytes("first line\n"));
        BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));

        String first = reader.readLine();
        input.switchTo(bytes("second line\n"));
        String second = reader.readLine();

        assertThat(first, equalTo("first line"));
        assertThat(second, equalTo("second line"));
    }
}
