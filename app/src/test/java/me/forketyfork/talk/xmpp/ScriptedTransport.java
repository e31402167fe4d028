package me.forketyfork.talk.xmpp;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * A transport whose server side is a fixed script. Everything the client writes is recorded.
 */
class ScriptedTransport implements Transport {

    private final InputStream input;
    private final ByteArrayOutputStream written = new ByteArrayOutputStream();
    private final boolean secure;
    private boolean failWrites;
    private boolean closed;
    private int readTimeoutMs = -1;

    ScriptedTransport(String serverScript) {
        this(serverScript, false);
    }

    ScriptedTransport(String serverScript, boolean secure) {
        this.input = new ByteArrayInputStream(serverScript.getBytes(StandardCharsets.UTF_8));
        this.secure = secure;
    }

    /**
     * Makes every later write fail, as if the peer had gone away.
     */
    void failWrites() {
        this.failWrites = true;
    }

    String written() {
        return written.toString(StandardCharsets.UTF_8);
    }

    boolean isClosed() {
        return closed;
    }

    int readTimeoutMs() {
        return readTimeoutMs;
    }

    @Override
    public InputStream getInputStream() {
        return input;
    }

    @Override
    public OutputStream getOutputStream() {
        return new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                write(new byte[]{(byte) b}, 0, 1);
            }

            @Override
            public void write(byte[] b, int off, int len) throws IOException {
                if (failWrites || closed) {
                    throw new IOException("Broken pipe");
                }
                written.write(b, off, len);
            }
        };
    }

    @Override
    public boolean isSecure() {
        return secure;
    }

    @Override
    public void setReadTimeout(int timeoutMs) {
        this.readTimeoutMs = timeoutMs;
    }

    @Override
    public void close() {
        closed = true;
    }
}
