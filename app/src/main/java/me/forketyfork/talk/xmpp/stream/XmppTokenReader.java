package me.forketyfork.talk.xmpp.stream;

import com.ctc.wstx.stax.WstxInputFactory;
import me.forketyfork.talk.xmpp.EndOfStreamException;
import me.forketyfork.talk.xmpp.TransportException;
import me.forketyfork.talk.xmpp.TransportTimeoutException;
import me.forketyfork.talk.xmpp.XmppException;
import org.codehaus.stax2.XMLInputFactory2;
import org.codehaus.stax2.XMLStreamReader2;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import java.io.Reader;
import java.net.SocketTimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Pulls XML tokens off the transport for the whole life of a session.
 * <p>
 * One parser instance spans every stream restart: a second {@code <stream:stream>} simply
 * shows up as another start element. The parser is created on the first read, because
 * creating it already blocks on the prolog and the server stays silent until our own
 * stream header has been written.
 */
public class XmppTokenReader {

    private final Logger logger = Logger.getLogger("XmppTokenReader");

    private final XMLInputFactory2 inputFactory;
    private final RecordingReader input;
    private XMLStreamReader2 parser;

    public XmppTokenReader(Reader source) {
        this.input = new RecordingReader(new XmlDeclarationFilterReader(source));
        this.inputFactory = new WstxInputFactory();
        inputFactory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, Boolean.TRUE);
        inputFactory.setProperty(XMLInputFactory.IS_COALESCING, Boolean.FALSE);
        inputFactory.setProperty(XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
        inputFactory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);
    }

    /**
     * Advances to the next token.
     *
     * @return the StAX event type, see {@link XMLStreamConstants}
     * @throws EndOfStreamException if the transport reached its end
     * @throws TransportException   if reading failed or the input is not well-formed
     */
    public int next() throws XmppException {
        try {
            if (parser == null) {
                parser = (XMLStreamReader2) inputFactory.createXMLStreamReader(input);
            }
            if (!parser.hasNext()) {
                throw new EndOfStreamException();
            }
            return parser.next();
        } catch (XMLStreamException e) {
            throw translate(e);
        }
    }

    /**
     * @return the parser positioned on the token returned by the last {@link #next()}
     */
    public XMLStreamReader2 parser() {
        if (parser == null) {
            throw new IllegalStateException("No token has been read yet");
        }
        return parser;
    }

    /**
     * @return whether the current start element was written as {@code <name/>}
     */
    boolean emptyElement() throws XmppException {
        try {
            return parser().isEmptyElement();
        } catch (XMLStreamException e) {
            throw translate(e);
        }
    }

    /**
     * @return character offset just past the current token
     */
    long tokenEnd() throws XmppException {
        try {
            return parser().getLocationInfo().getEndingCharOffset();
        } catch (XMLStreamException e) {
            throw translate(e);
        }
    }

    /**
     * @return character offset where the current token starts
     */
    long tokenStart() {
        return parser().getLocationInfo().getStartingCharOffset();
    }

    /**
     * @return the original text between two character offsets, entity references unexpanded
     */
    String raw(long from, long to) {
        return input.slice(from, to);
    }

    /**
     * Drops recorded text up to the end of the current token. Called once a top-level
     * element has been decoded.
     */
    void release() throws XmppException {
        input.release(tokenEnd());
    }

    /**
     * Maps a parser failure onto the client's exception hierarchy.
     */
    public XmppException translate(XMLStreamException e) {
        if (input.endReached()) {
            logger.log(Level.FINE, "Input ended while parsing", e);
            return new EndOfStreamException();
        }
        for (Throwable cause = e; cause != null; cause = next(cause)) {
            if (cause instanceof SocketTimeoutException) {
                return new TransportTimeoutException("Timed out reading from the transport", cause);
            }
        }
        return new TransportException("Failed to read XMPP stream: " + e.getMessage(), e);
    }

    private static Throwable next(Throwable cause) {
        if (cause instanceof XMLStreamException && cause.getCause() == null) {
            return ((XMLStreamException) cause).getNestedException();
        }
        return cause.getCause();
    }
}
