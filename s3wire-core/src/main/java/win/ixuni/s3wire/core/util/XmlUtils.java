package win.ixuni.s3wire.core.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import org.codehaus.stax2.XMLOutputFactory2;
import org.codehaus.stax2.io.EscapingWriterFactory;
import win.ixuni.s3wire.core.exception.SerializationException;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import javax.xml.stream.XMLStreamWriter;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.FilterWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UnsupportedEncodingException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * XML 工具类
 * <p>
 * Request bodies are written through a plain (non-repairing) StAX writer so the
 * default namespace lands on the root element exactly once. Responses are read
 * with Jackson's XmlMapper.
 */
public final class XmlUtils {

    private static final XmlMapper MAPPER = XmlMapper.builder()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .build();

    private static final XMLOutputFactory OUTPUT_FACTORY = createOutputFactory();

    private static final XMLInputFactory INPUT_FACTORY = createInputFactory();

    private XmlUtils() {
    }

    private static XMLOutputFactory createOutputFactory() {
        XMLOutputFactory factory = XMLOutputFactory.newFactory();
        // Woodstox leaves '>' raw in text unless it closes "]]>"
        factory.setProperty(XMLOutputFactory2.P_TEXT_ESCAPER, new TextEscapingWriterFactory());
        return factory;
    }

    /**
     * Writes one XML document into a StAX writer
     */
    @FunctionalInterface
    public interface XmlBodyWriter {
        void write(XMLStreamWriter writer) throws XMLStreamException;
    }

    /**
     * Serialize a document as compact UTF-8 with an XML declaration
     */
    public static byte[] toXmlBytes(XmlBodyWriter body) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            XMLStreamWriter writer = OUTPUT_FACTORY.createXMLStreamWriter(out, StandardCharsets.UTF_8.name());
            writer.writeStartDocument(StandardCharsets.UTF_8.name(), "1.0");
            body.write(writer);
            writer.writeEndDocument();
            writer.flush();
            writer.close();
        } catch (XMLStreamException e) {
            throw new SerializationException("Failed to serialize XML body: " + e.getMessage(), e);
        }
        return out.toByteArray();
    }

    public static <T> T fromXml(byte[] xml, Class<T> clazz) {
        try {
            return MAPPER.readValue(xml, clazz);
        } catch (IOException e) {
            throw new SerializationException("Failed to deserialize XML as " + clazz.getSimpleName(), e);
        }
    }

    /**
     * Local name of the document element, or null for an empty document
     */
    public static String rootElementName(byte[] xml) {
        if (xml == null || xml.length == 0) {
            return null;
        }
        try {
            XMLStreamReader reader = INPUT_FACTORY.createXMLStreamReader(new ByteArrayInputStream(xml));
            String name = null;
            while (name == null && reader.hasNext()) {
                if (reader.next() == XMLStreamReader.START_ELEMENT) {
                    name = reader.getLocalName();
                }
            }
            reader.close();
            return name;
        } catch (XMLStreamException e) {
            throw new SerializationException("Response body is not well-formed XML", e);
        }
    }

    private static XMLInputFactory createInputFactory() {
        XMLInputFactory factory = XMLInputFactory.newFactory();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        return factory;
    }

    /**
     * 文本转义：&amp; &lt; &gt; 全部转义
     */
    static final class TextEscapingWriterFactory implements EscapingWriterFactory {

        @Override
        public Writer createEscapingWriterFor(Writer writer, String encoding) {
            return new TextEscapingWriter(writer);
        }

        @Override
        public Writer createEscapingWriterFor(OutputStream out, String encoding) throws UnsupportedEncodingException {
            return new TextEscapingWriter(new OutputStreamWriter(out, encoding));
        }
    }

    static final class TextEscapingWriter extends FilterWriter {

        TextEscapingWriter(Writer out) {
            super(out);
        }

        @Override
        public void write(int c) throws IOException {
            switch (c) {
                case '&':
                    out.write("&amp;");
                    break;
                case '<':
                    out.write("&lt;");
                    break;
                case '>':
                    out.write("&gt;");
                    break;
                default:
                    out.write(c);
            }
        }

        @Override
        public void write(char[] cbuf, int off, int len) throws IOException {
            for (int i = off; i < off + len; i++) {
                write(cbuf[i]);
            }
        }

        @Override
        public void write(String str, int off, int len) throws IOException {
            for (int i = off; i < off + len; i++) {
                write(str.charAt(i));
            }
        }
    }
}
