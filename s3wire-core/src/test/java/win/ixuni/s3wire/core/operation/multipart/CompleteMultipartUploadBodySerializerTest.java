package win.ixuni.s3wire.core.operation.multipart;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import win.ixuni.s3wire.core.model.CompletedMultipartUpload;
import win.ixuni.s3wire.core.model.CompletedPart;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * XML body wire format tests
 */
class CompleteMultipartUploadBodySerializerTest {

    private final CompleteMultipartUploadBodySerializer serializer = new CompleteMultipartUploadBodySerializer();

    // ==================== 格式 ====================

    @Test
    @DisplayName("Body matches the service wire format after the XML declaration")
    void testWireFormat() {
        byte[] body = serializer.serialize(CompletedMultipartUpload.of(List.of(
                CompletedPart.of(1, "\"etag1\""),
                CompletedPart.of(2, "\"etag2\""))));

        String xml = new String(body, StandardCharsets.UTF_8);
        assertTrue(xml.startsWith("<?xml "), "Missing XML declaration: " + xml);
        assertTrue(xml.contains("1.0") && xml.contains("UTF-8"), "Declaration must name version and encoding");

        String element = xml.substring(xml.indexOf("?>") + 2);
        assertEquals("<CompleteMultipartUpload xmlns=\"http://s3.amazonaws.com/doc/2006-03-01/\">"
                + "<Part><PartNumber>1</PartNumber><ETag>\"etag1\"</ETag></Part>"
                + "<Part><PartNumber>2</PartNumber><ETag>\"etag2\"</ETag></Part>"
                + "</CompleteMultipartUpload>", element.replace("&quot;", "\""));
    }

    @Test
    @DisplayName("No document gives a zero-length body")
    void testAbsentDocument() {
        assertEquals(0, serializer.serialize(null).length);
    }

    // ==================== 顺序 ====================

    @Test
    @DisplayName("Parts keep caller order, not part-number order")
    void testCallerOrderPreserved() throws Exception {
        byte[] body = serializer.serialize(CompletedMultipartUpload.of(List.of(
                CompletedPart.of(1, "etag1"),
                CompletedPart.of(3, "etag3"),
                CompletedPart.of(2, "etag2"))));

        Document doc = parse(body);
        NodeList parts = doc.getElementsByTagName("Part");
        assertEquals(3, parts.getLength());
        assertEquals("1", text((Element) parts.item(0), "PartNumber"));
        assertEquals("etag1", text((Element) parts.item(0), "ETag"));
        assertEquals("3", text((Element) parts.item(1), "PartNumber"));
        assertEquals("etag3", text((Element) parts.item(1), "ETag"));
        assertEquals("2", text((Element) parts.item(2), "PartNumber"));
        assertEquals("etag2", text((Element) parts.item(2), "ETag"));
    }

    // ==================== 转义 ====================

    @Test
    @DisplayName("Special characters in ETag are escaped and survive a parser round trip")
    void testEscaping() throws Exception {
        String etag = "a&b<c>d\"e'f";
        byte[] body = serializer.serialize(CompletedMultipartUpload.of(List.of(CompletedPart.of(7, etag))));

        String xml = new String(body, StandardCharsets.UTF_8);
        assertFalse(xml.contains("a&b"), "Raw ampersand must not appear");
        assertFalse(xml.contains("<c>"), "Raw less-than must not appear");
        assertFalse(xml.contains("c>d"), "Raw greater-than must not appear");
        assertTrue(xml.contains("a&amp;b&lt;c&gt;d"));

        Document doc = parse(body);
        assertEquals(etag, text(doc.getDocumentElement(), "ETag"));
    }

    @Test
    @DisplayName("Greater-than is escaped everywhere in text, not only after ]]")
    void testGreaterThanEscaping() throws Exception {
        String etag = "\"e1\" a>b ]]> c&d<e";
        byte[] body = serializer.serialize(CompletedMultipartUpload.of(List.of(CompletedPart.of(1, etag))));

        String xml = new String(body, StandardCharsets.UTF_8);
        assertTrue(xml.contains("a&gt;b ]]&gt; c&amp;d&lt;e</ETag>"), xml);
        assertEquals(etag, text(parse(body).getDocumentElement(), "ETag"));
    }

    @Test
    @DisplayName("Non-ASCII content is written as UTF-8")
    void testUtf8() throws Exception {
        byte[] body = serializer.serialize(CompletedMultipartUpload.of(List.of(CompletedPart.of(1, "標籤-ü"))));
        assertEquals("標籤-ü", text(parse(body).getDocumentElement(), "ETag"));
    }

    // ==================== 可选元素 ====================

    @Test
    @DisplayName("Per-part checksums are written after ETag only when present")
    void testPartChecksums() throws Exception {
        CompletedPart part = CompletedPart.builder()
                .partNumber(1)
                .etag("e1")
                .checksumSha256("c2hhMjU2")
                .build();
        byte[] body = serializer.serialize(CompletedMultipartUpload.of(List.of(part)));

        String xml = new String(body, StandardCharsets.UTF_8);
        assertTrue(xml.contains("<ETag>e1</ETag><ChecksumSHA256>c2hhMjU2</ChecksumSHA256></Part>"), xml);
        assertFalse(xml.contains("ChecksumCRC32"));
        assertFalse(xml.contains("ChecksumSHA1"));
    }

    @Test
    @DisplayName("Empty part list still produces the namespaced root")
    void testEmptyPartList() throws Exception {
        byte[] body = serializer.serialize(CompletedMultipartUpload.builder().build());

        Document doc = parse(body);
        Element root = doc.getDocumentElement();
        assertEquals("CompleteMultipartUpload", root.getLocalName());
        assertEquals(CompleteMultipartUploadBodySerializer.NAMESPACE, root.getNamespaceURI());
        assertEquals(0, root.getElementsByTagName("Part").getLength());
    }

    @Test
    @DisplayName("Children inherit the default namespace without redeclaring it")
    void testNamespaceDeclaredOnce() {
        byte[] body = serializer.serialize(CompletedMultipartUpload.of(List.of(CompletedPart.of(1, "e"))));
        String xml = new String(body, StandardCharsets.UTF_8);
        assertEquals(xml.indexOf("xmlns"), xml.lastIndexOf("xmlns"));
    }

    private static Document parse(byte[] body) throws Exception {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        return factory.newDocumentBuilder().parse(new ByteArrayInputStream(body));
    }

    private static String text(Element parent, String name) {
        return parent.getElementsByTagName(name).item(0).getTextContent();
    }
}
