package win.ixuni.s3wire.core.operation.multipart;

import win.ixuni.s3wire.core.model.CompletedMultipartUpload;
import win.ixuni.s3wire.core.model.CompletedPart;
import win.ixuni.s3wire.core.util.XmlUtils;

import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;

/**
 * XML body serializer for CompleteMultipartUpload
 * <p>
 * No document means an empty body, not an empty root element. Parts are written
 * in list order.
 */
class CompleteMultipartUploadBodySerializer {

    static final String NAMESPACE = "http://s3.amazonaws.com/doc/2006-03-01/";

    private static final byte[] EMPTY = new byte[0];

    byte[] serialize(CompletedMultipartUpload upload) {
        if (upload == null) {
            return EMPTY;
        }
        return XmlUtils.toXmlBytes(writer -> {
            writer.writeStartElement("CompleteMultipartUpload");
            writer.writeDefaultNamespace(NAMESPACE);
            for (CompletedPart part : upload.getParts()) {
                writePart(writer, part);
            }
            writer.writeEndElement();
        });
    }

    private static void writePart(XMLStreamWriter writer, CompletedPart part) throws XMLStreamException {
        writer.writeStartElement("Part");
        if (part.getPartNumber() != null) {
            writeElement(writer, "PartNumber", String.valueOf(part.getPartNumber()));
        }
        writeElement(writer, "ETag", part.getEtag());
        writeElement(writer, "ChecksumCRC32", part.getChecksumCrc32());
        writeElement(writer, "ChecksumCRC32C", part.getChecksumCrc32c());
        writeElement(writer, "ChecksumSHA1", part.getChecksumSha1());
        writeElement(writer, "ChecksumSHA256", part.getChecksumSha256());
        writer.writeEndElement();
    }

    private static void writeElement(XMLStreamWriter writer, String name, String value) throws XMLStreamException {
        if (value == null) {
            return;
        }
        writer.writeStartElement(name);
        writer.writeCharacters(value);
        writer.writeEndElement();
    }
}
