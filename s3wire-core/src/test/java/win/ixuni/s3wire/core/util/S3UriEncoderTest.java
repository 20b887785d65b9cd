package win.ixuni.s3wire.core.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class S3UriEncoderTest {

    @Test
    @DisplayName("Unreserved characters are left as-is")
    void testUnreserved() {
        assertEquals("AZaz09-._~", S3UriEncoder.encode("AZaz09-._~"));
    }

    @Test
    @DisplayName("Space is %20, plus and star are escaped")
    void testReservedCharacters() {
        assertEquals("a%20b%2Bc%2A", S3UriEncoder.encode("a b+c*"));
        assertEquals("%3F%26%3D%23%25", S3UriEncoder.encode("?&=#%"));
    }

    @Test
    @DisplayName("Multi-byte UTF-8 uses uppercase hex")
    void testUnicode() {
        assertEquals("%C3%BC%E4%B8%AD", S3UriEncoder.encode("ü中"));
    }

    @Test
    @DisplayName("Key keeps its slashes, bucket does not")
    void testBuildPath() {
        assertEquals("/b/k", S3UriEncoder.buildPath("b", "k"));
        assertEquals("/my%20bucket/photos/2024/a%20b.jpg",
                S3UriEncoder.buildPath("my bucket", "photos/2024/a b.jpg"));
        assertEquals("/a%2Fb/c/d", S3UriEncoder.buildPath("a/b", "c/d"));
    }

    @Test
    @DisplayName("Leading, trailing and repeated slashes in keys survive")
    void testKeySlashes() {
        assertEquals("/dir//file/", S3UriEncoder.encodeKey("/dir//file/"));
    }

    @Test
    @DisplayName("Query string keeps map order and encodes values")
    void testQueryString() {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("uploadId", "abc/def+=");
        query.put("x", "1 2");
        assertEquals("uploadId=abc%2Fdef%2B%3D&x=1%202", S3UriEncoder.buildQueryString(query));
        assertEquals("", S3UriEncoder.buildQueryString(Map.of()));
    }
}
