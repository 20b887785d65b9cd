package win.ixuni.s3wire.core.util;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * S3 URI 编码工具类
 * <p>
 * Only A-Za-z0-9-._~ are left as-is; every other UTF-8 byte becomes %XX with
 * uppercase hex. 空格编码为 %20（不是 +）。
 */
public final class S3UriEncoder {

    private S3UriEncoder() {
        // 工具类不允许实例化
    }

    /**
     * Percent-encode a value, slashes included
     */
    public static String encode(String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }

        StringBuilder result = new StringBuilder(input.length());
        byte[] bytes = input.getBytes(StandardCharsets.UTF_8);

        for (byte b : bytes) {
            char c = (char) (b & 0xFF);
            if (isUnreservedCharacter(c)) {
                result.append(c);
            } else {
                result.append('%').append(String.format("%02X", b & 0xFF));
            }
        }

        return result.toString();
    }

    /**
     * Encode an object key, keeping its "/" separators
     * <p>
     * The whole key is encoded first, then %2F is turned back into "/".
     */
    public static String encodeKey(String key) {
        return encode(key).replace("%2F", "/");
    }

    /**
     * Build the request path: /{bucket}/{key}
     */
    public static String buildPath(String bucket, String key) {
        return "/" + encode(bucket) + "/" + encodeKey(key);
    }

    /**
     * Render query parameters in map order as name=value pairs joined by "&amp;"
     */
    public static String buildQueryString(Map<String, String> query) {
        if (query == null || query.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> entry : query.entrySet()) {
            if (sb.length() > 0) {
                sb.append('&');
            }
            sb.append(encode(entry.getKey()))
                    .append('=')
                    .append(encode(entry.getValue()));
        }
        return sb.toString();
    }

    /**
     * 检查字符是否是 URI 编码规范中的非保留字符
     * 非保留字符: A-Z a-z 0-9 - . _ ~
     */
    private static boolean isUnreservedCharacter(char c) {
        return (c >= 'A' && c <= 'Z') ||
                (c >= 'a' && c <= 'z') ||
                (c >= '0' && c <= '9') ||
                c == '-' || c == '.' || c == '_' || c == '~';
    }
}
