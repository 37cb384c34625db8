package org.smileyface.sitecrawler.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public class CrawlerUtils {

    private CrawlerUtils() {
        // No instanciation
    }

    /**
     * Canonicalizes an absolute URL into the identity key used for deduplication.
     * <ul>
     *   <li>the fragment is dropped;</li>
     *   <li>scheme must be http or https and host must be present, otherwise null is returned;</li>
     *   <li>scheme and host are lower-cased, a default port is dropped, user-info is dropped;</li>
     *   <li>an empty path becomes {@code /}; path and query are kept in their raw (encoded) form,
     *   with characters a URI may not contain (spaces, {@code |}, non-ASCII) percent-encoded.</li>
     * </ul>
     *
     * @param raw absolute URL, may be null
     * @return canonical URL or null when the input is not a crawlable http(s) URL
     */
    public static String canonicalize(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String trimmed = raw.trim();
        int hash = trimmed.indexOf('#');
        if (hash >= 0) {
            trimmed = trimmed.substring(0, hash);
        }
        try {
            URI uri = new URI(escapeIllegal(trimmed));
            String scheme = uri.getScheme();
            if (scheme == null) return null;
            String lowerScheme = scheme.toLowerCase();
            if (!lowerScheme.equals("http") && !lowerScheme.equals("https")) {
                return null; // skip mailto:, javascript:, ftp: ...
            }
            String host = uri.getHost();
            if (host == null || host.isBlank()) return null;
            String path = uri.getRawPath();
            if (path == null || path.isEmpty()) path = "/";
            String query = uri.getRawQuery();

            StringBuilder sb = new StringBuilder();
            sb.append(lowerScheme).append("://").append(host.toLowerCase());
            if (uri.getPort() != -1 && uri.getPort() != defaultPort(lowerScheme)) {
                sb.append(':').append(uri.getPort());
            }
            sb.append(path);
            if (query != null && !query.isEmpty()) sb.append('?').append(query);
            return sb.toString();
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /**
     * @return the lower-cased host of an absolute URL, or null when it has none
     */
    public static String hostOf(String url) {
        if (url == null) return null;
        try {
            String host = new URI(url).getHost();
            return host == null ? null : host.toLowerCase();
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /**
     * @return scheme, host and port of a canonical URL, e.g. {@code https://example.com:8443}
     */
    public static String originOf(String canonicalUrl) {
        URI uri = URI.create(canonicalUrl);
        StringBuilder sb = new StringBuilder();
        sb.append(uri.getScheme()).append("://").append(uri.getHost());
        if (uri.getPort() != -1) {
            sb.append(':').append(uri.getPort());
        }
        return sb.toString();
    }

    /**
     * Lower-case hex SHA-1 of the UTF-8 bytes of {@code value}, truncated to {@code length} characters.
     */
    public static String shortHash(String value, int length) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-1");
            byte[] digest = md.digest(value.getBytes(StandardCharsets.UTF_8));
            String hex = toHex(digest);
            return hex.substring(0, Math.min(length, hex.length()));
        } catch (NoSuchAlgorithmException e) {
            // SHA-1 is guaranteed to exist on all Java platforms
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }

    /**
     * Percent-encodes (as UTF-8) every character that may not appear in a URI, so hrefs such as
     * {@code /a b} or {@code /x|y} still parse. Existing {@code %XX} escapes are kept; a stray {@code %}
     * becomes {@code %25}.
     */
    static String escapeIllegal(String url) {
        int authorityEnd = authorityEnd(url);
        StringBuilder sb = null;
        for (int i = 0; i < url.length(); i++) {
            char c = url.charAt(i);
            boolean legal;
            if (c == '%') {
                legal = isEscape(url, i);
            } else if (c == '[' || c == ']') {
                legal = i < authorityEnd; // IPv6 literal
            } else {
                legal = isUriChar(c);
            }
            if (legal) {
                if (sb != null) sb.append(c);
                continue;
            }
            if (sb == null) {
                sb = new StringBuilder(url.length() + 16).append(url, 0, i);
            }
            int end = Character.isHighSurrogate(c) && i + 1 < url.length() ? i + 2 : i + 1;
            for (byte b : url.substring(i, end).getBytes(StandardCharsets.UTF_8)) {
                sb.append('%')
                        .append(Character.toUpperCase(Character.forDigit((b >>> 4) & 0xF, 16)))
                        .append(Character.toUpperCase(Character.forDigit(b & 0xF, 16)));
            }
            i = end - 1;
        }
        return sb == null ? url : sb.toString();
    }

    private static boolean isUriChar(char c) {
        if (c >= 'a' && c <= 'z' || c >= 'A' && c <= 'Z' || c >= '0' && c <= '9') return true;
        return "-._~:/?#[]@!$&'()*+,;=".indexOf(c) >= 0;
    }

    private static int authorityEnd(String url) {
        int start = url.indexOf("://");
        if (start < 0) return 0;
        for (int i = start + 3; i < url.length(); i++) {
            char c = url.charAt(i);
            if (c == '/' || c == '?' || c == '#') return i;
        }
        return url.length();
    }

    private static boolean isEscape(String s, int i) {
        return i + 2 < s.length()
                && Character.digit(s.charAt(i + 1), 16) >= 0
                && Character.digit(s.charAt(i + 2), 16) >= 0;
    }

    private static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(Character.forDigit((b >>> 4) & 0xF, 16));
            sb.append(Character.forDigit(b & 0xF, 16));
        }
        return sb.toString();
    }

    private static int defaultPort(String scheme) {
        return "https".equals(scheme) ? 443 : 80;
    }
}
