package org.smileyface.sitecrawler.fetch;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * A completed HTTP response: final status, headers, body and where redirects ended up.
 *
 * @param requestUrl URL that was requested
 * @param finalUrl   URL of the last response after redirects
 * @param statusCode HTTP status of the final response
 * @param headers    response headers (first value per name)
 * @param body       response body bytes, never null
 * @param attempts   number of attempts it took, 1 when no retry was needed
 */
public record FetchResult(String requestUrl,
                          String finalUrl,
                          int statusCode,
                          String contentType,
                          Map<String, String> headers,
                          byte[] body,
                          String charset,
                          int attempts) {

    public FetchResult {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        body = body == null ? new byte[0] : body;
    }

    public ContentKind kind() {
        return ContentKind.of(contentType);
    }

    public boolean isHtml() {
        return kind() == ContentKind.HTML;
    }

    /**
     * Decodes the body with the response charset, falling back to UTF-8.
     */
    public String bodyAsString() {
        return new String(body, resolveCharset(charset));
    }

    private static Charset resolveCharset(String name) {
        if (name == null || name.isBlank()) return StandardCharsets.UTF_8;
        try {
            return Charset.forName(name.trim());
        } catch (IllegalArgumentException e) {
            return StandardCharsets.UTF_8;
        }
    }
}
