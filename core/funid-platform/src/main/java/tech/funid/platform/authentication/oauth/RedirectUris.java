package tech.funid.platform.authentication.oauth;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Appends query parameters to redirect targets. Null values are skipped.
 */
final class RedirectUris {

    private RedirectUris() {
    }

    static String withQuery(String baseUri, Map<String, String> params) {
        StringBuilder url = new StringBuilder(baseUri);
        char separator = baseUri.contains("?") ? '&' : '?';
        for (Map.Entry<String, String> param : params.entrySet()) {
            if (param.getValue() == null) {
                continue;
            }
            url.append(separator)
                .append(encode(param.getKey()))
                .append('=')
                .append(encode(param.getValue()));
            separator = '&';
        }
        return url.toString();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
