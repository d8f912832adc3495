package express.mvp.conduit.client;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Map;
import java.util.StringJoiner;

/** Builds query strings for list endpoints. */
final class QueryParams {

    private QueryParams() {}

    /**
     * Encodes parameters as a query string.
     *
     * <p>Null values are skipped. A collection or array value repeats its key once per element.
     *
     * @param params the parameters, may be null
     * @return {@code ?k=v&...}, or the empty string when nothing remains
     */
    static String of(Map<String, ?> params) {
        if (params == null || params.isEmpty()) {
            return "";
        }
        StringJoiner query = new StringJoiner("&", "?", "");
        query.setEmptyValue("");
        params.forEach(
                (key, value) -> {
                    if (value instanceof Collection<?> values) {
                        values.forEach(item -> append(query, key, item));
                    } else if (value instanceof Object[] values) {
                        for (Object item : values) {
                            append(query, key, item);
                        }
                    } else {
                        append(query, key, value);
                    }
                });
        return query.toString();
    }

    private static void append(StringJoiner query, String key, Object value) {
        if (value == null) {
            return;
        }
        query.add(encode(key) + "=" + encode(String.valueOf(value)));
    }

    static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
