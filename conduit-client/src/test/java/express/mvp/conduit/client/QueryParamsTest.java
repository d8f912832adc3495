package express.mvp.conduit.client;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link QueryParams}. */
@DisplayName("QueryParams")
class QueryParamsTest {

    @Test
    @DisplayName("Empty or null maps produce no query")
    void empty() {
        assertEquals("", QueryParams.of(null));
        assertEquals("", QueryParams.of(Map.of()));
    }

    @Test
    @DisplayName("Keeps insertion order and skips nulls")
    void orderAndNulls() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("status", "running");
        params.put("agentId", null);
        params.put("limit", 20);

        assertEquals("?status=running&limit=20", QueryParams.of(params));
    }

    @Test
    @DisplayName("Repeats the key for collections and arrays")
    void repeats() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("tag", List.of("a", "b"));
        params.put("id", new String[] {"x"});

        assertEquals("?tag=a&tag=b&id=x", QueryParams.of(params));
    }

    @Test
    @DisplayName("Only null values produce no query")
    void onlyNulls() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("a", null);
        params.put("b", Arrays.asList((Object) null));

        assertEquals("", QueryParams.of(params));
    }

    @Test
    @DisplayName("Encodes reserved characters")
    void encodes() {
        assertEquals("?q=a%26b%3Dc", QueryParams.of(Map.of("q", "a&b=c")));
        assertEquals("t%2F1", QueryParams.encode("t/1"));
    }
}
