package app.govexplorer.sdk.internal;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HttpUtilTest {

    @Test
    void queryStringEncodesValuesInOrder() {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("targetId", "b 1");
        query.put("since", "2024-01-01T00:00:00Z");
        query.put("until", null);

        assertEquals("?targetId=b+1&since=2024-01-01T00%3A00%3A00Z", HttpUtil.queryString(query));
    }

    @Test
    void queryStringIsEmptyWithoutValues() {
        Map<String, String> query = new HashMap<>();
        query.put("until", null);

        assertEquals("", HttpUtil.queryString(query));
        assertEquals("", HttpUtil.queryString(Map.of()));
        assertEquals("", HttpUtil.queryString(null));
    }
}
