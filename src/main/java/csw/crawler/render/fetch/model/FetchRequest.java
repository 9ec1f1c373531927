package csw.crawler.render.fetch.model;

import lombok.Getter;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A page the crawler wants downloaded. Everything but {@link #getMeta() meta} is fixed once the request exists;
 * meta carries per-request results such as the screenshot back to the caller.
 */
@Getter
public class FetchRequest {
    public static final String META_RENDERER = "renderer";

    private final String url;
    private final Map<String, String> headers;
    private final Map<String, Object> meta = new ConcurrentHashMap<>();

    protected FetchRequest(String url, Map<String, String> headers) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Request URL must not be blank");
        }
        this.url = url;
        this.headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static FetchRequest of(String url) {
        return new FetchRequest(url, Map.of());
    }

    public static FetchRequest of(String url, Map<String, String> headers) {
        return new FetchRequest(url, headers);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + url + "]";
    }
}
