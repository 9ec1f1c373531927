package csw.crawler.render.fetch.model;

import java.nio.charset.Charset;

public record RenderedResponse(
        String finalUrl,
        byte[] body,
        Charset encoding,
        FetchRequest request
) {

    public String text() {
        return new String(body, encoding);
    }

    /**
     * PNG bytes captured while rendering, or {@code null} when none were requested.
     */
    public byte[] screenshot() {
        return (byte[]) request.getMeta().get(BrowserRequest.META_SCREENSHOT);
    }

    public String renderer() {
        return (String) request.getMeta().get(FetchRequest.META_RENDERER);
    }
}
