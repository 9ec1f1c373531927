package csw.crawler.render.common.exception;

import lombok.Getter;

/**
 * Rendering a page in a browser session failed. The session that was driving it has already been replaced.
 */
@Getter
public class RenderFailedException extends BrowserPoolException {

    private final String url;
    private final String sessionId;

    public RenderFailedException(String url, String sessionId, Throwable cause) {
        super("Failed to render " + url + " in session " + sessionId + ": " + cause.getMessage(), cause);
        this.url = url;
        this.sessionId = sessionId;
    }
}
