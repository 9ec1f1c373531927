package csw.crawler.render.common.exception;

/**
 * An operation on a live browser session failed. The session is no longer trusted after this.
 */
public class BrowserSessionException extends RuntimeException {

    public BrowserSessionException(String message) {
        super(message);
    }

    public BrowserSessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
