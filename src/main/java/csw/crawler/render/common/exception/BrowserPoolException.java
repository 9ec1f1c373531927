package csw.crawler.render.common.exception;

/**
 * Base type for every failure raised by the browser-session pool and the fetch layer on top of it.
 */
public class BrowserPoolException extends RuntimeException {

    public BrowserPoolException(String message) {
        super(message);
    }

    public BrowserPoolException(String message, Throwable cause) {
        super(message, cause);
    }
}
