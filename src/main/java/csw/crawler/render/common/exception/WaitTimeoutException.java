package csw.crawler.render.common.exception;

public class WaitTimeoutException extends BrowserSessionException {

    public WaitTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
