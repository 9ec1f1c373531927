package csw.crawler.render.common.exception;

public class UnsupportedBrowserException extends ProvisioningException {

    public UnsupportedBrowserException(String message) {
        super(message);
    }
}
