package csw.crawler.render.fetch.model;

/**
 * Result of one request in a batch: either a response or the reason it failed.
 */
public record FetchOutcome(FetchRequest request, RenderedResponse response, String error) {

    public static FetchOutcome success(RenderedResponse response) {
        return new FetchOutcome(response.request(), response, null);
    }

    public static FetchOutcome failure(FetchRequest request, Throwable error) {
        return new FetchOutcome(request, null, error.getMessage());
    }

    public boolean isSuccess() {
        return response != null;
    }
}
