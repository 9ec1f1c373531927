package csw.crawler.render.fetch.service;

import csw.crawler.render.fetch.model.FetchOutcome;
import csw.crawler.render.fetch.model.FetchRequest;
import csw.crawler.render.fetch.model.RenderedResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Download entry point of the crawler: browser rendering when the request asks for it and a session is free,
 * a plain HTTP fetch otherwise.
 */
@Slf4j
@Service
public class CrawlFetchService {
    public static final String RENDERER_BROWSER = "browser";
    public static final String RENDERER_HTTP = "http";

    private final BrowserFetchService browserFetchService;
    private final HttpFetchService httpFetchService;
    private final Executor fetchExecutor;

    public CrawlFetchService(BrowserFetchService browserFetchService,
                             HttpFetchService httpFetchService,
                             @Qualifier("fetchExecutor") Executor fetchExecutor) {
        this.browserFetchService = browserFetchService;
        this.httpFetchService = httpFetchService;
        this.fetchExecutor = fetchExecutor;
    }

    public RenderedResponse fetch(FetchRequest request) {
        Optional<RenderedResponse> rendered = browserFetchService.fetch(request);
        if (rendered.isPresent()) {
            request.getMeta().put(FetchRequest.META_RENDERER, RENDERER_BROWSER);
            return rendered.get();
        }
        request.getMeta().put(FetchRequest.META_RENDERER, RENDERER_HTTP);
        return httpFetchService.fetch(request);
    }

    /**
     * Fetches all requests concurrently. A failing request does not affect the others.
     *
     * @return one outcome per request, in request order
     */
    public List<FetchOutcome> fetchAll(List<? extends FetchRequest> requests) {
        List<CompletableFuture<FetchOutcome>> futures = requests.stream()
                .map(request -> CompletableFuture
                        .supplyAsync(() -> FetchOutcome.success(fetch(request)), fetchExecutor)
                        .exceptionally(ex -> {
                            Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                            log.warn("Fetching {} failed: {}", request.getUrl(), cause.getMessage());
                            return FetchOutcome.failure(request, cause);
                        }))
                .toList();

        return futures.stream()
                .map(CompletableFuture::join)
                .toList();
    }
}
