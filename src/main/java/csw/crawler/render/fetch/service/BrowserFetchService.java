package csw.crawler.render.fetch.service;

import csw.crawler.render.common.exception.PoolExhaustedException;
import csw.crawler.render.common.exception.RenderFailedException;
import csw.crawler.render.fetch.model.BrowserRequest;
import csw.crawler.render.fetch.model.FetchRequest;
import csw.crawler.render.fetch.model.RenderedResponse;
import csw.crawler.render.playwright.BrowserSession;
import csw.crawler.render.playwright.pool.BrowserSessionPool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

/**
 * Renders {@link BrowserRequest}s in a pooled browser session. Any other request is left to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BrowserFetchService {

    private final BrowserSessionPool sessionPool;

    /**
     * @return the rendered page, or empty when the request is not meant for a browser or no session became
     * available within the checkout timeout
     * @throws RenderFailedException if the browser failed while rendering; its session has been replaced
     */
    public Optional<RenderedResponse> fetch(FetchRequest request) {
        if (!(request instanceof BrowserRequest browserRequest)) {
            return Optional.empty();
        }
        try {
            return Optional.of(sessionPool.withSession(session -> render(session, browserRequest)));
        } catch (PoolExhaustedException e) {
            log.error("No browser session available within {}ms, skipping browser rendering of {}",
                    e.getTimeout().toMillis(), request.getUrl());
            return Optional.empty();
        }
    }

    RenderedResponse render(BrowserSession session, BrowserRequest request) {
        log.debug("Rendering {} in session {}", request.getUrl(), session.id());
        try {
            session.navigate(request.getUrl());

            for (Map.Entry<String, String> cookie : request.getCookies().entrySet()) {
                session.addCookie(cookie.getKey(), cookie.getValue());
            }

            if (request.getWaitCondition() != null) {
                session.waitUntil(request.getWaitCondition(), request.getWaitTimeout());
            }

            if (request.isScreenshot()) {
                request.getMeta().put(BrowserRequest.META_SCREENSHOT, session.captureScreenshot());
            }

            if (request.getScript() != null) {
                session.executeScript(request.getScript());
            }

            byte[] body = session.pageSource().getBytes(StandardCharsets.UTF_8);
            String finalUrl = session.currentUrl();

            if (request.isExposeSession()) {
                request.getMeta().put(BrowserRequest.META_SESSION, session);
            }
            return new RenderedResponse(finalUrl, body, StandardCharsets.UTF_8, request);
        } catch (RuntimeException e) {
            log.warn("Rendering {} failed in session {}: {}", request.getUrl(), session.id(), e.getMessage());
            throw new RenderFailedException(request.getUrl(), session.id(), e);
        }
    }
}
