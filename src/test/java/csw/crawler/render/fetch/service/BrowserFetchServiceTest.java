package csw.crawler.render.fetch.service;

import csw.crawler.render.common.exception.RenderFailedException;
import csw.crawler.render.common.exception.WaitTimeoutException;
import csw.crawler.render.fetch.model.BrowserRequest;
import csw.crawler.render.fetch.model.FetchRequest;
import csw.crawler.render.fetch.model.RenderedResponse;
import csw.crawler.render.playwright.BrowserKind;
import csw.crawler.render.playwright.BrowserSession;
import csw.crawler.render.playwright.FakeBrowserSession;
import csw.crawler.render.playwright.FakeSessionFactory;
import csw.crawler.render.playwright.PoolConfig;
import csw.crawler.render.playwright.WaitCondition;
import csw.crawler.render.playwright.pool.BrowserSessionPool;
import csw.crawler.render.playwright.pool.PoolStats;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class BrowserFetchServiceTest {

    private FakeSessionFactory factory;
    private BrowserSessionPool pool;
    private BrowserFetchService service;

    @BeforeEach
    void setUp() {
        factory = new FakeSessionFactory();
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdown();
        }
    }

    private void startPool(int size, Duration checkoutTimeout) {
        PoolConfig config = PoolConfig.builder()
                .browserKind(BrowserKind.CHROMIUM)
                .poolSize(size)
                .checkoutTimeout(checkoutTimeout)
                .build();
        pool = new BrowserSessionPool(config, factory);
        pool.initialize();
        service = new BrowserFetchService(pool);
    }

    @Test
    void plainRequestIsNotHandled() {
        startPool(1, Duration.ofSeconds(1));

        Optional<RenderedResponse> response = service.fetch(FetchRequest.of("https://example.com"));

        assertTrue(response.isEmpty());
        assertEquals(1, pool.stats().idle());
        assertTrue(factory.created().get(0).calls().isEmpty());
    }

    @Test
    void renderedResponseReflectsRedirectAndFinalMarkup() {
        startPool(1, Duration.ofSeconds(1));
        factory.redirect("https://example.com/old", "https://example.com/new");
        BrowserRequest request = BrowserRequest.builder()
                .url("https://example.com/old")
                .waitCondition(new WaitCondition.SelectorPresent("#loaded"))
                .script("window.scrollTo(0, document.body.scrollHeight)")
                .build();

        RenderedResponse response = service.fetch(request).orElseThrow();

        assertEquals("https://example.com/new", response.finalUrl());
        assertEquals(StandardCharsets.UTF_8, response.encoding());
        assertEquals("<html><body><h1>https://example.com/new</h1><div id=\"loaded\"></div>"
                + "<p>window.scrollTo(0, document.body.scrollHeight)</p></body></html>", response.text());
        assertSame(request, response.request());
        assertEquals(1, pool.stats().idle());
    }

    @Test
    void renderStepsRunInOrder() {
        FakeBrowserSession session = new FakeBrowserSession("s1");
        startPool(1, Duration.ofSeconds(1));
        BrowserRequest request = BrowserRequest.builder()
                .url("https://shop.example.com")
                .cookies(Map.of("consent", "yes"))
                .waitCondition(new WaitCondition.SelectorVisible(".price"))
                .screenshot(true)
                .script("expandAll()")
                .build();

        service.render(session, request);

        assertEquals(List.of("navigate https://shop.example.com", "cookie consent", "wait", "screenshot",
                "script", "pageSource", "currentUrl"), session.calls());
        assertEquals("yes", session.cookies().get("consent"));
        assertArrayEquals(FakeBrowserSession.PNG, (byte[]) request.getMeta().get(BrowserRequest.META_SCREENSHOT));
        assertFalse(request.getMeta().containsKey(BrowserRequest.META_SESSION));
    }

    @Test
    void sessionIsExposedOnlyWhenAsked() {
        startPool(1, Duration.ofSeconds(1));
        BrowserRequest request = BrowserRequest.builder()
                .url("https://example.com")
                .exposeSession(true)
                .build();

        service.fetch(request).orElseThrow();

        BrowserSession exposed = (BrowserSession) request.getMeta().get(BrowserRequest.META_SESSION);
        assertEquals(factory.created().get(0).id(), exposed.id());
    }

    @Test
    void brokenSessionIsReplacedAndFailureReported() {
        startPool(1, Duration.ofSeconds(1));
        FakeBrowserSession original = factory.created().get(0);
        original.breakSession();

        RenderFailedException ex = assertThrows(RenderFailedException.class,
                () -> service.fetch(BrowserRequest.builder().url("https://example.com").build()));

        assertEquals(original.id(), ex.getSessionId());
        assertEquals(1, original.terminateCount());
        assertEquals(1, pool.stats().idle());
        assertNotEquals(original.id(), pool.withSession(BrowserSession::id));
    }

    @Test
    void waitTimeoutReplacesOnlyTheFailingSession() throws Exception {
        startPool(2, Duration.ofSeconds(5));
        factory.slow("/slow");
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<Optional<RenderedResponse>> slow = executor.submit(() -> {
                start.await();
                return service.fetch(BrowserRequest.builder()
                        .url("https://example.com/slow")
                        .waitCondition(new WaitCondition.SelectorPresent("#never"))
                        .waitTimeout(Duration.ofMillis(50))
                        .build());
            });
            Future<Optional<RenderedResponse>> fast = executor.submit(() -> {
                start.await();
                return service.fetch(BrowserRequest.builder()
                        .url("https://example.com/fast")
                        .waitCondition(new WaitCondition.SelectorPresent("#loaded"))
                        .build());
            });
            start.countDown();

            ExecutionException ex = assertThrows(ExecutionException.class, () -> slow.get(5, TimeUnit.SECONDS));
            RenderFailedException renderFailed = assertInstanceOf(RenderFailedException.class, ex.getCause());
            assertInstanceOf(WaitTimeoutException.class, renderFailed.getCause());
            assertEquals("https://example.com/fast", fast.get(5, TimeUnit.SECONDS).orElseThrow().finalUrl());
        } finally {
            executor.shutdownNow();
        }

        PoolStats stats = pool.stats();
        assertEquals(2, stats.idle());
        assertEquals(0, stats.active());
        assertEquals(3, stats.created());
        assertEquals(1, stats.destroyed());
        long terminated = factory.created().stream().filter(s -> s.terminateCount() == 1).count();
        assertEquals(1, terminated);
    }

    @Test
    void exhaustedPoolWithZeroTimeoutIsNotHandled() {
        startPool(1, Duration.ZERO);
        BrowserSession held = pool.acquire();

        Optional<RenderedResponse> response = service.fetch(BrowserRequest.builder().url("https://example.com").build());

        assertTrue(response.isEmpty());
        assertEquals(0, factory.session(held.id()).terminateCount());
        pool.release(held);
    }
}
