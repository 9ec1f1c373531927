package csw.crawler.render.playwright;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import csw.crawler.render.common.exception.BrowserSessionException;
import csw.crawler.render.common.exception.ProvisioningException;
import csw.crawler.render.common.exception.WaitTimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class PlaywrightBrowserSessionTest {

    @Mock
    private PlaywrightFactory playwrightFactory;
    @Mock
    private Playwright playwright;
    @Mock
    private Browser browser;
    @Mock
    private BrowserContext context;
    @Mock
    private Page page;

    private PoolConfig config;
    private PlaywrightBrowserSession session;

    @BeforeEach
    void setUp() {
        config = PoolConfig.builder()
                .browserKind(BrowserKind.CHROMIUM)
                .userAgent("crawler-test/1.0")
                .commandTimeout(Duration.ofMillis(200))
                .launchTimeout(Duration.ofSeconds(5))
                .build();
        when(playwrightFactory.create(config)).thenReturn(playwright);
        when(browser.newContext(any(Browser.NewContextOptions.class))).thenReturn(context);
        when(context.newPage()).thenReturn(page);
        when(browser.isConnected()).thenReturn(true);
        when(page.url()).thenReturn("https://example.com/final");
    }

    @AfterEach
    void tearDown() {
        if (session != null) {
            session.terminate();
        }
    }

    private PlaywrightBrowserSession start() {
        session = new PlaywrightBrowserSession("7", config, playwrightFactory, p -> browser);
        return session;
    }

    @Test
    void startOpensContextWithConfiguredUserAgent() {
        start();

        ArgumentCaptor<Browser.NewContextOptions> options = ArgumentCaptor.forClass(Browser.NewContextOptions.class);
        verify(browser).newContext(options.capture());
        assertEquals("crawler-test/1.0", options.getValue().userAgent);
        assertEquals("7", session.id());
        assertTrue(session.isHealthy());
    }

    @Test
    void pageCallsRunOnTheSessionWorker() {
        AtomicReference<String> thread = new AtomicReference<>();
        when(page.content()).thenAnswer(invocation -> {
            thread.set(Thread.currentThread().getName());
            return "<html></html>";
        });
        start();

        assertEquals("<html></html>", session.pageSource());
        assertEquals("browser-session-7", thread.get());
    }

    @Test
    void navigateAndReadUrl() {
        start();

        session.navigate("https://example.com/start");

        verify(page).navigate("https://example.com/start");
        assertEquals("https://example.com/final", session.currentUrl());
    }

    @Test
    void addCookieIsScopedToCurrentPage() {
        start();

        session.addCookie("token", "abc");

        verify(context).addCookies(anyList());
    }

    @Test
    void waitTimeoutIsReportedAsWaitTimeout() {
        when(page.waitForSelector(eq("#content"), any(Page.WaitForSelectorOptions.class)))
                .thenThrow(new TimeoutError("Timeout 100ms exceeded"));
        start();

        assertThrows(WaitTimeoutException.class,
                () -> session.waitUntil(new WaitCondition.SelectorVisible("#content"), Duration.ofMillis(100)));
    }

    @Test
    void waitLongerThanCommandTimeoutIsHonoured() {
        when(page.waitForSelector(eq("#late"), any(Page.WaitForSelectorOptions.class))).thenAnswer(invocation -> {
            Thread.sleep(400);
            return null;
        });
        start();

        assertDoesNotThrow(() -> session.waitUntil(new WaitCondition.SelectorPresent("#late"), Duration.ofSeconds(2)));

        ArgumentCaptor<Page.WaitForSelectorOptions> options = ArgumentCaptor.forClass(Page.WaitForSelectorOptions.class);
        verify(page).waitForSelector(eq("#late"), options.capture());
        assertEquals(2000d, options.getValue().timeout);
    }

    @Test
    void zeroWaitTimeoutChecksOnceInsteadOfWaitingForever() {
        start();

        session.waitUntil(new WaitCondition.SelectorVisible("#now"), Duration.ZERO);

        ArgumentCaptor<Page.WaitForSelectorOptions> options = ArgumentCaptor.forClass(Page.WaitForSelectorOptions.class);
        verify(page).waitForSelector(eq("#now"), options.capture());
        assertEquals(1d, options.getValue().timeout);
    }

    @Test
    void waitOutlivingItsBoundIsAWaitTimeout() {
        when(page.waitForSelector(eq("#stuck"), any(Page.WaitForSelectorOptions.class))).thenAnswer(invocation -> {
            Thread.sleep(5000);
            return null;
        });
        start();

        WaitTimeoutException ex = assertThrows(WaitTimeoutException.class,
                () -> session.waitUntil(new WaitCondition.SelectorPresent("#stuck"), Duration.ofMillis(100)));
        assertInstanceOf(TimeoutException.class, ex.getCause());
    }

    @Test
    void slowStartWithinLaunchTimeoutSucceeds() {
        when(playwrightFactory.create(config)).thenAnswer(invocation -> {
            Thread.sleep(600);
            return playwright;
        });

        start();

        assertTrue(session.isHealthy());
    }

    @Test
    void startupTimeoutCoversLaunchAndDownloads() {
        PoolConfig remote = PoolConfig.builder()
                .browserKind(BrowserKind.CHROMIUM)
                .remoteEndpoint("ws://playwright:3000")
                .launchTimeout(Duration.ofSeconds(20))
                .build();

        assertEquals(Duration.ofSeconds(20).plus(PlaywrightBrowserSession.DRIVER_INSTALL_ALLOWANCE),
                PlaywrightBrowserSession.startupTimeout(remote));
        assertEquals(Duration.ofSeconds(5)
                        .plus(PlaywrightBrowserSession.DRIVER_INSTALL_ALLOWANCE)
                        .plus(PlaywrightBrowserSession.BROWSER_DOWNLOAD_ALLOWANCE),
                PlaywrightBrowserSession.startupTimeout(config));
    }

    @Test
    void browserFinishingStartupAfterTimeoutIsClosed() {
        when(playwrightFactory.create(config)).thenAnswer(invocation -> {
            Thread.sleep(600);
            return playwright;
        });

        assertThrows(ProvisioningException.class,
                () -> new PlaywrightBrowserSession("9", config, Duration.ofMillis(100), playwrightFactory, p -> browser));

        verify(context, timeout(3000)).close();
        verify(browser, timeout(3000)).close();
        verify(playwright, timeout(3000)).close();
    }

    @Test
    void waitForUrlUsesRegex() {
        start();

        session.waitUntil(new WaitCondition.UrlMatches(".*/final"), Duration.ofSeconds(1));

        verify(page).waitForURL(any(java.util.regex.Pattern.class), any(Page.WaitForURLOptions.class));
    }

    @Test
    void browserFailureIsWrapped() {
        when(page.navigate("https://down.example.com")).thenThrow(new PlaywrightException("net::ERR_NAME_NOT_RESOLVED"));
        start();

        BrowserSessionException ex = assertThrows(BrowserSessionException.class,
                () -> session.navigate("https://down.example.com"));
        assertInstanceOf(PlaywrightException.class, ex.getCause());
    }

    @Test
    void hangingCommandTimesOut() {
        when(page.content()).thenAnswer(invocation -> {
            Thread.sleep(5000);
            return "";
        });
        start();

        BrowserSessionException ex = assertThrows(BrowserSessionException.class, () -> session.pageSource());
        assertInstanceOf(TimeoutException.class, ex.getCause());
    }

    @Test
    void disconnectedBrowserIsUnhealthy() {
        start();
        when(browser.isConnected()).thenReturn(false);

        assertFalse(session.isHealthy());
    }

    @Test
    void terminateClosesEverythingOnce() {
        start();

        session.terminate();
        session.terminate();

        verify(context, times(1)).close();
        verify(browser, times(1)).close();
        verify(playwright, times(1)).close();
        assertFalse(session.isHealthy());
        assertThrows(BrowserSessionException.class, () -> session.navigate("https://example.com"));
    }

    @Test
    void failedStartReleasesPlaywright() {
        PlaywrightException launchFailure = new PlaywrightException("Executable doesn't exist");

        ProvisioningException ex = assertThrows(ProvisioningException.class,
                () -> new PlaywrightBrowserSession("8", config, playwrightFactory, p -> {
                    throw launchFailure;
                }));

        assertSame(launchFailure, ex.getCause());
        verify(playwright).close();
        verify(context, never()).close();
    }

    @Test
    void screenshotAndScriptDelegateToPage() {
        byte[] png = {1, 2, 3};
        when(page.screenshot()).thenReturn(png);
        when(page.evaluate("document.title")).thenReturn("Example");
        start();

        assertArrayEquals(png, session.captureScreenshot());
        assertEquals("Example", session.executeScript("document.title"));
    }
}
