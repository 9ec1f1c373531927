package csw.crawler.render.playwright;

import com.microsoft.playwright.Playwright;

public interface PlaywrightFactory {
    Playwright create(PoolConfig config);
}
