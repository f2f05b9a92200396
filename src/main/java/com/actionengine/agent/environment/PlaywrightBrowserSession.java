package com.actionengine.agent.environment;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.options.LoadState;
import lombok.extern.slf4j.Slf4j;

/**
 * Chromium session driven through Playwright. One instance per thread; a
 * Playwright object is not thread-safe, so every call is synchronized.
 */
@Slf4j
public class PlaywrightBrowserSession implements BrowserSession {

    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;
    private final Page page;

    private PlaywrightBrowserSession(Playwright playwright, Browser browser, BrowserContext context, Page page) {
        this.playwright = playwright;
        this.browser = browser;
        this.context = context;
        this.page = page;
    }

    /**
     * Launches Chromium with the thread's window settings. Partially created
     * handles are closed before the failure is rethrown.
     */
    public static PlaywrightBrowserSession launch(EnvironmentConfig config, int timeoutMs, String userAgent) {
        Playwright pw = null;
        Browser br = null;
        try {
            pw = Playwright.create();
            br = pw.chromium().launch(new BrowserType.LaunchOptions().setHeadless(config.isHeadless()));

            Browser.NewContextOptions contextOptions = new Browser.NewContextOptions()
                    .setViewportSize(config.getWindowWidth(), config.getWindowHeight());
            if (userAgent != null && !userAgent.isBlank()) {
                contextOptions.setUserAgent(userAgent);
            }
            BrowserContext ctx = br.newContext(contextOptions);
            Page page = ctx.newPage();
            page.setDefaultTimeout(timeoutMs);

            log.info("Playwright browser launched (headless: {}, window: {}x{})",
                    config.isHeadless(), config.getWindowWidth(), config.getWindowHeight());
            return new PlaywrightBrowserSession(pw, br, ctx, page);
        } catch (RuntimeException e) {
            if (br != null) {
                try {
                    br.close();
                } catch (RuntimeException ex) {
                    log.trace("Error closing browser: {}", ex.getMessage());
                }
            }
            if (pw != null) {
                try {
                    pw.close();
                } catch (RuntimeException ex) {
                    log.trace("Error closing playwright: {}", ex.getMessage());
                }
            }
            throw e;
        }
    }

    @Override
    public synchronized String navigate(String url) {
        page.navigate(url);
        page.waitForLoadState(LoadState.DOMCONTENTLOADED);
        return page.title();
    }

    @Override
    public synchronized void click(String selector) {
        page.click(selector);
    }

    @Override
    public synchronized void type(String selector, String text) {
        page.fill(selector, text);
    }

    @Override
    public synchronized String readText(int maxChars) {
        String text = page.innerText("body");
        if (text == null) return "";
        return text.length() > maxChars ? text.substring(0, maxChars) + "\n[Content truncated...]" : text;
    }

    @Override
    public synchronized String currentUrl() {
        return page.url();
    }

    @Override
    public synchronized void close() {
        RuntimeException failure = null;
        for (AutoCloseable closeable : new AutoCloseable[]{context, browser, playwright}) {
            try {
                closeable.close();
            } catch (Exception e) {
                if (failure == null) {
                    failure = new IllegalStateException("Failed to close browser session", e);
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
        log.info("Playwright browser closed");
    }
}
