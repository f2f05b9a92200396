package com.actionengine.agent.environment;

/**
 * Browser handle exclusively owned by one thread.
 */
public interface BrowserSession extends LiveResource {

    /** Navigates the active page and returns its title */
    String navigate(String url);

    void click(String selector);

    void type(String selector, String text);

    /** Visible text of the active page, truncated to {@code maxChars} */
    String readText(int maxChars);

    String currentUrl();
}
