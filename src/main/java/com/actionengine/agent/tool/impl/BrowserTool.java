package com.actionengine.agent.tool.impl;

import com.actionengine.agent.config.ToolProperties;
import com.actionengine.agent.environment.BrowserSession;
import com.actionengine.agent.environment.ThreadEnvironment;
import com.actionengine.agent.exception.ToolExecutionException;
import com.actionengine.agent.tool.AgentTool;
import com.actionengine.agent.tool.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Drives the calling thread's browser session: navigate, click, input_text,
 * get_text, current_url.
 */
@Component
@Slf4j
public class BrowserTool implements AgentTool {

    public static final String NAME = "browser";

    private final ToolProperties toolProperties;

    public BrowserTool(ToolProperties toolProperties) {
        this.toolProperties = toolProperties;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return """
                Interact with your web browser. Actions:
                - navigate: open 'url' (http/https) and return the page title
                - click: click the element matching the CSS 'selector'
                - input_text: fill 'text' into the element matching 'selector'
                - get_text: return the visible text of the current page
                - current_url: return the URL of the current page
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "action", Map.of(
                                "type", "string",
                                "enum", List.of("navigate", "click", "input_text", "get_text", "current_url"),
                                "description", "The browser action to perform"
                        ),
                        "url", Map.of("type", "string", "description", "Required for navigate"),
                        "selector", Map.of("type", "string",
                                "description", "CSS selector, required for click and input_text"),
                        "text", Map.of("type", "string", "description", "Required for input_text")
                ),
                "required", List.of("action")
        );
    }

    @Override
    public ToolResult execute(Map<String, Object> arguments, ThreadEnvironment environment) {
        String action = (String) arguments.get("action");
        try {
            BrowserSession browser = environment.browserSession()
                    .orElseThrow(() -> new ToolExecutionException("Browser is disabled for this thread"));
            String result = switch (action) {
                case "navigate" -> navigate(browser, require(arguments, "url", action));
                case "click" -> {
                    String selector = require(arguments, "selector", action);
                    browser.click(selector);
                    yield "Clicked element '" + selector + "'";
                }
                case "input_text" -> {
                    String selector = require(arguments, "selector", action);
                    browser.type(selector, require(arguments, "text", action));
                    yield "Input text into element '" + selector + "'";
                }
                case "get_text" -> browser.readText(toolProperties.getBrowser().getMaxTextChars());
                case "current_url" -> browser.currentUrl();
                default -> throw new ToolExecutionException("Unknown action '" + action + "'");
            };
            log.info("Browser action done [thread={}, action={}]", environment.getThreadId(), action);
            return ToolResult.success(result);
        } catch (ToolExecutionException e) {
            return ToolResult.failure(e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Browser action failed [thread={}, action={}]: {}",
                    environment.getThreadId(), action, e.getMessage());
            return ToolResult.failure("Browser action '" + action + "' failed: " + e.getMessage());
        }
    }

    private static String navigate(BrowserSession browser, String url) {
        if (!url.startsWith("http://") && !url.startsWith("https://")) {
            throw new ToolExecutionException("Only http/https URLs are supported: " + url);
        }
        String title = browser.navigate(url);
        return "Navigated to " + url + " (title: " + title + ")";
    }

    private static String require(Map<String, Object> arguments, String name, String action) {
        Object value = arguments.get(name);
        if (value == null || value.toString().isBlank()) {
            throw new ToolExecutionException("'" + name + "' is required for " + action);
        }
        return value.toString();
    }
}
