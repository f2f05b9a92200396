package com.actionengine.agent.environment;

import com.actionengine.agent.config.ToolProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class PlaywrightBrowserSessionFactory implements BrowserSessionFactory {

    private final ToolProperties toolProperties;

    @Override
    public BrowserSession open(String threadId, EnvironmentConfig config) {
        ToolProperties.Browser browser = toolProperties.getBrowser();
        return PlaywrightBrowserSession.launch(config, browser.getTimeoutMs(), browser.getUserAgent());
    }
}
