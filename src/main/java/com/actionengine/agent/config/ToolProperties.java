package com.actionengine.agent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Strongly-typed configuration for the terminal and browser tools.
 * Bound from application.yml under the "tools" prefix.
 */
@Component
@ConfigurationProperties(prefix = "tools")
@Data
public class ToolProperties {

    private Terminal terminal = new Terminal();
    private Browser browser = new Browser();

    @Data
    public static class Terminal {
        /** Shell used to run scripts, invoked as {@code <shell> -c <script>} */
        private String shell = "/bin/sh";
        /** Root under which each thread gets its own working directory */
        private String workingDirectory = "./agent-workspace";
        private int defaultTimeoutSeconds = 60;
        private int maxTimeoutSeconds = 600;
        private int maxOutputChars = 10000;
    }

    @Data
    public static class Browser {
        private int timeoutMs = 30000;
        private String userAgent = "";
        private int maxTextChars = 8000;
    }
}
