package com.actionengine.agent.environment;

import com.actionengine.agent.config.ToolProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Opens a terminal rooted at {@code tools.terminal.working-directory/<threadId>}.
 */
@Component
@RequiredArgsConstructor
public class ProcessTerminalSessionFactory implements TerminalSessionFactory {

    private final ToolProperties toolProperties;

    @Override
    public TerminalSession open(String threadId, EnvironmentConfig config) {
        ToolProperties.Terminal terminal = toolProperties.getTerminal();
        String dirName = threadId.replaceAll("[^A-Za-z0-9._-]", "_");
        Path workDir = Path.of(terminal.getWorkingDirectory()).toAbsolutePath().normalize().resolve(dirName);
        return new ProcessTerminalSession(terminal.getShell(), workDir, terminal.getMaxOutputChars());
    }
}
