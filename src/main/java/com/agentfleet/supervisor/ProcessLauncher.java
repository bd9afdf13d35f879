package com.agentfleet.supervisor;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Seam over OS process creation, so tests can observe or wrap launches.
 */
@FunctionalInterface
public interface ProcessLauncher {

    /**
     * Starts a child process attached to this JVM.
     *
     * @param command program and arguments
     * @param env     variables added on top of the inherited environment
     */
    Process launch(List<String> command, Map<String, String> env) throws IOException;

    static ProcessLauncher system() {
        return (command, env) -> {
            ProcessBuilder builder = new ProcessBuilder(command);
            builder.environment().putAll(env);
            builder.redirectInput(ProcessBuilder.Redirect.PIPE);
            return builder.start();
        };
    }
}
