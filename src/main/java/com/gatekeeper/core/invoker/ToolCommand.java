package com.gatekeeper.core.invoker;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * A subprocess to run: executable plus arguments, working directory and timeout.
 */
public record ToolCommand(
    String name,
    List<String> command,
    Path workingDirectory,
    Duration timeout
) {

    public ToolCommand {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        command = List.copyOf(command);
    }

    public String executable() {
        return command.get(0);
    }

    public String display() {
        return String.join(" ", command);
    }
}
