package com.example.lxmon.command;

import com.example.lxmon.config.EngineProperties;
import com.example.lxmon.exception.CommandRejectedException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Validates operator commands against the configured allowlist, denylist and
 * length limit before they are queued.
 */
@Component
@RequiredArgsConstructor
public class CommandPolicy {

    private final EngineProperties properties;

    /**
     * @return the trimmed command text
     * @throws CommandRejectedException if the command may not be queued
     */
    public String validate(String command) {
        if (command == null || command.isBlank()) {
            throw new CommandRejectedException("Command must not be empty");
        }
        String trimmed = command.trim();
        EngineProperties.CommandsConfig config = properties.getCommands();

        if (trimmed.length() > config.getMaxLength()) {
            throw new CommandRejectedException(
                    "Command exceeds " + config.getMaxLength() + " characters");
        }

        String executable = executableOf(trimmed);
        List<String> allowlist = config.getAllowlist();
        if (allowlist != null && !allowlist.isEmpty() && !allowlist.contains(executable)) {
            throw new CommandRejectedException("Command not allowed: " + executable);
        }

        String lower = trimmed.toLowerCase(Locale.ROOT);
        for (String denied : config.getDenylist()) {
            if (!denied.isBlank() && lower.contains(denied.toLowerCase(Locale.ROOT))) {
                throw new CommandRejectedException("Command contains denied pattern: " + denied);
            }
        }
        return trimmed;
    }

    // "/usr/bin/docker ps" -> "docker"
    static String executableOf(String command) {
        String first = command.split("\\s+", 2)[0];
        int slash = first.lastIndexOf('/');
        return slash >= 0 ? first.substring(slash + 1) : first;
    }
}
