package com.example.lxmon.command;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Queue entry for a command. Carries only the row id and the command text;
 * the command row is the source of truth for status.
 */
public record QueuedCommand(
        @JsonProperty("command_id") long commandId,
        @JsonProperty("command") String command
) {}
