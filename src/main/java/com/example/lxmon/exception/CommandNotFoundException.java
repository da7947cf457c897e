package com.example.lxmon.exception;

public class CommandNotFoundException extends RuntimeException {

    private final Long commandId;
    private final Long serverId;

    public CommandNotFoundException(Long commandId, Long serverId) {
        super("Command not found: id=" + commandId + " server=" + serverId);
        this.commandId = commandId;
        this.serverId = serverId;
    }

    public Long getCommandId() {
        return commandId;
    }

    public Long getServerId() {
        return serverId;
    }
}
