package com.example.lxmon.command;

import com.example.lxmon.config.EngineProperties;
import com.example.lxmon.exception.CommandRejectedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandPolicyTest {

    private EngineProperties properties;
    private CommandPolicy policy;

    @BeforeEach
    void setUp() {
        properties = new EngineProperties();
        properties.getCommands().setDenylist(List.of("rm -rf", "mkfs"));
        policy = new CommandPolicy(properties);
    }

    @Test
    void allowedCommandIsTrimmedAndAccepted() {
        assertEquals("docker ps -a", policy.validate("  docker ps -a\n"));
        assertEquals("/usr/bin/uptime", policy.validate("/usr/bin/uptime"));
    }

    @Test
    void blankCommandIsRejected() {
        assertThrows(CommandRejectedException.class, () -> policy.validate(null));
        assertThrows(CommandRejectedException.class, () -> policy.validate("   "));
    }

    @Test
    void executableOutsideAllowlistIsRejected() {
        CommandRejectedException e = assertThrows(CommandRejectedException.class,
                () -> policy.validate("curl http://example.org"));
        assertTrue(e.getMessage().contains("curl"));
    }

    @Test
    void emptyAllowlistAllowsAnyExecutable() {
        properties.getCommands().setAllowlist(List.of());

        assertEquals("journalctl -u nginx", policy.validate("journalctl -u nginx"));
    }

    @Test
    void denylistMatchesAnywhereIgnoringCase() {
        properties.getCommands().setAllowlist(List.of());

        assertThrows(CommandRejectedException.class, () -> policy.validate("echo x && RM -RF /tmp/x"));
        assertThrows(CommandRejectedException.class, () -> policy.validate("mkfs.ext4 /dev/sdb1"));
    }

    @Test
    void overlongCommandIsRejected() {
        properties.getCommands().setMaxLength(16);

        assertEquals("echo hello world", policy.validate("echo hello world"));
        assertThrows(CommandRejectedException.class, () -> policy.validate("echo hello world!"));
    }

    @Test
    void executableIsFirstTokenWithoutPath() {
        assertEquals("docker", CommandPolicy.executableOf("/usr/local/bin/docker ps"));
        assertEquals("uptime", CommandPolicy.executableOf("uptime"));
        assertEquals("systemctl", CommandPolicy.executableOf("systemctl\trestart nginx"));
    }
}
