package com.example.lxmon.command;

import com.example.lxmon.domain.Command;
import com.example.lxmon.exception.CommandNotFoundException;
import com.example.lxmon.exception.QueueCacheException;
import com.example.lxmon.queue.QueueCacheClient;
import com.example.lxmon.repository.CommandRepository;
import com.example.lxmon.repository.ServerRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Hand-off between operators queueing commands and agents executing them.
 *
 * <p>Enqueue writes the command row first and then pushes {@link QueuedCommand}
 * onto the server's queue. The two writes are not atomic: a failed push leaves
 * the row PENDING with no queue entry, and a queue entry whose row is missing is
 * skipped when dequeued. Status transitions are conditional updates keyed by
 * command id, so each happens at most once even under concurrent callers:
 * PENDING to RUNNING on dequeue, then COMPLETED or FAILED on the first result
 * report. Entries for commands that are no longer PENDING are skipped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CommandDispatchQueue {

    private static final Set<Command.CommandStatus> OPEN_STATES =
            EnumSet.of(Command.CommandStatus.PENDING, Command.CommandStatus.RUNNING);

    private final CommandRepository commandRepository;
    private final ServerRepository serverRepository;
    private final QueueCacheClient queueCacheClient;
    private final CommandPolicy commandPolicy;
    private final ObjectMapper objectMapper;

    /**
     * Persist a PENDING command and queue it for the server.
     *
     * @throws com.example.lxmon.exception.CommandRejectedException if the command violates policy
     * @throws IllegalArgumentException if the server does not exist
     */
    public Command enqueue(long serverId, String commandText) {
        String text = commandPolicy.validate(commandText);
        if (!serverRepository.existsById(serverId)) {
            throw new IllegalArgumentException("Server not found: " + serverId);
        }

        Command command = commandRepository.save(Command.builder()
                .serverId(serverId)
                .command(text)
                .status(Command.CommandStatus.PENDING)
                .createdAt(Instant.now())
                .build());

        try {
            queueCacheClient.push(serverId, toJson(new QueuedCommand(command.getId(), text)));
            log.info("Command {} queued for server {}: {}", command.getId(), serverId, text);
        } catch (QueueCacheException e) {
            log.error("Command {} saved but not queued for server {}, it will stay PENDING: {}",
                    command.getId(), serverId, e.getMessage());
        }
        return command;
    }

    /**
     * Pop the next command for the server and mark it RUNNING. Queue entries
     * without a matching PENDING row are logged and skipped.
     *
     * @return the dequeued command, empty once the queue is exhausted
     */
    public Optional<Command> dequeue(long serverId) {
        Optional<String> entry;
        while ((entry = queueCacheClient.pop(serverId)).isPresent()) {
            Optional<QueuedCommand> queued = parse(entry.get(), serverId);
            if (queued.isEmpty()) continue;

            long commandId = queued.get().commandId();
            if (commandRepository.claim(commandId, serverId, Command.CommandStatus.PENDING,
                    Command.CommandStatus.RUNNING, Instant.now()) == 1) {
                return commandRepository.findByIdAndServerId(commandId, serverId);
            }

            Optional<Command> row = commandRepository.findByIdAndServerId(commandId, serverId);
            if (row.isEmpty()) {
                log.warn("Dropping queue entry for unknown command {} on server {}", commandId, serverId);
            } else {
                log.warn("Dropping queue entry for command {} on server {}: already {}",
                        commandId, serverId, row.get().getStatus());
            }
        }
        return Optional.empty();
    }

    /**
     * Drain the server's queue, as an agent poll does.
     */
    public List<Command> dequeueAll(long serverId) {
        long available = queueCacheClient.queueLength(serverId);
        List<Command> commands = new ArrayList<>();
        for (long i = 0; i < available; i++) {
            Optional<Command> next = dequeue(serverId);
            if (next.isEmpty()) break;
            commands.add(next.get());
        }
        return commands;
    }

    /**
     * Record the outcome reported by the agent. Exit code 0 completes the command,
     * anything else fails it. Only the first report is recorded; later ones
     * return the stored result unchanged.
     *
     * @throws CommandNotFoundException if no command with this id belongs to the server
     */
    public Command reportResult(long commandId, long serverId, int exitCode, String stdout, String stderr) {
        if (commandRepository.findByIdAndServerId(commandId, serverId).isEmpty()) {
            throw new CommandNotFoundException(commandId, serverId);
        }

        Command.CommandStatus outcome = exitCode == 0 ? Command.CommandStatus.COMPLETED : Command.CommandStatus.FAILED;
        int updated = commandRepository.complete(commandId, serverId, OPEN_STATES,
                outcome, exitCode, stdout, stderr, Instant.now());

        Command command = commandRepository.findByIdAndServerId(commandId, serverId)
                .orElseThrow(() -> new CommandNotFoundException(commandId, serverId));
        if (updated == 0) {
            log.info("Ignoring repeated result for command {} (already {})", commandId, command.getStatus());
        } else {
            log.info("Command {} completed with exit code {}", commandId, exitCode);
        }
        return command;
    }

    public List<Command> history(long serverId) {
        return commandRepository.findByServerIdOrderByCreatedAtDesc(serverId);
    }

    public long pendingCount(long serverId) {
        return queueCacheClient.queueLength(serverId);
    }

    private Optional<QueuedCommand> parse(String payload, long serverId) {
        try {
            return Optional.of(objectMapper.readValue(payload, QueuedCommand.class));
        } catch (JsonProcessingException e) {
            log.warn("Dropping malformed queue entry on server {}: {}", serverId, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private String toJson(QueuedCommand queued) {
        try {
            return objectMapper.writeValueAsString(queued);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize command " + queued.commandId(), e);
        }
    }
}
