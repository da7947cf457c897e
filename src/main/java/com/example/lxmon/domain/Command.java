package com.example.lxmon.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A command queued for execution on a server. The id is the only link
 * between this row and its entry on the server's command queue.
 */
@Entity
@Table(name = "commands", indexes = {
        @Index(name = "idx_command_server_created", columnList = "server_id, created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Command {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "server_id", nullable = false)
    private Long serverId;

    @Column(nullable = false, length = 4096)
    private String command;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CommandStatus status;

    @Column(name = "exit_code")
    private Integer exitCode;

    @Lob
    private String stdout;

    @Lob
    private String stderr;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "executed_at")
    private Instant executedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    public enum CommandStatus {
        PENDING, RUNNING, COMPLETED, FAILED, TIMEOUT;

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED || this == TIMEOUT;
        }
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
        if (status == null) status = CommandStatus.PENDING;
    }
}
