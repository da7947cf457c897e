package com.example.lxmon.repository;

import com.example.lxmon.domain.Command;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface CommandRepository extends JpaRepository<Command, Long> {

    Optional<Command> findByIdAndServerId(Long id, Long serverId);

    List<Command> findByServerIdOrderByCreatedAtDesc(Long serverId);

    /**
     * Move a PENDING command to RUNNING.
     *
     * @return 1 if this call made the transition, 0 otherwise
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("UPDATE Command c SET c.status = :running, c.executedAt = :executedAt " +
            "WHERE c.id = :id AND c.serverId = :serverId AND c.status = :pending")
    int claim(@Param("id") Long id,
              @Param("serverId") Long serverId,
              @Param("pending") Command.CommandStatus pending,
              @Param("running") Command.CommandStatus running,
              @Param("executedAt") Instant executedAt);

    /**
     * Record a result on a command that is still in one of {@code open}.
     *
     * @return 1 if this call recorded the result, 0 if the command had already finished
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("UPDATE Command c SET c.status = :status, c.exitCode = :exitCode, " +
            "c.stdout = :stdout, c.stderr = :stderr, c.completedAt = :completedAt " +
            "WHERE c.id = :id AND c.serverId = :serverId AND c.status IN :open")
    int complete(@Param("id") Long id,
                 @Param("serverId") Long serverId,
                 @Param("open") Collection<Command.CommandStatus> open,
                 @Param("status") Command.CommandStatus status,
                 @Param("exitCode") Integer exitCode,
                 @Param("stdout") String stdout,
                 @Param("stderr") String stderr,
                 @Param("completedAt") Instant completedAt);
}
