package com.example.lxmon.repository;

import com.example.lxmon.domain.Server;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface ServerRepository extends JpaRepository<Server, Long> {

    Optional<Server> findByHostname(String hostname);

    /** Servers whose last heartbeat is older than {@code cutoff} and are not yet OFFLINE. */
    List<Server> findByLastHeartbeatBeforeAndStatusNot(Instant cutoff, Server.Status status);
}
