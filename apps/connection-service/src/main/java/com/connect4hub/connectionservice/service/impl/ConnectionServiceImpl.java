package com.connect4hub.connectionservice.service.impl;

import com.connect4hub.connectionservice.domain.model.ConnectCommand;
import com.connect4hub.connectionservice.domain.model.ConnectionAccepted;
import com.connect4hub.connectionservice.domain.model.ConnectionIdentity;
import com.connect4hub.connectionservice.service.ConnectionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

@Slf4j
@Service
@RequiredArgsConstructor
public class ConnectionServiceImpl implements ConnectionService {

    private final Clock clock;

    @Override
    public ConnectionAccepted connect(ConnectCommand command) {
        Objects.requireNonNull(command, "command");
        ConnectionIdentity identity = command.identity();
        Instant now = clock.instant();

        log.info("受理连接: clientId={}, accountId={}, acceptedAt={}",
                identity.clientId(), identity.accountId(), now);
        return new ConnectionAccepted(identity, now);
    }
}
