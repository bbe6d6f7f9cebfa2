package com.metasrv.meta;

import com.metasrv.statemachine.Command;

import java.util.Objects;

/**
 * Asks the leader to propose a command and return its applied result.
 */
public record WriteRequest(Command command) implements ForwardRequest.Body {

    public WriteRequest {
        Objects.requireNonNull(command, "command");
    }
}
