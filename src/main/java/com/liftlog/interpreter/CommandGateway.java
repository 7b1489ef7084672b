package com.liftlog.interpreter;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.liftlog.engine.WorkoutEventEngine;
import com.liftlog.projection.CurrentWorkout;
import com.liftlog.projection.ProjectionKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs free-text commands. The interpreter is called before, and never inside,
 * the user's write lock; its output is then emitted or queried like any other
 * request.
 */
@Service
public class CommandGateway {

    private static final Logger log = LoggerFactory.getLogger(CommandGateway.class);

    private final CommandInterpreter interpreter;
    private final WorkoutEventEngine engine;

    public CommandGateway(CommandInterpreter interpreter, WorkoutEventEngine engine) {
        this.interpreter = interpreter;
        this.engine = engine;
    }

    public CommandOutcome handle(String userId, String text) {
        CurrentWorkout current = engine.projection(userId, ProjectionKeys.CURRENT_WORKOUT)
            .map(entry -> (CurrentWorkout) entry.data())
            .orElse(null);
        InterpretedCommand command = interpreter.interpret(text, current);
        log.debug("Interpreted command for user={} as {}", userId, command);

        if (command instanceof InterpretedCommand.Emit emit) {
            return new CommandOutcome(command, engine.emit(userId, emit.eventType(), emit.payload()));
        }
        InterpretedCommand.Query query = (InterpretedCommand.Query) command;
        return new CommandOutcome(command, engine.query(userId, query.kind(), query.key()).orElse(null));
    }

    public record CommandOutcome(
        @JsonProperty("command") InterpretedCommand command,
        @JsonProperty("result") Object result
    ) {}
}
