package com.liftlog.interpreter;

import com.liftlog.projection.CurrentWorkout;

/**
 * Turns free text into a candidate request. Implementations are untrusted:
 * whatever they return goes through the same validation as any other caller.
 */
public interface CommandInterpreter {

    /**
     * @param text    what the user typed
     * @param current the active workout as last committed, or null
     * @throws com.liftlog.contract.ValidationException when the text is not understood
     */
    InterpretedCommand interpret(String text, CurrentWorkout current);
}
