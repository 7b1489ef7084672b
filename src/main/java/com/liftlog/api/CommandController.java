package com.liftlog.api;

import com.liftlog.contract.ValidationException;
import com.liftlog.interpreter.CommandGateway;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * POST /v1/users/{userId}/commands  {"text": "100 for 8"}
 *
 * Free text goes through the command interpreter and then the ordinary emit or
 * query path; it gets no extra trust.
 */
@RestController
@RequestMapping("/v1/users/{userId}/commands")
public class CommandController {

    private final CommandGateway gateway;

    public CommandController(CommandGateway gateway) {
        this.gateway = gateway;
    }

    @PostMapping
    public CommandGateway.CommandOutcome submit(@PathVariable String userId, @RequestBody Map<String, Object> request) {
        if (!(request.get("text") instanceof String text) || text.isBlank()) {
            throw new ValidationException("text", "is required");
        }
        return gateway.handle(userId, text);
    }
}
