package com.programmersdiary.nudge.web;

import com.programmersdiary.nudge.provider.ChatModelResolver;
import com.programmersdiary.nudge.provider.ProviderConfig;
import com.programmersdiary.nudge.provider.ProviderConfigRepository;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

/**
 * Provider management. API keys are accepted but never returned.
 */
@RestController
@RequestMapping("/api/providers")
public class ProviderController {

    private final ProviderConfigRepository repository;
    private final ChatModelResolver chatModelResolver;

    public ProviderController(ProviderConfigRepository repository, ChatModelResolver chatModelResolver) {
        this.repository = repository;
        this.chatModelResolver = chatModelResolver;
    }

    @GetMapping
    public List<ProviderResponse> list() {
        return repository.findAll().stream()
                .map(ProviderResponse::from)
                .toList();
    }

    // The provider scheduled jobs currently fire against.
    @GetMapping("/active")
    public ProviderResponse active() {
        return chatModelResolver.activeProvider()
                .map(ProviderResponse::from)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No provider configured"));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ProviderResponse create(@RequestBody CreateProviderRequest request) {
        if (request.type() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Provider type is required");
        }
        var config = new ProviderConfig(
                UUID.randomUUID().toString(),
                request.name() != null ? request.name() : request.type().name().toLowerCase(),
                request.type(),
                request.apiKey(),
                request.baseUrl(),
                request.model()
        );
        return ProviderResponse.from(repository.save(config));
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String id) {
        if (!repository.deleteById(id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND);
        }
    }
}
