package com.programmersdiary.nudge.provider;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.programmersdiary.nudge.storage.PrivateJsonFile;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Provider configurations, API keys included, kept in {@code providers.json} under the config dir.
 */
@Repository
public class ProviderConfigRepository {

    private static final TypeReference<List<ProviderConfig>> CONFIG_LIST_TYPE = new TypeReference<>() {};

    private final PrivateJsonFile configFile;
    private final List<ProviderConfig> configs = new CopyOnWriteArrayList<>();

    public ProviderConfigRepository(
            @Value("${nudge.config-dir:${user.home}/.nudge}") String configDir) {
        this.configFile = new PrivateJsonFile(Path.of(configDir, "providers.json"),
                new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    @PostConstruct
    void load() throws IOException {
        if (configFile.exists()) {
            var stored = configFile.read(CONFIG_LIST_TYPE);
            if (stored != null) {
                configs.addAll(stored);
            }
        }
    }

    public List<ProviderConfig> findAll() {
        return List.copyOf(configs);
    }

    public Optional<ProviderConfig> findById(String id) {
        return configs.stream().filter(c -> c.id().equals(id)).findFirst();
    }

    public synchronized ProviderConfig save(ProviderConfig config) {
        configs.removeIf(c -> c.id().equals(config.id()));
        configs.add(config);
        persist();
        return config;
    }

    public synchronized boolean deleteById(String id) {
        boolean removed = configs.removeIf(c -> c.id().equals(id));
        if (removed) {
            persist();
        }
        return removed;
    }

    private void persist() {
        try {
            configFile.write(configs);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
