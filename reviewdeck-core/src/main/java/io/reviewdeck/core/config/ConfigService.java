package io.reviewdeck.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.reviewdeck.core.config.model.ReviewDeckConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ConfigService {
    private static final Logger LOG = LoggerFactory.getLogger(ConfigService.class);

    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public ReviewDeckConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            LOG.debug("No config at {}, using defaults", configPath);
            return ReviewDeckConfig.defaults();
        }
        JsonNode stored = mapper.readTree(Files.readString(configPath));
        return mapper.treeToValue(deepMerge(mapper.valueToTree(ReviewDeckConfig.defaults()), stored), ReviewDeckConfig.class);
    }

    public void save(Path configPath, ReviewDeckConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        if (configPath.getParent() != null) {
            Files.createDirectories(configPath.getParent());
        }
        Files.writeString(configPath, toPrettyJson(config) + System.lineSeparator());
        LOG.info("Config written to {}", configPath);
    }

    public OnboardResult onboard(Path configPath, boolean overwrite) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        boolean created = !Files.exists(configPath);
        boolean reset = !created && overwrite;
        ReviewDeckConfig config = created || reset ? ReviewDeckConfig.defaults() : load(configPath);
        save(configPath, config);

        Path workspace = ConfigPaths.resolveWorkspace(config.report().workspace());
        WorkspaceBootstrap.ensureWorkspace(workspace);
        Path template = ConfigPaths.resolveTemplate(config.report());
        boolean templateWritten = WorkspaceBootstrap.ensureTemplate(template);
        if (templateWritten) {
            LOG.info("Master template written to {}", template);
        }
        return new OnboardResult(configPath, workspace, template, created, reset, templateWritten);
    }

    public String toPrettyJson(ReviewDeckConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config: " + e.getOriginalMessage(), e);
        }
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry ->
            merged.set(entry.getKey(), deepMerge(merged.get(entry.getKey()), entry.getValue())));
        return merged;
    }
}
