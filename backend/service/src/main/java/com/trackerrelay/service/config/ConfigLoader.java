package com.trackerrelay.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.trackerrelay.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

public final class ConfigLoader {
    public static final String TOKEN_ENV = "GITHUB_TOKEN";
    public static final String OWNER_ENV = "REPO_OWNER";
    public static final String REPO_ENV = "REPO_NAME";
    public static final String API_URL_ENV = "GITHUB_API_URL";

    private ConfigLoader() {
    }

    public static RelayConfig load(Path file) {
        return read(file, new TypeReference<>() {
        });
    }

    public static RelayConfig applyEnvironment(RelayConfig config, Map<String, String> env) {
        PublishConfig publish = config.publish();
        return config.withPublish(publish.withRepository(
                env.getOrDefault(API_URL_ENV, publish.apiUrl()),
                env.getOrDefault(OWNER_ENV, publish.owner()),
                env.getOrDefault(REPO_ENV, publish.repo()),
                env.getOrDefault(TOKEN_ENV, publish.token())
        ));
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
