package com.rerag.runtime;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

public final class AppConfigLoader {
    public static final String ENV_OLLAMA_URL = "RERAG_OLLAMA_URL";
    public static final String ENV_KETO_READ_URL = "RERAG_KETO_READ_URL";
    public static final String ENV_SNAPSHOT_PATH = "RERAG_SNAPSHOT_PATH";
    public static final String ENV_PERMISSIONS_MODE = "RERAG_PERMISSIONS_MODE";
    public static final String BUNDLED_CONFIG = "application.yml";

    private static final Logger log = LoggerFactory.getLogger(AppConfigLoader.class);

    private AppConfigLoader() {
    }

    public static AppConfig load(Path config) throws IOException {
        return load(config, System.getenv());
    }

    public static AppConfig load(Path config, Map<String, String> environment) throws IOException {
        AppConfig appConfig;
        if (config != null && Files.exists(config)) {
            log.info("Using config file: {}", config);
            appConfig = orDefaults(mapper().readValue(config.toFile(), AppConfig.class));
        } else {
            appConfig = loadBundled(config);
        }
        applyEnvironment(appConfig, environment);
        appConfig.validate();
        return appConfig;
    }

    private static AppConfig loadBundled(Path missing) throws IOException {
        try (InputStream in = AppConfigLoader.class.getClassLoader().getResourceAsStream(BUNDLED_CONFIG)) {
            if (in == null) {
                log.info("Config file {} not found and no bundled {}, using defaults", missing, BUNDLED_CONFIG);
                return new AppConfig();
            }
            log.info("Config file {} not found, using bundled {}", missing, BUNDLED_CONFIG);
            return orDefaults(mapper().readValue(in, AppConfig.class));
        }
    }

    private static AppConfig orDefaults(AppConfig loaded) {
        return loaded == null ? new AppConfig() : loaded;
    }

    static ObjectMapper mapper() {
        return YAMLMapper.builder(new YAMLFactory())
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .build();
    }

    private static void applyEnvironment(AppConfig config, Map<String, String> environment) {
        String ollamaUrl = environment.get(ENV_OLLAMA_URL);
        if (ollamaUrl != null && !ollamaUrl.isBlank()) {
            config.getServices().getOllama().setBaseUrl(ollamaUrl);
        }
        String ketoUrl = environment.get(ENV_KETO_READ_URL);
        if (ketoUrl != null && !ketoUrl.isBlank()) {
            config.getServices().getKeto().setReadUrl(ketoUrl);
        }
        String snapshotPath = environment.get(ENV_SNAPSHOT_PATH);
        if (snapshotPath != null && !snapshotPath.isBlank()) {
            config.getStorage().setSnapshotPath(snapshotPath);
        }
        String mode = environment.get(ENV_PERMISSIONS_MODE);
        if (mode != null && !mode.isBlank()) {
            try {
                config.getPermissions().setMode(AppConfig.PermissionsMode.valueOf(mode.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(ENV_PERMISSIONS_MODE + " must be one of static, keto, got " + mode, e);
            }
        }
    }
}
