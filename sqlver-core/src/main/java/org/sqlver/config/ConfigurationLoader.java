package org.sqlver.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlver.options.SqlverOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

public class ConfigurationLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigurationLoader.class);

    private static final String CONFIG_FILE_NAME = SqlverOptions.Profile.CONFIG_FILE;
    private static final String DEFAULT_PROFILE = SqlverOptions.Profile.DEFAULT;

    private final ObjectMapper yamlMapper;
    private final Path startDirectory;
    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(Paths.get("").toAbsolutePath(), System.getenv());
    }

    public ConfigurationLoader(Path startDirectory) {
        this(startDirectory, System.getenv());
    }

    ConfigurationLoader(Path startDirectory, Map<String, String> environment) {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.startDirectory = startDirectory;
        this.environment = environment;
    }

    /**
     * 설정을 로드하고 지정된 프로파일을 적용
     *
     * 우선순위: CLI 프로파일 > 환경변수 > 기본값(dev)
     *
     * @param cliProfile CLI에서 지정된 프로파일 (null 가능)
     * @return 해석된 설정 맵
     */
    public Map<String, String> loadConfiguration(String cliProfile) {
        String activeProfile = resolveActiveProfile(cliProfile);

        Optional<SqlverConfiguration> config = findAndLoadConfiguration();
        if (config.isEmpty()) {
            return createDefaultConfiguration();
        }
        return extractConfigurationForProfile(config.get(), activeProfile);
    }

    String resolveActiveProfile(String cliProfile) {
        if (cliProfile != null && !cliProfile.trim().isEmpty()) {
            return cliProfile.trim();
        }
        String envProfile = environment.get(SqlverOptions.Profile.ENV_VAR);
        if (envProfile != null && !envProfile.trim().isEmpty()) {
            return envProfile.trim();
        }
        return DEFAULT_PROFILE;
    }

    /**
     * 시작 디렉토리부터 상위 디렉토리로 올라가며 sqlver.yaml 을 찾는다.
     */
    private Optional<SqlverConfiguration> findAndLoadConfiguration() {
        Path currentDir = startDirectory;

        while (currentDir != null) {
            Path configFile = currentDir.resolve(CONFIG_FILE_NAME);
            if (Files.exists(configFile)) {
                try {
                    LOGGER.debug("Loading configuration from {}", configFile);
                    return Optional.ofNullable(yamlMapper.readValue(configFile.toFile(), SqlverConfiguration.class));
                } catch (IOException e) {
                    LOGGER.warn("Failed to parse {}: {}", configFile, e.getMessage());
                    return Optional.empty();
                }
            }
            currentDir = currentDir.getParent();
        }
        return Optional.empty();
    }

    private Map<String, String> extractConfigurationForProfile(SqlverConfiguration config, String profile) {
        var profileConfig = config.getProfiles() == null ? null : config.getProfiles().get(profile);
        if (profileConfig == null) {
            LOGGER.warn("Profile '{}' not found in configuration. Using defaults.", profile);
            return createDefaultConfiguration();
        }

        var configMap = new HashMap<>(createDefaultConfiguration());
        if (profileConfig.getPlatform() != null && !profileConfig.getPlatform().isBlank()) {
            configMap.put(SqlverOptions.Plan.PLATFORM_KEY, profileConfig.getPlatform().trim());
        }
        if (profileConfig.getFailOnWarnings() != null) {
            configMap.put(SqlverOptions.Plan.FAIL_ON_WARNINGS_KEY, String.valueOf(profileConfig.getFailOnWarnings()));
        }
        return configMap;
    }

    private Map<String, String> createDefaultConfiguration() {
        return Map.of(
                SqlverOptions.Plan.PLATFORM_KEY, SqlverOptions.Plan.PLATFORM_DEFAULT,
                SqlverOptions.Plan.FAIL_ON_WARNINGS_KEY, String.valueOf(SqlverOptions.Plan.FAIL_ON_WARNINGS_DEFAULT)
        );
    }
}
