package org.quoin.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.quoin.options.QuoinOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

public class ConfigurationLoader {

    private static final String CONFIG_FILE_NAME = QuoinOptions.Profile.CONFIG_FILE;
    private static final String DEFAULT_PROFILE = QuoinOptions.Profile.DEFAULT;
    private static final String PROFILE_ENV_VAR = QuoinOptions.Profile.ENV_VAR;

    private final ObjectMapper yamlMapper;
    private final Path startDirectory;
    private final Function<String, String> environment;

    public ConfigurationLoader() {
        this(Paths.get("").toAbsolutePath());
    }

    public ConfigurationLoader(Path startDirectory) {
        this(startDirectory, System::getenv);
    }

    // 테스트 용
    ConfigurationLoader(Path startDirectory, Function<String, String> environment) {
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

        Optional<QuoinConfiguration> config = findAndLoadConfiguration();
        if (config.isEmpty()) {
            // 설정 파일이 없으면 기본값 사용
            return createDefaultConfiguration();
        }

        return extractConfigurationForProfile(config.get(), activeProfile);
    }

    /**
     * 활성 프로파일을 결정합니다.
     */
    String resolveActiveProfile(String cliProfile) {
        if (cliProfile != null && !cliProfile.trim().isEmpty()) {
            return cliProfile;
        }

        String envProfile = environment.apply(PROFILE_ENV_VAR);
        if (envProfile != null && !envProfile.trim().isEmpty()) {
            return envProfile;
        }

        return DEFAULT_PROFILE;
    }

    /**
     * 시작 디렉토리부터 상위 디렉토리로 올라가며 quoin.yaml을 찾습니다.
     */
    private Optional<QuoinConfiguration> findAndLoadConfiguration() {
        Path currentDir = startDirectory;

        while (currentDir != null) {
            Path configFile = currentDir.resolve(CONFIG_FILE_NAME);
            if (Files.exists(configFile)) {
                try {
                    QuoinConfiguration config = yamlMapper.readValue(configFile.toFile(), QuoinConfiguration.class);
                    return Optional.ofNullable(config);
                } catch (IOException e) {
                    System.err.println("Warning: Failed to parse " + configFile + ": " + e.getMessage());
                    return Optional.empty();
                }
            }
            currentDir = currentDir.getParent();
        }

        return Optional.empty();
    }

    /**
     * 특정 프로파일의 설정을 추출하여 키-값 맵으로 변환합니다.
     */
    private Map<String, String> extractConfigurationForProfile(QuoinConfiguration config, String profile) {
        var profileConfig = config.getProfiles() == null ? null : config.getProfiles().get(profile);
        if (profileConfig == null) {
            System.err.println("Warning: Profile '" + profile + "' not found in configuration. Using defaults.");
            return createDefaultConfiguration();
        }

        var configMap = new HashMap<>(createDefaultConfiguration());

        var quoting = profileConfig.getQuoting();
        if (quoting != null) {
            putIfPresent(configMap, QuoinOptions.Quote.DIALECT_KEY, quoting.getDialect());
            putIfPresent(configMap, QuoinOptions.Quote.MODE_KEY, quoting.getMode());
            putIfPresent(configMap, QuoinOptions.Quote.POLICY_KEY, quoting.getPolicy());
        }

        return configMap;
    }

    private static void putIfPresent(Map<String, String> configMap, String key, String value) {
        if (value != null && !value.isBlank()) {
            configMap.put(key, value.trim());
        }
    }

    /**
     * 기본 설정 맵을 생성합니다.
     */
    private Map<String, String> createDefaultConfiguration() {
        return Map.of(
            QuoinOptions.Quote.DIALECT_KEY, QuoinOptions.Quote.DIALECT_DEFAULT,
            QuoinOptions.Quote.MODE_KEY, QuoinOptions.Quote.MODE_DEFAULT,
            QuoinOptions.Quote.POLICY_KEY, QuoinOptions.Quote.POLICY_DEFAULT
        );
    }
}
