package com.tradinggrok.config;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.groups.Default;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.util.Optional;
import java.util.Properties;
import java.util.function.UnaryOperator;

/**
 * Credentials and endpoints for the backend collaborators.
 * Each key is read from the environment first, then from config.properties.
 */
public final class Config {
    private static final Logger logger = LoggerFactory.getLogger(Config.class);
    private static final String CONFIG_FILE = "config.properties";
    private static final String PAPER_BASE_URL = "https://paper-api.alpaca.markets";
    private static final String LIVE_BASE_URL = "https://api.alpaca.markets";
    private static final String DEFAULT_DATA_URL = "https://data.alpaca.markets";
    private static final String DEFAULT_GROK_URL = "https://api.x.ai/v1/chat/completions";
    private static final String DEFAULT_GROK_MODEL = "grok-beta";

    /** Validation group for settings only the HTTP control surface needs. */
    public interface ControlApi {
    }

    @NotBlank(message = "APCA_API_KEY_ID is required")
    private final String apiKey;

    @NotBlank(message = "APCA_API_SECRET_KEY is required")
    private final String apiSecret;

    @NotBlank(message = "Base URL is required")
    @Pattern(regexp = "^https://.*", message = "Base URL must use HTTPS")
    private final String baseUrl;

    @Pattern(regexp = "^https://.*", message = "Data URL must use HTTPS")
    private final String dataUrl;

    @NotBlank(message = "GROK_API_KEY is required")
    private final String grokApiKey;

    @Pattern(regexp = "^https://.*", message = "Grok URL must use HTTPS")
    private final String grokUrl;

    @NotBlank(message = "DASHBOARD_PASSWORD is required to serve the control API", groups = ControlApi.class)
    private final String dashboardPassword;

    @Min(value = 1, groups = ControlApi.class)
    @Max(value = 65535, groups = ControlApi.class)
    private final int dashboardPort;

    private final boolean paperTrading;
    private final String grokModel;
    private final UnaryOperator<String> env;
    private final Properties properties;

    public Config() {
        this(loadProperties(), System::getenv);
    }

    /**
     * @param env environment lookup, consulted before {@code properties}
     */
    public Config(Properties properties, UnaryOperator<String> env) {
        this.properties = properties;
        this.env = env;
        this.paperTrading = Boolean.parseBoolean(getProperty("PAPER_TRADING", "true").trim());
        this.baseUrl = getProperty("APCA_API_BASE_URL", paperTrading ? PAPER_BASE_URL : LIVE_BASE_URL);
        this.dataUrl = getProperty("APCA_DATA_URL", DEFAULT_DATA_URL);
        this.apiKey = getProperty("APCA_API_KEY_ID");
        this.apiSecret = getProperty("APCA_API_SECRET_KEY");
        this.grokApiKey = getProperty("GROK_API_KEY");
        this.grokUrl = getProperty("GROK_API_URL", DEFAULT_GROK_URL);
        this.grokModel = getProperty("GROK_MODEL", DEFAULT_GROK_MODEL);
        this.dashboardPassword = getProperty("DASHBOARD_PASSWORD");
        this.dashboardPort = parsePort(getProperty("DASHBOARD_PORT", "8080"));

        if (!paperTrading && baseUrl.contains("paper-api")) {
            logger.warn("PAPER_TRADING=false but base URL {} is the paper endpoint", baseUrl);
        }
        logger.info("Backend configuration loaded: {} mode, broker {}, analysis model {}",
            paperTrading ? "PAPER" : "LIVE", baseUrl, grokModel);
    }

    private static Properties loadProperties() {
        var props = new Properties();
        try (var fis = new FileInputStream(CONFIG_FILE)) {
            props.load(fis);
            logger.debug("Loaded properties from {}", CONFIG_FILE);
        } catch (IOException e) {
            logger.debug("No {} found, using environment only", CONFIG_FILE);
        }
        return props;
    }

    private int parsePort(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid DASHBOARD_PORT '{}', using 8080", value);
            return 8080;
        }
    }

    /**
     * Validate using Bean Validation. Pass {@link ControlApi} to also check control API settings.
     *
     * @throws IllegalStateException listing every violation
     */
    public void validate(Class<?>... groups) {
        Validator validator = Validation.buildDefaultValidatorFactory().getValidator();
        Class<?>[] effective = new Class<?>[groups.length + 1];
        effective[0] = Default.class;
        System.arraycopy(groups, 0, effective, 1, groups.length);

        var violations = validator.validate(this, effective);
        if (!violations.isEmpty()) {
            var errorMessages = violations.stream()
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .sorted()
                .toList();
            throw new IllegalStateException("Configuration validation failed: " + String.join(", ", errorMessages));
        }
    }

    public String apiKey() {
        return apiKey;
    }

    public String apiSecret() {
        return apiSecret;
    }

    public String baseUrl() {
        return baseUrl;
    }

    public String dataUrl() {
        return dataUrl;
    }

    public String grokApiKey() {
        return grokApiKey;
    }

    public String grokUrl() {
        return grokUrl;
    }

    public String grokModel() {
        return grokModel;
    }

    public String dashboardPassword() {
        return dashboardPassword;
    }

    public int dashboardPort() {
        return dashboardPort;
    }

    /**
     * Decides the broker endpoint; the trading configuration takes its mode from here.
     */
    public boolean isPaperTrading() {
        return paperTrading;
    }

    private String getProperty(String key) {
        return Optional.ofNullable(env.apply(key))
            .or(() -> Optional.ofNullable(properties.getProperty(key)))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .orElse(null);
    }

    private String getProperty(String key, String defaultValue) {
        String value = getProperty(key);
        return value != null ? value : defaultValue;
    }
}
