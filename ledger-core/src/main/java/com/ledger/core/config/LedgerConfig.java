package com.ledger.core.config;

import com.ledger.core.model.CurrencyRegistry;
import com.ledger.core.model.PriceType;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Ledger configuration loaded from {@code ledger.properties}.
 *
 * Lookup order: working directory, then classpath, then built-in defaults.
 * Keys:
 * - XRATE_PRICE_TYPE: BID, ASK or MID (default MID), price used for currency conversion
 * - CURRENCY_PRECISION_&lt;CODE&gt;: fractional digits for a currency, adds to or overrides the defaults
 * - EVENT_QUEUE_CAPACITY: bound of the single-writer event queue (default 10000)
 * - HTTP_PORT: port of the read-only valuation API (default 8080, 0 picks a free port)
 */
public final class LedgerConfig {
    private static final Logger logger = LoggerFactory.getLogger(LedgerConfig.class);
    private static final String CONFIG_FILE = "ledger.properties";
    private static final String PRECISION_PREFIX = "CURRENCY_PRECISION_";

    private static final AtomicReference<LedgerConfig> instanceRef = new AtomicReference<>();

    private final Properties properties;

    @NotNull(message = "Exchange-rate price type is required")
    private final PriceType xratePriceType;

    @NotNull
    private final CurrencyRegistry currencies;

    @Min(value = 1, message = "Event queue capacity must be at least 1")
    @Max(value = 10_000_000, message = "Event queue capacity must not exceed 10000000")
    private final int eventQueueCapacity;

    @Min(value = 0, message = "HTTP port must be between 0 and 65535")
    @Max(value = 65535, message = "HTTP port must be between 0 and 65535")
    private final int httpPort;

    private LedgerConfig(Properties props) {
        this.properties = props;
        this.xratePriceType = parsePriceType("XRATE_PRICE_TYPE", PriceType.MID);
        this.currencies = CurrencyRegistry.withOverrides(parsePrecisions());
        this.eventQueueCapacity = parseInt("EVENT_QUEUE_CAPACITY", 10_000);
        this.httpPort = parseInt("HTTP_PORT", 8080);

        validate();

        logger.info("Ledger configuration loaded: xrate={}, currencies={}, queueCapacity={}, httpPort={}",
            xratePriceType, currencies.all().size(), eventQueueCapacity, httpPort);
    }

    /**
     * Singleton loaded from the default locations on first use.
     */
    public static LedgerConfig getInstance() {
        return instanceRef.updateAndGet(existing ->
            existing != null ? existing : load()
        );
    }

    public static LedgerConfig load() {
        Properties props = new Properties();

        Path configPath = Path.of(CONFIG_FILE);
        if (Files.exists(configPath)) {
            try (InputStream is = Files.newInputStream(configPath)) {
                props.load(is);
                logger.info("Loaded config from: {}", configPath.toAbsolutePath());
                return new LedgerConfig(props);
            } catch (IOException e) {
                logger.warn("Failed to load {} from filesystem: {}", CONFIG_FILE, e.getMessage());
            }
        }

        try (InputStream is = LedgerConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded config from classpath");
                return new LedgerConfig(props);
            }
        } catch (IOException e) {
            logger.warn("Failed to load {} from classpath: {}", CONFIG_FILE, e.getMessage());
        }

        logger.warn("No {} found, using defaults", CONFIG_FILE);
        return new LedgerConfig(new Properties());
    }

    /**
     * Build a config from explicit properties, bypassing the singleton.
     */
    public static LedgerConfig forTest(Properties props) {
        return new LedgerConfig(props);
    }

    /**
     * Drop the cached singleton so the next {@link #getInstance()} reloads.
     */
    public static void reset() {
        instanceRef.set(null);
    }

    private void validate() {
        try (ValidatorFactory factory = Validation.byDefaultProvider()
                .configure()
                .messageInterpolator(new ParameterMessageInterpolator())
                .buildValidatorFactory()) {
            Validator validator = factory.getValidator();
            var violations = validator.validate(this);
            if (!violations.isEmpty()) {
                var errorMessages = violations.stream()
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .sorted()
                    .toList();
                throw new IllegalStateException(
                    "Configuration validation failed: " + String.join(", ", errorMessages)
                );
            }
        }
    }

    private PriceType parsePriceType(String key, PriceType defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return PriceType.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private int parseInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private Map<String, Integer> parsePrecisions() {
        var precisions = new LinkedHashMap<String, Integer>();
        for (String key : properties.stringPropertyNames()) {
            if (!key.startsWith(PRECISION_PREFIX) || key.length() == PRECISION_PREFIX.length()) {
                continue;
            }
            String code = key.substring(PRECISION_PREFIX.length());
            String value = properties.getProperty(key).trim();
            try {
                int precision = Integer.parseInt(value);
                if (precision < 0 || precision > 16) {
                    logger.warn("Ignoring {}={}: precision must be within [0, 16]", key, value);
                    continue;
                }
                precisions.put(code, precision);
            } catch (NumberFormatException e) {
                logger.warn("Ignoring {}: '{}' is not an integer precision", key, value);
            }
        }
        return precisions;
    }

    public PriceType xratePriceType() {
        return xratePriceType;
    }

    public CurrencyRegistry currencies() {
        return currencies;
    }

    public int eventQueueCapacity() {
        return eventQueueCapacity;
    }

    public int httpPort() {
        return httpPort;
    }
}
