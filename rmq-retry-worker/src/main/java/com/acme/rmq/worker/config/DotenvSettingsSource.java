package com.acme.rmq.worker.config;

import com.acme.rmq.config.ConfigurationException;
import com.acme.rmq.config.Settings;
import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads {@link Settings} from {@code RMQ_*} variables. Process environment wins over the
 * {@code .env} file; a missing file is not an error.
 */
public class DotenvSettingsSource {
    private static final Logger logger = LoggerFactory.getLogger(DotenvSettingsSource.class);

    static final String PREFIX = "RMQ_";

    private static final List<String> OPTIONAL_KEYS =
            List.of(Settings.CONFIRM_TIMEOUT_MS, Settings.CONNECTION_NAME);

    private final Dotenv dotenv;

    public DotenvSettingsSource(Dotenv dotenv) {
        this.dotenv = dotenv;
    }

    public static DotenvSettingsSource load(Path directory, String filename) {
        try {
            Dotenv dotenv = Dotenv.configure()
                    .directory(directory.toString())
                    .filename(filename)
                    .ignoreIfMissing()
                    .load();
            logger.info("Configuration loaded from {} and the environment", directory.resolve(filename));
            return new DotenvSettingsSource(dotenv);
        } catch (DotenvException e) {
            throw new ConfigurationException("Failed to read " + directory.resolve(filename), e);
        }
    }

    /** Environment variable name of a settings key, e.g. {@code queue_retry -> RMQ_QUEUE_RETRY}. */
    public static String variableName(String key) {
        return PREFIX + key.toUpperCase(Locale.ROOT);
    }

    public Map<String, String> toOptions() {
        List<String> keys = new ArrayList<>(Settings.REQUIRED_KEYS);
        keys.addAll(OPTIONAL_KEYS);

        Map<String, String> options = new HashMap<>();
        for (String key : keys) {
            String value = dotenv.get(variableName(key));
            if (value != null) {
                options.put(key, value);
            }
        }
        return options;
    }

    public Settings toSettings() {
        return Settings.fromMap(toOptions());
    }
}
