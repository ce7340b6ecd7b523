package org.janelia.colorcast.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link Config} from the default resources and an optional properties file.
 * Settings read later override the ones read earlier.
 */
public class ConfigProvider {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigProvider.class);
    private static final String DEFAULT_CONFIG_RESOURCES = "/colorcast.properties";

    public static ConfigProvider getInstance() {
        return new ConfigProvider();
    }

    private final Properties properties;

    private ConfigProvider() {
        this.properties = new Properties();
    }

    public ConfigProvider fromDefaultResources() {
        return fromResource(DEFAULT_CONFIG_RESOURCES);
    }

    public ConfigProvider fromResource(String resourceName) {
        try (InputStream configStream = this.getClass().getResourceAsStream(resourceName)) {
            if (configStream == null) {
                LOG.warn("Config resource {} not found", resourceName);
            } else {
                LOG.debug("Reading settings from resource {}", resourceName);
                properties.load(configStream);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading config resource " + resourceName, e);
        }
        return this;
    }

    /**
     * Read settings from the given file. A blank file name is ignored.
     *
     * @throws IllegalArgumentException if the file does not exist
     */
    public ConfigProvider fromFile(String fileName) {
        if (StringUtils.isBlank(fileName)) {
            return this;
        }
        Path configPath = Paths.get(fileName);
        if (Files.notExists(configPath)) {
            throw new IllegalArgumentException("Config file " + fileName + " not found");
        }
        try (InputStream configStream = Files.newInputStream(configPath)) {
            LOG.info("Reading settings from {}", fileName);
            properties.load(configStream);
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading config file " + fileName, e);
        }
        return this;
    }

    public Config get() {
        Properties snapshot = new Properties();
        snapshot.putAll(properties);
        return new Config(snapshot);
    }
}
