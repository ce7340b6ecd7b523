package org.janelia.colorcast.config;

import java.util.Map;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Application settings backed by java properties.
 */
public class Config {

    private final Properties properties;

    Config(Properties properties) {
        this.properties = properties;
    }

    public String getStringPropertyValue(String name) {
        return StringUtils.trimToNull(properties.getProperty(name));
    }

    public String getStringPropertyValue(String name, String defaultValue) {
        String value = getStringPropertyValue(name);
        return value != null ? value : defaultValue;
    }

    public int getIntegerPropertyValue(String name, int defaultValue) {
        String value = getStringPropertyValue(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer value for " + name + ": " + value, e);
        }
    }

    public double getDoublePropertyValue(String name, double defaultValue) {
        String value = getStringPropertyValue(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid numeric value for " + name + ": " + value, e);
        }
    }

    public boolean hasProperty(String name) {
        return getStringPropertyValue(name) != null;
    }

    @Override
    public String toString() {
        ToStringBuilder builder = new ToStringBuilder(this);
        for (Map.Entry<Object, Object> e : properties.entrySet()) {
            builder.append(String.valueOf(e.getKey()), e.getValue());
        }
        return builder.toString();
    }
}
