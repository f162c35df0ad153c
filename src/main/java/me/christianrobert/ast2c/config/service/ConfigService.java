package me.christianrobert.ast2c.config.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runtime settings for code generation.
 *
 * <p>Known keys are validated on write ({@link #validate}); unknown keys are stored as given so
 * clients can keep their own settings next to the generator's. Reads never fail: a missing or
 * unusable value yields the built-in default.</p>
 */
@ApplicationScoped
public class ConfigService {

    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    public static final String INDENT_WIDTH = "generator.indent-width";
    public static final String SHOW_AST = "generator.show-ast";

    private static final int DEFAULT_INDENT_WIDTH = 4;
    private static final boolean DEFAULT_SHOW_AST = false;

    private final Map<String, Object> settings = new ConcurrentHashMap<>();

    public ConfigService() {
        loadDefaults();
    }

    private void loadDefaults() {
        settings.put(INDENT_WIDTH, DEFAULT_INDENT_WIDTH);
        settings.put(SHOW_AST, DEFAULT_SHOW_AST);
        log.info("Generator settings initialized: {}={}, {}={}",
                INDENT_WIDTH, DEFAULT_INDENT_WIDTH, SHOW_AST, DEFAULT_SHOW_AST);
    }

    public Map<String, Object> getAllConfiguration() {
        return new HashMap<>(settings);
    }

    public Object getConfigValue(String key) {
        return settings.get(key);
    }

    public String getConfigValueAsString(String key) {
        Object value = settings.get(key);
        return value != null ? value.toString() : null;
    }

    public boolean hasConfigKey(String key) {
        return settings.containsKey(key);
    }

    /**
     * Spaces per indent level for generated code. Falls back to 4 when unset, non-numeric or negative.
     */
    public int getIndentWidth() {
        Integer width = toInteger(settings.get(INDENT_WIDTH));
        if (width == null || width < 0) {
            log.warn("Invalid value for {}: {} (using {})", INDENT_WIDTH, settings.get(INDENT_WIDTH), DEFAULT_INDENT_WIDTH);
            return DEFAULT_INDENT_WIDTH;
        }
        return width;
    }

    /**
     * Whether generation results include the tree dump when the caller does not say.
     */
    public boolean isShowAstByDefault() {
        Boolean showAst = toBoolean(settings.get(SHOW_AST));
        return showAst != null ? showAst : DEFAULT_SHOW_AST;
    }

    /**
     * Checks a value for a key before it is stored.
     *
     * @param key Setting key
     * @param value Proposed value (null unsets the key)
     * @return Problem description, or empty if the value is acceptable
     */
    public Optional<String> validate(String key, Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (INDENT_WIDTH.equals(key)) {
            Integer width = toInteger(value);
            if (width == null || width < 0) {
                return Optional.of(INDENT_WIDTH + " must be a non-negative integer, got: " + value);
            }
        } else if (SHOW_AST.equals(key) && toBoolean(value) == null) {
            return Optional.of(SHOW_AST + " must be true or false, got: " + value);
        }
        return Optional.empty();
    }

    /**
     * Stores several settings. Values are not validated here; REST callers validate first.
     */
    public void updateConfiguration(Map<String, Object> changes) {
        log.info("Updating {} settings", changes.size());
        changes.forEach(this::setConfigValue);
    }

    /**
     * Stores one setting; a null value removes the key.
     */
    public void setConfigValue(String key, Object value) {
        Object previous = value != null ? settings.put(key, value) : settings.remove(key);
        log.debug("Setting {} = {} (was: {})", key, value, previous);
    }

    public void resetToDefaults() {
        log.info("Resetting generator settings to defaults");
        settings.clear();
        loadDefaults();
    }

    // Numbers and numeric strings ("4")
    private static Integer toInteger(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    // Booleans and the strings "true"/"false" (any case)
    private static Boolean toBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            if ("true".equalsIgnoreCase(text)) {
                return Boolean.TRUE;
            }
            if ("false".equalsIgnoreCase(text)) {
                return Boolean.FALSE;
            }
        }
        return null;
    }
}
