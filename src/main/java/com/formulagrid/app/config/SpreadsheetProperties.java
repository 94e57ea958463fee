package com.formulagrid.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Locale;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Settings under the "spreadsheet." prefix. The defaults match a plain
 * {@code new Spreadsheet()}: names kept as typed, every cell-shaped name accepted.
 */
@ConfigurationProperties(prefix = "spreadsheet")
public class SpreadsheetProperties {

    public enum Normalization {
        NONE,
        UPPER_CASE
    }

    private String defaultVersion = "default";
    private Normalization normalize = Normalization.NONE;
    private String validNamePattern = ".*";
    private String storageDir = "sheets";

    public String getDefaultVersion() {
        return defaultVersion;
    }

    public void setDefaultVersion(String defaultVersion) {
        this.defaultVersion = defaultVersion;
    }

    public Normalization getNormalize() {
        return normalize;
    }

    public void setNormalize(Normalization normalize) {
        this.normalize = normalize;
    }

    public String getValidNamePattern() {
        return validNamePattern;
    }

    public void setValidNamePattern(String validNamePattern) {
        this.validNamePattern = validNamePattern;
    }

    public String getStorageDir() {
        return storageDir;
    }

    public void setStorageDir(String storageDir) {
        this.storageDir = storageDir;
    }

    /**
     * The configured normalization as a name function.
     */
    public UnaryOperator<String> normalizer() {
        if (normalize == Normalization.UPPER_CASE) {
            return s -> s.toUpperCase(Locale.ROOT);
        }
        return s -> s;
    }

    /**
     * The configured name pattern as a validity predicate; names must match it fully.
     */
    public Predicate<String> validator() {
        Pattern pattern = Pattern.compile(validNamePattern);
        return s -> pattern.matcher(s).matches();
    }
}
