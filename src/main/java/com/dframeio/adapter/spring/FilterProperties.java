package com.dframeio.adapter.spring;

import com.dframeio.config.FilterEngineConfig;
import com.dframeio.relational.PlaceholderStyle;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the filter engine.
 * <p>
 * Engine options set here take precedence over the ones in the YAML file at
 * {@link #getConfigPath()}. Unset options keep the file's value.
 * <pre>
 * dframeio:
 *   filter:
 *     config-path: classpath:dframeio-filter.yaml
 *     residual-split: false
 *     placeholder-style: NUMBERED
 *     quote-identifiers: true
 * </pre>
 */
@ConfigurationProperties(prefix = "dframeio.filter")
public class FilterProperties {

    /**
     * Whether the filter engine beans are created.
     */
    private boolean enabled = true;

    /**
     * Path to the filter configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:dframeio-filter.yaml";

    /**
     * Keep non-pushable conjuncts of columnar filters as an in-memory residual.
     */
    private Boolean residualSplit;

    /**
     * Placeholder syntax of relational WHERE clauses.
     */
    private PlaceholderStyle placeholderStyle;

    /**
     * Double-quote column names in relational WHERE clauses.
     */
    private Boolean quoteIdentifiers;

    /**
     * Overlay the options set on these properties onto a loaded configuration.
     *
     * @param fileConfig Configuration read from {@link #getConfigPath()}
     * @return Effective engine configuration
     */
    public FilterEngineConfig applyTo(FilterEngineConfig fileConfig) {
        return new FilterEngineConfig(
                residualSplit != null ? residualSplit : fileConfig.residualSplit(),
                placeholderStyle != null ? placeholderStyle : fileConfig.placeholderStyle(),
                quoteIdentifiers != null ? quoteIdentifiers : fileConfig.quoteIdentifiers());
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }

    public Boolean getResidualSplit() {
        return residualSplit;
    }

    public void setResidualSplit(Boolean residualSplit) {
        this.residualSplit = residualSplit;
    }

    public PlaceholderStyle getPlaceholderStyle() {
        return placeholderStyle;
    }

    public void setPlaceholderStyle(PlaceholderStyle placeholderStyle) {
        this.placeholderStyle = placeholderStyle;
    }

    public Boolean getQuoteIdentifiers() {
        return quoteIdentifiers;
    }

    public void setQuoteIdentifiers(Boolean quoteIdentifiers) {
        this.quoteIdentifiers = quoteIdentifiers;
    }
}
