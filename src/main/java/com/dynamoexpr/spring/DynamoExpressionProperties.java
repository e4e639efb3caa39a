package com.dynamoexpr.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for condition expressions.
 */
@ConfigurationProperties(prefix = "dynamo-expr")
public class DynamoExpressionProperties {

    /**
     * Whether the expression service is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the expression configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:dynamo-expr.yaml";

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
}
