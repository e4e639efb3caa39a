package com.dynamoexpr.spring;

import com.dynamoexpr.ConditionExpressionService;
import com.dynamoexpr.config.ConfigLoader;
import com.dynamoexpr.config.ExpressionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for condition expressions.
 */
@Configuration
@ConditionalOnProperty(prefix = "dynamo-expr", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(DynamoExpressionProperties.class)
public class DynamoExpressionAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(DynamoExpressionAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public ExpressionConfig expressionConfig(DynamoExpressionProperties properties) {
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public ConditionExpressionService conditionExpressionService(ExpressionConfig config) {
        log.info("Creating ConditionExpressionService: {}", config);
        return new ConditionExpressionService(config);
    }
}
