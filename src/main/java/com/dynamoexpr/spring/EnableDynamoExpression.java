package com.dynamoexpr.spring;

import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enable condition expression support in a Spring Boot application.
 *
 * Usage:
 * <pre>
 * &#64;SpringBootApplication
 * &#64;EnableDynamoExpression
 * public class MyApplication {
 *     public static void main(String[] args) {
 *         SpringApplication.run(MyApplication.class, args);
 *     }
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(DynamoExpressionAutoConfiguration.class)
public @interface EnableDynamoExpression {
}
