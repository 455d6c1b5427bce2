package com.dframeio.spring;

import com.dframeio.adapter.spring.FilterAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enable the filter engine in a Spring Boot application.
 * Registers a {@link com.dframeio.filter.FilterEngine} bean configured from the
 * {@code dframeio.filter.*} properties and the YAML file they point to.
 *
 * Usage:
 * <pre>
 * &#64;SpringBootApplication
 * &#64;EnableFilterEngine
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
@Import(FilterAutoConfiguration.class)
public @interface EnableFilterEngine {
}
