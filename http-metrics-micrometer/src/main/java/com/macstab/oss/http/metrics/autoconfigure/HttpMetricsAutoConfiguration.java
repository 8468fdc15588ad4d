/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.http.metrics.autoconfigure;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import com.macstab.oss.http.metrics.HttpMetricsInterceptor;
import com.macstab.oss.http.metrics.backend.MetricsBackend;
import com.macstab.oss.http.metrics.config.HttpMetricsConfig;
import com.macstab.oss.http.metrics.micrometer.MicrometerMetricsBackend;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Spring Boot auto-configuration for HTTP server metrics.
 *
 * <p><strong>Activation Conditions:</strong>
 *
 * <ol>
 *   <li>{@code MeterRegistry.class} on classpath (Micrometer present)
 *   <li>{@code MeterRegistry} bean exists (Spring Boot Actuator configured)
 *   <li>{@code management.metrics.http-server.enabled=true} (default: true)
 * </ol>
 *
 * <p><strong>Beans Created:</strong>
 *
 * <ul>
 *   <li>{@link HttpMetricsConfig} - validated from {@link HttpMetricsProperties}; an invalid
 *       property fails context startup
 *   <li>{@link MetricsBackend} - {@link MicrometerMetricsBackend} if conditions met, {@link
 *       MetricsBackend#NOOP} otherwise
 *   <li>{@link HttpMetricsInterceptor} - consumed by server integrations (servlet filter)
 * </ul>
 *
 * <p>Every bean backs off when the application defines its own.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
@AutoConfiguration(
    afterName = {
      "org.springframework.boot.actuate.autoconfigure.metrics.MetricsAutoConfiguration",
      "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
    })
@ConditionalOnClass(MeterRegistry.class)
@EnableConfigurationProperties(HttpMetricsProperties.class)
public class HttpMetricsAutoConfiguration {

  /**
   * Creates the core configuration from properties.
   *
   * @param properties metrics configuration properties
   * @return validated configuration
   * @throws IllegalArgumentException on invalid names, label keys or exclusion patterns
   */
  @Bean
  @ConditionalOnMissingBean(HttpMetricsConfig.class)
  public HttpMetricsConfig httpMetricsConfig(final HttpMetricsProperties properties) {
    return properties.toConfig();
  }

  /**
   * Creates Micrometer-based backend when enabled.
   *
   * <p><strong>Activation:</strong>
   *
   * <ul>
   *   <li>{@code MeterRegistry} bean exists
   *   <li>{@code management.metrics.http-server.enabled=true} (default)
   *   <li>No user-defined {@code MetricsBackend} bean exists
   * </ul>
   *
   * @param registry Micrometer meter registry (injected by Spring Boot Actuator)
   * @param properties metrics configuration properties
   * @param config core configuration (logged on activation)
   * @return Micrometer backend
   */
  @Bean
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnProperty(
      prefix = HttpMetricsProperties.PREFIX,
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  @ConditionalOnMissingBean(MetricsBackend.class)
  public MetricsBackend micrometerHttpMetricsBackend(
      final MeterRegistry registry,
      final HttpMetricsProperties properties,
      final HttpMetricsConfig config) {

    log.info(
        "Activating HTTP server metrics (Micrometer) - {}, maxCacheSize: {}",
        config,
        properties.getMaxCacheSize());

    return new MicrometerMetricsBackend(registry, properties.getMaxCacheSize());
  }

  /**
   * Creates no-op backend when disabled or when no {@code MeterRegistry} exists.
   *
   * @return no-op backend (zero overhead)
   */
  @Bean
  @ConditionalOnMissingBean(MetricsBackend.class)
  public MetricsBackend noOpHttpMetricsBackend() {
    log.debug("HTTP server metrics disabled - using NOOP backend");
    return MetricsBackend.NOOP;
  }

  /**
   * Creates the request interceptor.
   *
   * @param config core configuration
   * @param backend metrics backend
   * @return interceptor shared by all requests
   */
  @Bean
  @ConditionalOnMissingBean(HttpMetricsInterceptor.class)
  public HttpMetricsInterceptor httpMetricsInterceptor(
      final HttpMetricsConfig config, final MetricsBackend backend) {
    return new HttpMetricsInterceptor(config, backend);
  }
}
