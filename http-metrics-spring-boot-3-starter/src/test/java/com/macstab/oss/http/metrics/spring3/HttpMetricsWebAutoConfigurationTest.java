/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.http.metrics.spring3;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.test.context.runner.WebApplicationContextRunner;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

import com.macstab.oss.http.metrics.autoconfigure.HttpMetricsAutoConfiguration;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Tests for {@link HttpMetricsWebAutoConfiguration}.
 *
 * <p><strong>Test Strategy:</strong>
 *
 * <ul>
 *   <li>Use {@link WebApplicationContextRunner} for servlet web application contexts
 *   <li>Test filter registration, ordering and back-off
 *   <li>Test that non-web contexts get no filter
 * </ul>
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@DisplayName("HttpMetricsWebAutoConfiguration")
class HttpMetricsWebAutoConfigurationTest {

  private static final AutoConfigurations CONFIGURATIONS =
      AutoConfigurations.of(
          HttpMetricsAutoConfiguration.class, HttpMetricsWebAutoConfiguration.class);

  private final WebApplicationContextRunner contextRunner =
      new WebApplicationContextRunner()
          .withConfiguration(CONFIGURATIONS)
          .withUserConfiguration(MeterRegistryConfiguration.class);

  @Test
  @DisplayName("Should register metrics filter in servlet web application")
  @SuppressWarnings("unchecked")
  void shouldRegisterFilter() {
    // Arrange & Act
    contextRunner.run(
        context -> {
          // Assert
          assertThat(context).hasBean("httpMetricsFilterRegistration");
          final FilterRegistrationBean<HttpMetricsFilter> registration =
              context.getBean("httpMetricsFilterRegistration", FilterRegistrationBean.class);
          assertThat(registration.getFilter()).isInstanceOf(HttpMetricsFilter.class);
          assertThat(registration.getOrder()).isEqualTo(Ordered.HIGHEST_PRECEDENCE + 1);
          assertThat(registration.getUrlPatterns()).containsExactly("/*");
        });
  }

  @Test
  @DisplayName("Should apply configured filter order")
  void shouldApplyFilterOrder() {
    // Arrange & Act
    contextRunner
        .withPropertyValues("management.metrics.http-server.filter-order=42")
        .run(
            context -> {
              // Assert
              assertThat(
                      context
                          .getBean("httpMetricsFilterRegistration", FilterRegistrationBean.class)
                          .getOrder())
                  .isEqualTo(42);
            });
  }

  @Test
  @DisplayName("Should not register filter when disabled")
  void shouldNotRegisterFilterWhenDisabled() {
    // Arrange & Act
    contextRunner
        .withPropertyValues("management.metrics.http-server.enabled=false")
        .run(
            context -> {
              // Assert
              assertThat(context).doesNotHaveBean("httpMetricsFilterRegistration");
            });
  }

  @Test
  @DisplayName("Should not register filter outside web applications")
  void shouldNotRegisterFilterOutsideWebApplication() {
    // Arrange & Act
    new ApplicationContextRunner()
        .withConfiguration(CONFIGURATIONS)
        .withUserConfiguration(MeterRegistryConfiguration.class)
        .run(
            context -> {
              // Assert
              assertThat(context).doesNotHaveBean("httpMetricsFilterRegistration");
              assertThat(context).hasBean("httpMetricsInterceptor");
            });
  }

  @Test
  @DisplayName("Should back off when user registers own filter registration")
  void shouldBackOffForUserRegistration() {
    // Arrange & Act
    contextRunner
        .withUserConfiguration(CustomRegistrationConfiguration.class)
        .run(
            context -> {
              // Assert
              assertThat(context.getBean("httpMetricsFilterRegistration"))
                  .isSameAs(CustomRegistrationConfiguration.CUSTOM);
            });
  }

  /** Provides {@link SimpleMeterRegistry} bean for testing. */
  @Configuration
  static class MeterRegistryConfiguration {
    @Bean
    SimpleMeterRegistry meterRegistry() {
      return new SimpleMeterRegistry();
    }
  }

  @Configuration
  static class CustomRegistrationConfiguration {
    static final FilterRegistrationBean<HttpMetricsFilter> CUSTOM = new FilterRegistrationBean<>();

    @Bean
    FilterRegistrationBean<HttpMetricsFilter> httpMetricsFilterRegistration() {
      return CUSTOM;
    }
  }
}
