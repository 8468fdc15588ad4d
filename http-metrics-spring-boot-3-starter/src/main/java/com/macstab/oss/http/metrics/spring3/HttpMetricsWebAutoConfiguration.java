/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.http.metrics.spring3;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.web.servlet.DispatcherServlet;
import org.springframework.web.servlet.mvc.method.RequestMappingInfoHandlerMapping;

import com.macstab.oss.http.metrics.HttpMetricsInterceptor;
import com.macstab.oss.http.metrics.autoconfigure.HttpMetricsAutoConfiguration;
import com.macstab.oss.http.metrics.autoconfigure.HttpMetricsProperties;

import jakarta.servlet.DispatcherType;
import lombok.extern.slf4j.Slf4j;

/**
 * Registers {@link HttpMetricsFilter} in Spring Boot 3 servlet applications.
 *
 * <p>Activated for servlet web applications with Spring MVC on the classpath, once {@link
 * HttpMetricsAutoConfiguration} has provided an {@link HttpMetricsInterceptor}. Disabled by {@code
 * management.metrics.http-server.enabled=false}.
 *
 * <p><strong>Configuration example:</strong>
 *
 * <pre>{@code
 * management:
 *   metrics:
 *     http-server:
 *       namespace: shop
 *       exclude: /actuator/health
 *       filter-order: -2147483647
 * }</pre>
 *
 * <p>The filter is registered for {@link DispatcherType#REQUEST} only; error and async dispatches
 * belong to the request that started them.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 * @see HttpMetricsFilter
 */
@Slf4j
@AutoConfiguration(after = HttpMetricsAutoConfiguration.class)
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@ConditionalOnClass({DispatcherServlet.class, FilterRegistrationBean.class})
@ConditionalOnBean(HttpMetricsInterceptor.class)
@ConditionalOnProperty(
    prefix = HttpMetricsProperties.PREFIX,
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
@EnableConfigurationProperties(HttpMetricsProperties.class)
public class HttpMetricsWebAutoConfiguration {

  /**
   * Registers the metrics filter for all URLs.
   *
   * @param interceptor interceptor shared by all requests
   * @param properties metrics configuration properties (filter order)
   * @param handlerMappings request mappings used to label {@code 405} responses
   * @return filter registration
   */
  @Bean
  @ConditionalOnMissingBean(name = "httpMetricsFilterRegistration")
  public FilterRegistrationBean<HttpMetricsFilter> httpMetricsFilterRegistration(
      final HttpMetricsInterceptor interceptor,
      final HttpMetricsProperties properties,
      final ObjectProvider<RequestMappingInfoHandlerMapping> handlerMappings) {
    final var registration =
        new FilterRegistrationBean<>(new HttpMetricsFilter(interceptor, handlerMappings));
    registration.setName("httpMetricsFilter");
    registration.setOrder(properties.getFilterOrder());
    registration.setDispatcherTypes(DispatcherType.REQUEST);
    registration.addUrlPatterns("/*");

    log.info("Registered HTTP server metrics filter (order {})", properties.getFilterOrder());
    return registration;
  }
}
