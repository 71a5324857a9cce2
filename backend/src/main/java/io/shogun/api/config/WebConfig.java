package io.shogun.api.config;

import io.shogun.api.audit.AuditLoggingInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

  private final AuditLoggingInterceptor auditLoggingInterceptor;

  public WebConfig(AuditLoggingInterceptor auditLoggingInterceptor) {
    this.auditLoggingInterceptor = auditLoggingInterceptor;
  }

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    // Operator endpoints under /api/audit-logs are not themselves audited.
    registry.addInterceptor(auditLoggingInterceptor).excludePathPatterns("/api/audit-logs/**");
  }
}
