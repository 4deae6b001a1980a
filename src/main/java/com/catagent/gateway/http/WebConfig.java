package com.catagent.gateway.http;

import com.catagent.security.WriteRateLimiter;
import com.catagent.shared.config.CatAgentConfig;
import org.springframework.boot.web.server.ConfigurableWebServerFactory;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final WriteRateLimiter rateLimiter;

    public WebConfig(WriteRateLimiter rateLimiter) {
        this.rateLimiter = rateLimiter;
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(new CurrentUserArgumentResolver());
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new WriteRateLimitInterceptor(rateLimiter)).addPathPatterns("/api/cat/**");
    }

    @Bean
    public WebServerFactoryCustomizer<ConfigurableWebServerFactory> serverPort(CatAgentConfig config) {
        return factory -> factory.setPort(config.serverPort());
    }
}
