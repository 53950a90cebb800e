package org.example.storyprep.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class ApiSecretMvcConfig implements WebMvcConfigurer {

    private final ApiSecretInterceptor apiSecretInterceptor;

    public ApiSecretMvcConfig(ApiSecretInterceptor apiSecretInterceptor) {
        this.apiSecretInterceptor = apiSecretInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(apiSecretInterceptor)
                .addPathPatterns("/api/**");
    }
}
