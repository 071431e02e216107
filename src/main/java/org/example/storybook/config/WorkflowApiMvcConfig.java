package org.example.storybook.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WorkflowApiMvcConfig implements WebMvcConfigurer {

    private final WorkflowApiKeyInterceptor workflowApiKeyInterceptor;

    public WorkflowApiMvcConfig(WorkflowApiKeyInterceptor workflowApiKeyInterceptor) {
        this.workflowApiKeyInterceptor = workflowApiKeyInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(workflowApiKeyInterceptor)
                .addPathPatterns("/api/**");
    }
}
