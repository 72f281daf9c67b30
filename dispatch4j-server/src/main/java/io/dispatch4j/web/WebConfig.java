package io.dispatch4j.web;

import io.dispatch4j.config.DispatchProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration(proxyBeanMethods = false)
public class WebConfig implements WebMvcConfigurer {

    private final DispatchProperties props;

    public WebConfig(DispatchProperties props) {
        this.props = props;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        String secret = props.getSecret();
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("dispatch.secret must be set");
        }
        registry.addInterceptor(new SecretHeaderInterceptor(secret.trim()))
                .addPathPatterns("/insert", "/delete", "/cron");
    }
}
