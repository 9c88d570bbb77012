package org.kioskfleet.config;

import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FilterConfig {

    @Bean
    public FilterRegistrationBean<JwtFilter> jwtFilterRegistration(JwtFilter jwtFilter) {
        FilterRegistrationBean<JwtFilter> registrationBean = new FilterRegistrationBean<>();

        registrationBean.setFilter(jwtFilter);

        // WebSocket endpoints authenticate in their handshake interceptors
        registrationBean.addUrlPatterns("/api/*");
        // Note: /api/health is excluded in JwtFilter

        return registrationBean;
    }
}
