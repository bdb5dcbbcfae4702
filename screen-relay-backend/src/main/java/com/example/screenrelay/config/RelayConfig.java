package com.example.screenrelay.config;

import com.example.screenrelay.signal.SignalEnvelopeCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.time.Clock;

@Configuration
public class RelayConfig implements WebMvcConfigurer {

    @Value("${relay.allowed-origins:http://localhost:3000}")
    private String[] allowedOrigins;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SignalEnvelopeCodec signalEnvelopeCodec(ObjectMapper objectMapper) {
        return new SignalEnvelopeCodec(objectMapper);
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOriginPatterns(allowedOrigins)
                .allowedMethods("GET", "POST")
                .allowCredentials(true);
    }
}
