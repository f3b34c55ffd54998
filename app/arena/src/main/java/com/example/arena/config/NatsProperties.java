package com.example.arena.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "nats")
public record NatsProperties(boolean enabled, String url, Integer connectionTimeout) {}
