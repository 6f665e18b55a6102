package com.scholary.ade.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the ADE parse client.
 *
 * <p>These map to the "ade.*" keys in application.yml. {@code baseUrl}, when set, overrides the
 * URL derived from {@code region}.
 */
@ConfigurationProperties(prefix = "ade")
@Validated
public record AdeClientProperties(
    @NotBlank String apiKey,
    @DefaultValue("us") String region,
    String baseUrl,
    @NotNull @DefaultValue("300s") Duration timeout,
    @NotNull @DefaultValue("30s") Duration connectTimeout) {}
