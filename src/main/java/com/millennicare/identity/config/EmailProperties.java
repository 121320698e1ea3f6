package com.millennicare.identity.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "app.mail")
public record EmailProperties(
        @DefaultValue("Millennicare <no-reply@millennicare.com>") String from
) {}
