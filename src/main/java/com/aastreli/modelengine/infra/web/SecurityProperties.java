package com.aastreli.modelengine.infra.web;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "security")
public class SecurityProperties {

    static final String DEV_KEY = "dev_key";

    private String internalApiKey = "";

    public boolean isEnforced() {
        return internalApiKey != null && !internalApiKey.isBlank() && !DEV_KEY.equals(internalApiKey);
    }
}
