package com.aastreli.modelengine.infra.ingestion;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "ingestion")
public class IngestionProperties {

    private BindingCache bindingCache = new BindingCache();

    private MlService mlService = new MlService();

    @Getter
    @Setter
    public static class BindingCache {
        private long refreshIntervalSeconds = 60;
    }

    @Getter
    @Setter
    public static class MlService {
        private String baseUrl = "http://localhost:8000";
        private long timeoutMs = 5000;
        private String apiKey = "";
    }
}
