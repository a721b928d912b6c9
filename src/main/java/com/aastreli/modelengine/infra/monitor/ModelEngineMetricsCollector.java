package com.aastreli.modelengine.infra.monitor;

import com.aastreli.modelengine.domain.service.registry.ModelRegistry;
import com.aastreli.modelengine.infra.ingestion.ModelBindingCache;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Slf4j
@Component
@RequiredArgsConstructor
public class ModelEngineMetricsCollector {

    private final ModelRegistry modelRegistry;
    private final ModelBindingCache bindingCache;
    private final MeterRegistry meterRegistry;

    @PostConstruct
    public void init() {
        Gauge.builder("model.cache.loaded", modelRegistry, ModelRegistry::loadedCount)
                .description("Model versions currently held in the cache")
                .register(meterRegistry);

        Gauge.builder("model.registry.tenant_defaults", modelRegistry,
                        r -> r.snapshot().tenantDefaults().size())
                .description("Tenants with a production version in the current snapshot")
                .register(meterRegistry);

        Gauge.builder("model.bindings.size", bindingCache, ModelBindingCache::size)
                .description("Asset to model-version bindings in the ingestion cache")
                .register(meterRegistry);

        log.info("[Metrics] 모델 레지스트리 모니터링 등록 완료");
    }

    @Scheduled(fixedRate = 60_000)
    public void logMetricsSummary() {
        log.debug("[Metrics] cache={} | tenants={} | bindings={} | predictions explicit={} tenant={} fallback={}",
                modelRegistry.loadedCount(),
                modelRegistry.snapshot().tenantDefaults().size(),
                bindingCache.size(),
                count("explicit"),
                count("tenant"),
                count("fallback"));

        Timer retrainTimer = meterRegistry.find("model.retrain.duration").timer();
        if (retrainTimer != null && retrainTimer.count() > 0) {
            log.debug("[Metrics] Retrain avg={}ms cnt={}",
                    String.format("%.0f", retrainTimer.mean(TimeUnit.MILLISECONDS)),
                    retrainTimer.count());
        }
    }

    private long count(String resolution) {
        Counter counter = meterRegistry.find("model.predictions").tag("resolution", resolution).counter();
        return counter != null ? (long) counter.count() : 0L;
    }
}
