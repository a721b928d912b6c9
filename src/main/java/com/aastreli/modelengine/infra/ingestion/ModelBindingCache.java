package com.aastreli.modelengine.infra.ingestion;

import com.aastreli.modelengine.domain.model.ModelBinding;
import com.aastreli.modelengine.domain.repository.AssetModelBindingRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Asset to bound model version, used to route each asset's telemetry to the version it is
 * pinned to. Rebuilt wholesale on every refresh.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModelBindingCache {

    private final AssetModelBindingRepository bindingRepository;

    private volatile Map<UUID, ModelBinding> bindings = Map.of();

    @PostConstruct
    public void init() {
        refresh();
    }

    @Scheduled(fixedDelayString = "${ingestion.binding-cache.refresh-interval-seconds:60}",
            initialDelayString = "${ingestion.binding-cache.refresh-interval-seconds:60}",
            timeUnit = TimeUnit.SECONDS)
    public void refresh() {
        try {
            List<ModelBinding> rows = bindingRepository.findActiveBindings();
            Map<UUID, ModelBinding> next = new HashMap<>(rows.size());
            for (ModelBinding row : rows) {
                next.put(row.assetId(), row);
            }
            bindings = Map.copyOf(next);
            log.debug("[Bindings] 바인딩 캐시 갱신: size={}", next.size());
        } catch (Exception e) {
            log.error("[Bindings] 바인딩 캐시 갱신 실패, 이전 맵 유지", e);
        }
    }

    public Optional<ModelBinding> lookup(UUID assetId) {
        if (assetId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(bindings.get(assetId));
    }

    public int size() {
        return bindings.size();
    }
}
