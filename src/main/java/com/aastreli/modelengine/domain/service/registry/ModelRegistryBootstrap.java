package com.aastreli.modelengine.domain.service.registry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ModelRegistryBootstrap {

    private final ModelRegistry modelRegistry;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        try {
            modelRegistry.loadDefault();
        } catch (RuntimeException e) {
            log.error("[Registry] 기본 모델 로드 실패, 예측 요청은 503 응답: {}", e.getMessage());
        }
        modelRegistry.refreshDefaults();
    }
}
