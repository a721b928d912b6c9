package com.aastreli.modelengine.domain.service.registry;

import com.aastreli.modelengine.domain.exception.ArtifactNotFoundException;
import com.aastreli.modelengine.domain.exception.ModelNotLoadedException;
import com.aastreli.modelengine.domain.exception.ModelVersionNotFoundException;
import com.aastreli.modelengine.domain.model.ModelDeployment;
import com.aastreli.modelengine.domain.model.ModelVersion;
import com.aastreli.modelengine.domain.repository.ModelDeploymentRepository;
import com.aastreli.modelengine.domain.repository.ModelVersionRepository;
import com.aastreli.modelengine.infra.artifact.ArtifactStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Serves predictions from the version a request resolves to: an explicit version id, then the
 * tenant's production version, then the filesystem model under {@code current-model-dir}.
 * Loaded versions are kept in a bounded cache evicted in least-recently-used order.
 */
@Slf4j
@Service
public class ModelRegistry {

    private final ModelRegistryProperties properties;
    private final ArtifactStore artifactStore;
    private final ModelHandleLoader loader;
    private final ModelDeploymentRepository deploymentRepository;
    private final ModelVersionRepository versionRepository;
    private final DeploymentService deploymentService;

    private final Counter explicitPredictions;
    private final Counter tenantPredictions;
    private final Counter fallbackPredictions;
    private final Counter cacheLoads;
    private final Counter cacheEvictions;

    private final LinkedHashMap<UUID, LoadedModel> cache = new LinkedHashMap<>(16, 0.75f, true);
    private final Object snapshotMonitor = new Object();
    private final Object fallbackMonitor = new Object();

    private volatile RegistrySnapshot snapshot = RegistrySnapshot.EMPTY;
    private volatile LoadedModel fallback;

    /** Guarded by snapshotMonitor. */
    private long deployEpoch;
    /** Production deploys a refresh in flight may not have read yet. Guarded by snapshotMonitor. */
    private final List<PendingDeploy> pendingDeploys = new ArrayList<>();

    private record PendingDeploy(long epoch, DeploymentResult result) {
    }

    public ModelRegistry(ModelRegistryProperties properties,
                         ArtifactStore artifactStore,
                         ModelHandleLoader loader,
                         ModelDeploymentRepository deploymentRepository,
                         ModelVersionRepository versionRepository,
                         DeploymentService deploymentService,
                         MeterRegistry meterRegistry) {
        this.properties = properties;
        this.artifactStore = artifactStore;
        this.loader = loader;
        this.deploymentRepository = deploymentRepository;
        this.versionRepository = versionRepository;
        this.deploymentService = deploymentService;

        this.explicitPredictions = predictionCounter(meterRegistry, "explicit");
        this.tenantPredictions = predictionCounter(meterRegistry, "tenant");
        this.fallbackPredictions = predictionCounter(meterRegistry, "fallback");
        this.cacheLoads = Counter.builder("model.cache.loads")
                .description("Model versions loaded into the cache")
                .register(meterRegistry);
        this.cacheEvictions = Counter.builder("model.cache.evictions")
                .description("Model versions evicted from the cache")
                .register(meterRegistry);
    }

    private static Counter predictionCounter(MeterRegistry meterRegistry, String resolution) {
        return Counter.builder("model.predictions")
                .tag("resolution", resolution)
                .description("Predictions served, by how the model version was resolved")
                .register(meterRegistry);
    }

    public PredictionResult predict(double[] features, int topK, String explicitVersionId, UUID tenantId) {
        UUID explicitId = parseUuid(explicitVersionId);
        if (explicitId != null) {
            Optional<LoadedModel> loaded = resolve(explicitId);
            if (loaded.isPresent()) {
                explicitPredictions.increment();
                return predictWith(loaded.get(), features, topK);
            }
            log.warn("[Registry] 지정 버전 사용 불가, 대체 모델로 전환: versionId={}, tenant={}", explicitId, tenantId);
        } else if (explicitVersionId != null && !explicitVersionId.isBlank()) {
            log.warn("[Registry] 잘못된 버전 ID 무시: versionId='{}'", explicitVersionId);
        }

        UUID tenantDefault = snapshot.defaultFor(tenantId);
        if (tenantDefault != null) {
            Optional<LoadedModel> loaded = resolve(tenantDefault);
            if (loaded.isPresent()) {
                tenantPredictions.increment();
                return predictWith(loaded.get(), features, topK);
            }
            log.warn("[Registry] 테넌트 기본 버전 로드 실패, 대체 모델 사용: tenant={}, versionId={}",
                    tenantId, tenantDefault);
        }

        LoadedModel current = fallback;
        if (current == null) {
            throw new ModelNotLoadedException();
        }
        fallbackPredictions.increment();
        return predictWith(current, features, topK);
    }

    private PredictionResult predictWith(LoadedModel loaded, double[] features, int topK) {
        PredictionResult raw = loaded.handle().predict(features, topK);
        return new PredictionResult(raw.label(), raw.confidence(), raw.topPredictions(),
                loaded.versionId(), loaded.versionLabel());
    }

    /**
     * Cache hit promotes the entry; a miss loads the version from its artifact location.
     * Loading happens outside the cache lock.
     */
    Optional<LoadedModel> resolve(UUID versionId) {
        synchronized (cache) {
            LoadedModel hit = cache.get(versionId);
            if (hit != null) {
                return Optional.of(hit);
            }
        }

        String location = snapshot.pathOf(versionId);
        if (location == null) {
            location = versionRepository.findArtifactPath(versionId).orElse(null);
        }
        if (location == null) {
            log.warn("[Registry] 아티팩트 경로 없음: versionId={}", versionId);
            return Optional.empty();
        }

        LoadedModel loaded;
        try {
            ModelHandle handle = loader.load(artifactStore.open(resolveLocation(location)));
            loaded = new LoadedModel(handle, versionId, handle.version());
        } catch (RuntimeException e) {
            log.warn("[Registry] 모델 버전 로드 실패: versionId={}, path={}, error={}",
                    versionId, location, e.getMessage());
            return Optional.empty();
        }
        return Optional.of(put(loaded));
    }

    private LoadedModel put(LoadedModel loaded) {
        synchronized (cache) {
            LoadedModel existing = cache.get(loaded.versionId());
            if (existing != null) {
                return existing;
            }
            if (cache.size() >= Math.max(1, properties.getMaxLoadedModels())) {
                Iterator<Map.Entry<UUID, LoadedModel>> eldest = cache.entrySet().iterator();
                Map.Entry<UUID, LoadedModel> evicted = eldest.next();
                eldest.remove();
                cacheEvictions.increment();
                log.info("[Registry] 캐시에서 모델 제거: versionId={}, label={}",
                        evicted.getKey(), evicted.getValue().versionLabel());
            }
            cache.put(loaded.versionId(), loaded);
            cacheLoads.increment();
            log.info("[Registry] 모델 버전 로드 완료: versionId={}, label={}, cached={}",
                    loaded.versionId(), loaded.versionLabel(), cache.size());
            return loaded;
        }
    }

    private String resolveLocation(String location) {
        Path path = Path.of(location);
        return path.isAbsolute() ? location : Path.of(properties.getModelDir()).resolve(path).toString();
    }

    @Scheduled(fixedDelayString = "${model.registry.refresh-interval-seconds:60}",
            initialDelayString = "${model.registry.refresh-interval-seconds:60}",
            timeUnit = TimeUnit.SECONDS)
    public void refreshDefaults() {
        long readEpoch;
        synchronized (snapshotMonitor) {
            readEpoch = deployEpoch;
        }
        try {
            List<ModelDeployment> deployments = deploymentRepository.findByProductionTrueAndDeploymentEndIsNull();

            Map<UUID, ModelDeployment> latest = new HashMap<>();
            for (ModelDeployment d : deployments) {
                latest.merge(d.getTenantId(), d,
                        (a, b) -> b.getDeploymentStart().isAfter(a.getDeploymentStart()) ? b : a);
            }

            Map<UUID, UUID> defaults = new HashMap<>();
            latest.forEach((tenant, d) -> defaults.put(tenant, d.getModelVersionId()));

            Set<UUID> versionIds = Set.copyOf(defaults.values());
            Map<UUID, String> paths = versionIds.isEmpty()
                    ? Map.of()
                    : versionRepository.findByIdIn(versionIds).stream()
                    .filter(v -> !v.isDeleted())
                    .collect(Collectors.toMap(ModelVersion::getId, ModelVersion::getArtifactPath));

            RegistrySnapshot next = new RegistrySnapshot(defaults, paths);
            int reapplied = 0;
            synchronized (snapshotMonitor) {
                pendingDeploys.removeIf(p -> p.epoch() <= readEpoch);
                for (PendingDeploy pending : pendingDeploys) {
                    DeploymentResult r = pending.result();
                    next = next.withDefault(r.tenantId(), r.versionId(), r.artifactPath());
                    reapplied++;
                }
                snapshot = next;
            }
            log.debug("[Registry] 기본 버전 갱신: tenants={}, deployments={}, reapplied={}",
                    next.tenantDefaults().size(), deployments.size(), reapplied);
        } catch (Exception e) {
            log.error("[Registry] 기본 버전 갱신 실패, 이전 스냅샷 유지", e);
        }
    }

    public DeploymentResult deploy(UUID versionId, boolean production) {
        DeploymentResult result = deploymentService.deploy(versionId, production);
        if (production) {
            synchronized (snapshotMonitor) {
                pendingDeploys.add(new PendingDeploy(++deployEpoch, result));
                snapshot = snapshot.withDefault(result.tenantId(), result.versionId(), result.artifactPath());
            }
            log.info("[Deploy] 프로덕션 전환 즉시 반영: tenant={}, version={}",
                    result.tenantId(), result.versionLabel());
        }
        return result;
    }

    public void loadDefault() {
        synchronized (fallbackMonitor) {
            ModelHandle handle = loader.load(artifactStore.open(properties.getCurrentModelDir()));
            fallback = new LoadedModel(handle, null, handle.version());
            log.info("[Registry] 기본 모델 로드 완료: version={}, classes={}, features={}",
                    handle.version(), handle.getEncoder().size(), handle.numFeatures());
        }
    }

    /**
     * Backs up the current filesystem model under its own label, then copies the named stored
     * version into {@code current-model-dir} and reloads it.
     */
    public String activate(String versionLabel) {
        synchronized (fallbackMonitor) {
            Map<String, Path> source;
            try {
                source = artifactStore.load(versionLabel);
            } catch (ArtifactNotFoundException | IllegalArgumentException e) {
                throw new ModelVersionNotFoundException(versionLabel);
            }

            Path currentDir = Path.of(properties.getCurrentModelDir());
            try {
                Map<String, byte[]> sourceBytes = new LinkedHashMap<>();
                for (Map.Entry<String, Path> e : source.entrySet()) {
                    sourceBytes.put(e.getKey(), Files.readAllBytes(e.getValue()));
                }

                LoadedModel current = fallback;
                if (current != null) {
                    Map<String, Object> backup = new LinkedHashMap<>();
                    for (String name : ModelArtifacts.BUNDLE) {
                        Path file = currentDir.resolve(name);
                        if (Files.isRegularFile(file)) {
                            backup.put(name, Files.readAllBytes(file));
                        }
                    }
                    artifactStore.replace(current.versionLabel(), backup);
                }

                Files.createDirectories(currentDir);
                for (Map.Entry<String, byte[]> e : sourceBytes.entrySet()) {
                    Path tmp = currentDir.resolve(e.getKey() + ".tmp");
                    Files.write(tmp, e.getValue());
                    Files.move(tmp, currentDir.resolve(e.getKey()), StandardCopyOption.REPLACE_EXISTING);
                }
            } catch (IOException e) {
                throw new IllegalStateException("Failed to activate version " + versionLabel, e);
            }

            loadDefault();
            log.info("[Registry] 버전 활성화: version={}", versionLabel);
            return currentVersionLabel();
        }
    }

    public String currentVersionLabel() {
        LoadedModel current = fallback;
        return current != null ? current.versionLabel() : "unknown";
    }

    public List<ModelVersionInfo> listVersions() {
        List<ModelVersionInfo> versions = new ArrayList<>();
        LoadedModel current = fallback;
        if (current != null) {
            Map<String, Object> metadata = new LinkedHashMap<>(current.handle().getMetadata());
            metadata.putIfAbsent("numClasses", current.handle().getEncoder().size());
            versions.add(ModelVersionInfo.fromMetadata(metadata, true));
        }
        for (String name : artifactStore.listVersions()) {
            artifactStore.getMetadata(name)
                    .ifPresent(meta -> versions.add(ModelVersionInfo.fromMetadata(meta, false)));
        }
        return versions;
    }

    public Optional<ModelVersionInfo> versionInfo(String versionLabel) {
        return listVersions().stream()
                .filter(v -> versionLabel.equals(v.version()))
                .findFirst();
    }

    public Map<String, Object> metrics() {
        LoadedModel current = fallback;
        Map<String, Object> result = new LinkedHashMap<>();
        if (current == null) {
            result.put("version", null);
            result.put("numClasses", 0);
            result.put("metrics", Map.of());
            result.put("trainingSamples", null);
            result.put("feedbackSamples", 0);
            return result;
        }
        Map<String, Object> metadata = current.handle().getMetadata();
        result.put("version", current.versionLabel());
        result.put("numClasses", current.handle().getEncoder().size());
        result.put("metrics", metadata.getOrDefault("metrics", Map.of()));
        result.put("trainingSamples", metadata.get("trainingSamples"));
        result.put("feedbackSamples", metadata.getOrDefault("feedbackSamples", 0));
        return result;
    }

    /**
     * The model a retraining run for this tenant starts from.
     */
    public LoadedModel baseModelFor(UUID tenantId) {
        UUID production = snapshot.defaultFor(tenantId);
        if (production != null) {
            Optional<LoadedModel> loaded = resolve(production);
            if (loaded.isPresent()) {
                return loaded.get();
            }
            log.warn("[Registry] 재학습 기준 모델 로드 실패, 대체 모델 사용: tenant={}, versionId={}",
                    tenantId, production);
        }
        LoadedModel current = fallback;
        if (current == null) {
            throw new ModelNotLoadedException();
        }
        return current;
    }

    public boolean isReady() {
        return fallback != null;
    }

    public int loadedCount() {
        synchronized (cache) {
            return cache.size();
        }
    }

    public boolean isCached(UUID versionId) {
        synchronized (cache) {
            return cache.containsKey(versionId);
        }
    }

    public RegistrySnapshot snapshot() {
        return snapshot;
    }

    private static UUID parseUuid(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return UUID.fromString(value.trim());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
