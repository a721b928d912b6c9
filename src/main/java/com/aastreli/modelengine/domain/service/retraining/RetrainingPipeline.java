package com.aastreli.modelengine.domain.service.retraining;

import com.aastreli.modelengine.domain.classifier.Classifier;
import com.aastreli.modelengine.domain.classifier.ClassifierTrainer;
import com.aastreli.modelengine.domain.classifier.FeatureScaler;
import com.aastreli.modelengine.domain.classifier.LabelEncoder;
import com.aastreli.modelengine.domain.classifier.TrainingDataset;
import com.aastreli.modelengine.domain.model.ModelStage;
import com.aastreli.modelengine.domain.model.ModelVersion;
import com.aastreli.modelengine.domain.repository.ModelVersionRepository;
import com.aastreli.modelengine.domain.service.TenantModelResolver;
import com.aastreli.modelengine.domain.service.feedback.FeedbackDataset;
import com.aastreli.modelengine.domain.service.feedback.FeedbackService;
import com.aastreli.modelengine.domain.service.registry.LoadedModel;
import com.aastreli.modelengine.domain.service.registry.ModelArtifacts;
import com.aastreli.modelengine.domain.service.registry.ModelHandleLoader;
import com.aastreli.modelengine.domain.service.registry.ModelRegistry;
import com.aastreli.modelengine.infra.artifact.ArtifactStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;

/**
 * Retrains a tenant's fault classifier on accumulated feedback merged with the base model's
 * historical data. New versions are written with stage {@code staging}; promotion is a separate
 * deploy. At most one run per (tenant, model) is in flight; a second caller is turned away.
 */
@Slf4j
@Service
public class RetrainingPipeline {

    private final RetrainingProperties properties;
    private final FeedbackService feedbackService;
    private final ModelRegistry modelRegistry;
    private final ModelHandleLoader loader;
    private final ClassifierTrainer trainer;
    private final ArtifactStore artifactStore;
    private final ModelVersionRepository versionRepository;
    private final TenantModelResolver tenantModelResolver;
    private final ThreadPoolTaskExecutor retrainExecutor;
    private final MeterRegistry meterRegistry;
    private final Timer retrainTimer;

    private final ConcurrentHashMap<String, Semaphore> permits = new ConcurrentHashMap<>();

    public RetrainingPipeline(RetrainingProperties properties,
                              FeedbackService feedbackService,
                              ModelRegistry modelRegistry,
                              ModelHandleLoader loader,
                              ClassifierTrainer trainer,
                              ArtifactStore artifactStore,
                              ModelVersionRepository versionRepository,
                              TenantModelResolver tenantModelResolver,
                              @Qualifier("retrainExecutor") ThreadPoolTaskExecutor retrainExecutor,
                              MeterRegistry meterRegistry) {
        this.properties = properties;
        this.feedbackService = feedbackService;
        this.modelRegistry = modelRegistry;
        this.loader = loader;
        this.trainer = trainer;
        this.artifactStore = artifactStore;
        this.versionRepository = versionRepository;
        this.tenantModelResolver = tenantModelResolver;
        this.retrainExecutor = retrainExecutor;
        this.meterRegistry = meterRegistry;
        this.retrainTimer = Timer.builder("model.retrain.duration")
                .description("Wall time of retraining runs that reached training")
                .register(meterRegistry);
    }

    public RetrainResult retrain(UUID tenantId, UUID modelId, List<UUID> feedbackIds) {
        long feedbackCount = feedbackService.count(tenantId);
        if (feedbackCount < properties.getMinFeedback()) {
            return record(insufficient(feedbackCount));
        }

        RetrainTarget target = resolveTarget(tenantId, modelId);
        Semaphore permit = permits.computeIfAbsent(target.permitKey(), k -> new Semaphore(1));
        if (!permit.tryAcquire()) {
            log.info("[Retrain] 이미 재학습 진행 중: tenant={}, model={}", tenantId, modelId);
            return record(RetrainResult.failure(RetrainStatus.ALREADY_RUNNING,
                    "Retraining already in progress for this tenant/model", feedbackCount));
        }
        try {
            Timer.Sample sample = Timer.start(meterRegistry);
            RetrainResult result = run(tenantId, modelId, target, feedbackIds, feedbackCount);
            sample.stop(retrainTimer);
            return record(result);
        } finally {
            permit.release();
        }
    }

    /**
     * Checks the feedback threshold, then queues the run on the retraining executor.
     */
    public RetrainResult retrainAsync(UUID tenantId, UUID modelId, List<UUID> feedbackIds) {
        long feedbackCount = feedbackService.count(tenantId);
        if (feedbackCount < properties.getMinFeedback()) {
            return record(insufficient(feedbackCount));
        }
        try {
            retrainExecutor.execute(() -> {
                try {
                    RetrainResult result = retrain(tenantId, modelId, feedbackIds);
                    log.info("[Retrain] 백그라운드 재학습 종료: status={}, version={}",
                            result.status().getCode(), result.newVersionLabel());
                } catch (RuntimeException e) {
                    log.error("[Retrain] 백그라운드 재학습 예외: tenant={}, model={}", tenantId, modelId, e);
                }
            });
        } catch (TaskRejectedException e) {
            log.warn("[Retrain] 재학습 대기열 초과: tenant={}, model={}", tenantId, modelId);
            return record(RetrainResult.failure(RetrainStatus.REJECTED,
                    "Retraining queue is full, try again later", feedbackCount));
        }
        log.info("[Retrain] 백그라운드 재학습 등록: tenant={}, model={}", tenantId, modelId);
        return RetrainResult.started(feedbackCount);
    }

    public boolean isRunning(UUID tenantId, UUID modelId) {
        Semaphore permit = permits.get(resolveTarget(tenantId, modelId).permitKey());
        return permit != null && permit.availablePermits() == 0;
    }

    private RetrainResult run(UUID tenantId, UUID modelId, RetrainTarget target, List<UUID> feedbackIds,
                              long feedbackCount) {
        try {
            FeedbackDataset feedback = feedbackService.loadForRetraining(tenantId, feedbackIds);
            if (feedback.count() == 0) {
                return RetrainResult.failure(RetrainStatus.NO_FEEDBACK, "No feedback data available", feedbackCount);
            }

            LoadedModel base = modelRegistry.baseModelFor(tenantId);
            int dimension = base.handle().numFeatures();
            TrainingDataset feedbackData = keepDimension(feedback.toTrainingDataset(), dimension, "feedback");
            if (feedbackData.isEmpty()) {
                return RetrainResult.failure(RetrainStatus.NO_FEEDBACK, "No feedback data available", feedbackCount);
            }
            log.info("[Retrain] 재학습 시작: tenant={}, model={}, feedback={}, base={}",
                    tenantId, modelId, feedbackData.size(), base.versionLabel());

            LabelEncoder baseEncoder = base.handle().getEncoder();
            LabelEncoder encoder = baseEncoder.extend(feedbackData.labels());
            if (encoder != baseEncoder) {
                Set<String> added = new TreeSet<>(encoder.classes());
                added.removeAll(baseEncoder.classes());
                log.info("[Retrain] 신규 고장 유형 감지: {}", added);
            }

            TrainingDataset historical = loadHistorical(base, encoder, dimension);
            TrainingDataset merged = historical.isEmpty()
                    ? feedbackData
                    : concat(historical, feedbackData, 1);
            TrainingDataset weighted = historical.isEmpty()
                    ? feedbackData
                    : concat(historical, feedbackData, Math.max(1, properties.getFeedbackWeightMultiplier()));
            if (!historical.isEmpty()) {
                log.info("[Retrain] 데이터 병합: original={}, feedback={}, multiplier={}",
                        historical.size(), weighted.size() - historical.size(),
                        Math.max(1, properties.getFeedbackWeightMultiplier()));
            }

            int[] y = new int[weighted.size()];
            for (int i = 0; i < y.length; i++) {
                y[i] = encoder.encode(weighted.labels().get(i));
            }

            DatasetSplitter.Split split = DatasetSplitter.split(weighted.features(), y, encoder.size(),
                    properties.getValidationFraction(), properties.getRandomSeed());

            FeatureScaler scaler = FeatureScaler.fit(split.trainX());
            double[][] trainX = scaler.transform(split.trainX());
            double[][] validationX = scaler.transform(split.validationX());
            double[] weights = ClassWeights.balanced(split.trainY(), encoder.size());

            Instant trainingStart = Instant.now();
            Classifier classifier = trainer.train(trainX, split.trainY(), weights, encoder.size());
            Instant trainingEnd = Instant.now();

            boolean holdout = validationX.length > 0;
            if (!holdout) {
                log.warn("[Retrain] 검증 데이터 없음, 학습 데이터로 평가: samples={}", trainX.length);
            }
            double[][] evalX = holdout ? validationX : trainX;
            int[] evalY = holdout ? split.validationY() : split.trainY();
            int[] predicted = new int[evalX.length];
            for (int i = 0; i < evalX.length; i++) {
                predicted[i] = argmax(classifier.predictProba(evalX[i]));
            }
            int normalClass = encoder.contains(properties.getNormalLabel())
                    ? encoder.encode(properties.getNormalLabel()) : -1;
            Map<String, Double> metrics = ClassificationMetrics.evaluate(evalY, predicted, encoder.size(), normalClass);

            return persist(tenantId, modelId, target, base, classifier, encoder, scaler, merged, metrics,
                    split.trainY().length, feedbackData.size(), feedbackCount, trainingStart, trainingEnd);
        } catch (Exception e) {
            log.error("[Retrain] 재학습 실패: tenant={}, model={}", tenantId, modelId, e);
            return RetrainResult.failure(RetrainStatus.FAILED, "Retraining failed: " + e.getMessage(), feedbackCount);
        }
    }

    private RetrainResult persist(UUID tenantId, UUID modelId, RetrainTarget target, LoadedModel base,
                                  Classifier classifier, LabelEncoder encoder, FeatureScaler scaler, TrainingDataset merged,
                                  Map<String, Double> metrics, int trainingSamples, int feedbackSamples,
                                  long feedbackCount, Instant trainingStart, Instant trainingEnd) {
        Optional<UUID> resolvedTenant = Optional.ofNullable(target.tenantId());
        Optional<UUID> resolvedModel = Optional.ofNullable(target.modelId());

        int versionNumber;
        if (resolvedTenant.isPresent() && resolvedModel.isPresent()) {
            versionNumber = (int) versionRepository.countByTenantIdAndModelId(resolvedTenant.get(), resolvedModel.get()) + 1;
        } else {
            versionNumber = artifactStore.listVersions().size() + 1;
        }
        String versionKey = tenantId != null && resolvedModel.isPresent()
                ? tenantId + "_" + resolvedModel.get() + "_v" + versionNumber
                : "v" + versionNumber;
        String semanticVersion = "1.0." + versionNumber;
        String fullLabel = tenantModelResolver.modelName(resolvedModel.orElse(null)) + ":" + semanticVersion;

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("version", versionKey);
        metadata.put("semanticVersion", semanticVersion);
        metadata.put("fullVersionLabel", fullLabel);
        metadata.put("createdAt", Instant.now().toString());
        metadata.put("numClasses", encoder.size());
        metadata.put("classes", encoder.classes());
        metadata.put("metrics", metrics);
        metadata.put("trainingSamples", trainingSamples);
        metadata.put("feedbackSamples", feedbackSamples);
        metadata.put("baseVersion", base.versionLabel());
        metadata.put("tenantId", resolvedTenant.map(UUID::toString).orElse(null));
        metadata.put("modelId", resolvedModel.map(UUID::toString).orElse(null));

        Map<String, Object> artifacts = new LinkedHashMap<>();
        artifacts.put(ModelArtifacts.CLASSIFIER, classifier);
        artifacts.put(ModelArtifacts.LABEL_ENCODER, encoder);
        artifacts.put(ModelArtifacts.FEATURE_SCALER, scaler);
        artifacts.put(ModelArtifacts.METADATA, metadata);
        artifacts.put(ModelArtifacts.TRAINING_DATA, merged);
        String location = artifactStore.save(versionKey, artifacts);

        UUID versionId = null;
        if (resolvedTenant.isPresent() && resolvedModel.isPresent()) {
            ModelVersion saved = versionRepository.save(ModelVersion.builder()
                    .tenantId(resolvedTenant.get())
                    .modelId(resolvedModel.get())
                    .semanticVersion(semanticVersion)
                    .fullVersionLabel(fullLabel)
                    .stage(ModelStage.STAGING)
                    .artifactPath(location)
                    .trainingStart(trainingStart)
                    .trainingEnd(trainingEnd)
                    .accuracy(metrics.get(ClassificationMetrics.ACCURACY))
                    .precisionScore(metrics.get(ClassificationMetrics.PRECISION))
                    .recallScore(metrics.get(ClassificationMetrics.RECALL))
                    .f1Score(metrics.get(ClassificationMetrics.F1))
                    .falseAlarmRate(metrics.get(ClassificationMetrics.FALSE_ALARM_RATE))
                    .build());
            versionId = saved.getId();
            log.info("[Retrain] 버전 기록 생성: label={}, stage=staging, id={}", fullLabel, versionId);
        } else {
            log.warn("[Retrain] 테넌트/모델 확인 불가, 버전 기록 생략: tenant={}, model={}", tenantId, modelId);
        }

        log.info("[Retrain] 재학습 완료: version={}, acc={}, balAcc={}, f1={}",
                versionKey,
                String.format("%.4f", metrics.get(ClassificationMetrics.ACCURACY)),
                String.format("%.4f", metrics.get(ClassificationMetrics.BALANCED_ACCURACY)),
                String.format("%.4f", metrics.get(ClassificationMetrics.F1)));

        return new RetrainResult(true, RetrainStatus.COMPLETED, "Model retrained successfully",
                versionKey, versionId, metrics, feedbackCount);
    }

    private TrainingDataset loadHistorical(LoadedModel base, LabelEncoder encoder, int dimension) {
        if (!properties.isIncludeOriginalData()) {
            return new TrainingDataset(new double[0][], List.of());
        }
        Optional<TrainingDataset> loaded = loader.loadTrainingData(base.handle().getFiles());
        if (loaded.isEmpty()) {
            log.warn("[Retrain] 원본 학습 데이터 없음, 피드백만으로 학습: base={}", base.versionLabel());
            return new TrainingDataset(new double[0][], List.of());
        }
        TrainingDataset data = keepDimension(loaded.get(), dimension, "original");
        List<double[]> features = new ArrayList<>();
        List<String> labels = new ArrayList<>();
        for (int i = 0; i < data.size(); i++) {
            if (encoder.contains(data.labels().get(i))) {
                features.add(data.features()[i]);
                labels.add(data.labels().get(i));
            }
        }
        log.info("[Retrain] 원본 학습 데이터 로드: samples={}", labels.size());
        return new TrainingDataset(features.toArray(new double[0][]), labels);
    }

    private static TrainingDataset keepDimension(TrainingDataset data, int dimension, String source) {
        List<double[]> features = new ArrayList<>(data.size());
        List<String> labels = new ArrayList<>(data.size());
        for (int i = 0; i < data.size(); i++) {
            if (data.features()[i].length == dimension) {
                features.add(data.features()[i]);
                labels.add(data.labels().get(i));
            }
        }
        if (labels.size() < data.size()) {
            log.warn("[Retrain] 특징 차원 불일치 샘플 제외: source={}, expected={}, dropped={}",
                    source, dimension, data.size() - labels.size());
        }
        return new TrainingDataset(features.toArray(new double[0][]), labels);
    }

    private static TrainingDataset concat(TrainingDataset head, TrainingDataset tail, int tailRepeat) {
        int size = head.size() + tail.size() * tailRepeat;
        double[][] features = new double[size][];
        List<String> labels = new ArrayList<>(size);
        int pos = 0;
        for (int i = 0; i < head.size(); i++) {
            features[pos++] = head.features()[i];
            labels.add(head.labels().get(i));
        }
        for (int r = 0; r < tailRepeat; r++) {
            for (int i = 0; i < tail.size(); i++) {
                features[pos++] = tail.features()[i];
                labels.add(tail.labels().get(i));
            }
        }
        return new TrainingDataset(features, labels);
    }

    private static int argmax(double[] values) {
        int best = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] > values[best]) best = i;
        }
        return best;
    }

    private RetrainResult insufficient(long feedbackCount) {
        return RetrainResult.failure(RetrainStatus.INSUFFICIENT_FEEDBACK,
                "Insufficient feedback. Need " + properties.getMinFeedback() + ", have " + feedbackCount,
                feedbackCount);
    }

    private RetrainResult record(RetrainResult result) {
        Counter.builder("model.retrain.runs")
                .tag("outcome", result.status().getCode())
                .description("Retraining requests by outcome")
                .register(meterRegistry)
                .increment();
        return result;
    }

    /**
     * Requests that omit the tenant or model are keyed by what they resolve to, so they share a
     * permit with requests naming the same pair explicitly.
     */
    private RetrainTarget resolveTarget(UUID tenantId, UUID modelId) {
        UUID tenant = tenantModelResolver.resolveTenant(tenantId).orElse(null);
        UUID model = tenant == null ? null : tenantModelResolver.resolveModel(tenant, modelId).orElse(null);
        return new RetrainTarget(tenant, model);
    }

    private record RetrainTarget(UUID tenantId, UUID modelId) {

        static final String SINGLE_TENANT_KEY = "single-tenant";

        String permitKey() {
            return tenantId != null && modelId != null ? tenantId + ":" + modelId : SINGLE_TENANT_KEY;
        }
    }
}
