package com.aastreli.modelengine.domain.service.retraining;

import com.aastreli.modelengine.domain.classifier.ClassifierTrainer;
import com.aastreli.modelengine.domain.classifier.GaussianNaiveBayesTrainer;
import com.aastreli.modelengine.domain.classifier.TrainingDataset;
import com.aastreli.modelengine.domain.model.ModelStage;
import com.aastreli.modelengine.domain.model.ModelVersion;
import com.aastreli.modelengine.domain.repository.ModelVersionRepository;
import com.aastreli.modelengine.domain.service.TenantModelResolver;
import com.aastreli.modelengine.domain.service.feedback.FeedbackDataset;
import com.aastreli.modelengine.domain.service.feedback.FeedbackService;
import com.aastreli.modelengine.domain.service.registry.LoadedModel;
import com.aastreli.modelengine.domain.service.registry.ModelHandle;
import com.aastreli.modelengine.domain.service.registry.ModelHandleLoader;
import com.aastreli.modelengine.domain.service.registry.ModelRegistry;
import com.aastreli.modelengine.infra.artifact.LocalArtifactStore;
import com.aastreli.modelengine.support.ModelFixtures;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RetrainingPipelineTest {

    private static final UUID TENANT = UUID.randomUUID();
    private static final UUID MODEL = UUID.randomUUID();
    private static final double[] GEAR_CENTER = {-5, 5, -5};

    @TempDir
    Path modelDir;

    @Mock
    FeedbackService feedbackService;

    @Mock
    ModelRegistry modelRegistry;

    @Mock
    ModelVersionRepository versionRepository;

    @Mock
    TenantModelResolver tenantModelResolver;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ModelHandleLoader loader = new ModelHandleLoader(objectMapper);
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private RetrainingProperties properties;
    private LocalArtifactStore artifactStore;
    private ThreadPoolTaskExecutor executor;

    @BeforeEach
    void setUp() {
        properties = new RetrainingProperties();
        properties.setMinFeedback(3);
        artifactStore = new LocalArtifactStore(modelDir, objectMapper);

        artifactStore.save("base", ModelFixtures.bundle("base"));
        ModelHandle baseHandle = loader.load(artifactStore.load("base"));
        lenient().when(modelRegistry.baseModelFor(any())).thenReturn(new LoadedModel(baseHandle, null, "base"));

        lenient().when(tenantModelResolver.resolveTenant(TENANT)).thenReturn(Optional.of(TENANT));
        lenient().when(tenantModelResolver.resolveModel(TENANT, MODEL)).thenReturn(Optional.of(MODEL));
        lenient().when(tenantModelResolver.modelName(any())).thenReturn("fault_classifier");
        lenient().when(versionRepository.countByTenantIdAndModelId(TENANT, MODEL)).thenReturn(1L);
        lenient().when(versionRepository.save(any(ModelVersion.class))).thenAnswer(inv -> {
            ModelVersion v = inv.getArgument(0);
            v.setId(UUID.randomUUID());
            return v;
        });

        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(2);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    private RetrainingPipeline pipeline(ClassifierTrainer trainer) {
        return new RetrainingPipeline(properties, feedbackService, modelRegistry, loader, trainer,
                artifactStore, versionRepository, tenantModelResolver, executor, meterRegistry);
    }

    private void feedback(TrainingDataset data) {
        List<UUID> ids = new ArrayList<>();
        for (int i = 0; i < data.size(); i++) {
            ids.add(UUID.randomUUID());
        }
        lenient().when(feedbackService.count(any())).thenReturn((long) data.size());
        lenient().when(feedbackService.loadForRetraining(any(), any()))
                .thenReturn(new FeedbackDataset(data.features(), data.labels(), ids));
    }

    @Test
    void belowThresholdCreatesNothing() {
        when(feedbackService.count(TENANT)).thenReturn(2L);

        RetrainResult result = pipeline(new GaussianNaiveBayesTrainer()).retrain(TENANT, MODEL, null);

        assertThat(result.success()).isFalse();
        assertThat(result.status()).isEqualTo(RetrainStatus.INSUFFICIENT_FEEDBACK);
        assertThat(result.message()).contains("Need 3, have 2");
        assertThat(artifactStore.listVersions()).containsExactly("base");
        verify(feedbackService, never()).loadForRetraining(any(), any());
        verify(versionRepository, never()).save(any());
    }

    @Test
    void newFaultClassExtendsLabelSpaceAndWritesStagingVersion() throws Exception {
        feedback(ModelFixtures.cluster(GEAR_CENTER, "gear_wear", 6, 11L));

        RetrainResult result = pipeline(new GaussianNaiveBayesTrainer()).retrain(TENANT, MODEL, null);

        assertThat(result.status()).isEqualTo(RetrainStatus.COMPLETED);
        assertThat(result.newVersionLabel()).isEqualTo(TENANT + "_" + MODEL + "_v2");
        assertThat(result.newVersionId()).isNotNull();
        assertThat(result.metrics()).containsKeys(
                ClassificationMetrics.ACCURACY, ClassificationMetrics.BALANCED_ACCURACY, ClassificationMetrics.F1);

        ModelHandle retrained = loader.load(artifactStore.load(result.newVersionLabel()));
        assertThat(retrained.getEncoder().classes()).containsExactly("bearing_fault", "gear_wear", "normal");
        assertThat(retrained.predict(GEAR_CENTER, 1).label()).isEqualTo("gear_wear");
        assertThat(retrained.predict(ModelFixtures.faultSample(), 1).label()).isEqualTo(ModelFixtures.BEARING_FAULT);

        TrainingDataset persisted = loader.loadTrainingData(retrained.getFiles()).orElseThrow();
        assertThat(persisted.size()).isEqualTo(20 + 6);

        ArgumentCaptor<ModelVersion> saved = ArgumentCaptor.forClass(ModelVersion.class);
        verify(versionRepository).save(saved.capture());
        assertThat(saved.getValue().getStage()).isEqualTo(ModelStage.STAGING);
        assertThat(saved.getValue().getSemanticVersion()).isEqualTo("1.0.2");
        assertThat(saved.getValue().getFullVersionLabel()).isEqualTo("fault_classifier:1.0.2");
        assertThat(saved.getValue().getTenantId()).isEqualTo(TENANT);
        assertThat(saved.getValue().getModelId()).isEqualTo(MODEL);
        assertThat(Path.of(saved.getValue().getArtifactPath())).isDirectory();
        assertThat(saved.getValue().getAccuracy()).isNotNull();
    }

    @Test
    void concurrentRunForSameTenantModelIsTurnedAway() throws Exception {
        feedback(ModelFixtures.cluster(GEAR_CENTER, "gear_wear", 6, 11L));
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        GaussianNaiveBayesTrainer delegate = new GaussianNaiveBayesTrainer();
        RetrainingPipeline pipeline = pipeline((x, y, w, k) -> {
            entered.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return delegate.train(x, y, w, k);
        });

        CompletableFuture<RetrainResult> first = CompletableFuture.supplyAsync(() -> pipeline.retrain(TENANT, MODEL, null));
        assertThat(entered.await(10, TimeUnit.SECONDS)).isTrue();
        assertThat(pipeline.isRunning(TENANT, MODEL)).isTrue();

        RetrainResult second = pipeline.retrain(TENANT, MODEL, null);
        release.countDown();

        assertThat(second.status()).isEqualTo(RetrainStatus.ALREADY_RUNNING);
        assertThat(first.get(30, TimeUnit.SECONDS).status()).isEqualTo(RetrainStatus.COMPLETED);
        assertThat(pipeline.isRunning(TENANT, MODEL)).isFalse();
        assertThat(meterRegistry.counter("model.retrain.runs", "outcome", "already_running").count()).isEqualTo(1.0);
    }

    @Test
    void defaultModelRequestSharesPermitWithExplicitModel() throws Exception {
        feedback(ModelFixtures.cluster(GEAR_CENTER, "gear_wear", 6, 11L));
        when(tenantModelResolver.resolveModel(TENANT, null)).thenReturn(Optional.of(MODEL));
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        GaussianNaiveBayesTrainer delegate = new GaussianNaiveBayesTrainer();
        RetrainingPipeline pipeline = pipeline((x, y, w, k) -> {
            entered.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return delegate.train(x, y, w, k);
        });

        CompletableFuture<RetrainResult> first = CompletableFuture.supplyAsync(() -> pipeline.retrain(TENANT, null, null));
        assertThat(entered.await(10, TimeUnit.SECONDS)).isTrue();
        assertThat(pipeline.isRunning(TENANT, MODEL)).isTrue();

        RetrainResult second = pipeline.retrain(TENANT, MODEL, null);
        release.countDown();

        assertThat(second.status()).isEqualTo(RetrainStatus.ALREADY_RUNNING);
        assertThat(first.get(30, TimeUnit.SECONDS).status()).isEqualTo(RetrainStatus.COMPLETED);
        verify(versionRepository).save(any(ModelVersion.class));
    }

    @Test
    void failedRunReleasesPermit() {
        feedback(ModelFixtures.cluster(GEAR_CENTER, "gear_wear", 6, 11L));
        AtomicBoolean fail = new AtomicBoolean(true);
        GaussianNaiveBayesTrainer delegate = new GaussianNaiveBayesTrainer();
        RetrainingPipeline pipeline = pipeline((x, y, w, k) -> {
            if (fail.getAndSet(false)) {
                throw new IllegalStateException("solver diverged");
            }
            return delegate.train(x, y, w, k);
        });

        RetrainResult failed = pipeline.retrain(TENANT, MODEL, null);
        RetrainResult retried = pipeline.retrain(TENANT, MODEL, null);

        assertThat(failed.status()).isEqualTo(RetrainStatus.FAILED);
        assertThat(failed.message()).contains("solver diverged");
        assertThat(retried.status()).isEqualTo(RetrainStatus.COMPLETED);
    }

    @Test
    void unresolvedTenantWritesArtifactsWithoutVersionRow() {
        feedback(ModelFixtures.cluster(new double[]{5, 5, 5}, ModelFixtures.BEARING_FAULT, 4, 3L));
        when(tenantModelResolver.resolveTenant(isNull())).thenReturn(Optional.empty());

        RetrainResult result = pipeline(new GaussianNaiveBayesTrainer()).retrain(null, null, null);

        assertThat(result.status()).isEqualTo(RetrainStatus.COMPLETED);
        assertThat(result.newVersionLabel()).isEqualTo("v2");
        assertThat(result.newVersionId()).isNull();
        assertThat(artifactStore.exists("v2")).isTrue();
        verify(versionRepository, never()).save(any());
    }

    @Test
    void emptyFeedbackSelectionReportsNoFeedback() {
        lenient().when(feedbackService.count(TENANT)).thenReturn(5L);
        when(feedbackService.loadForRetraining(eq(TENANT), any()))
                .thenReturn(new FeedbackDataset(new double[0][], List.of(), List.of()));

        RetrainResult result = pipeline(new GaussianNaiveBayesTrainer())
                .retrain(TENANT, MODEL, List.of(UUID.randomUUID()));

        assertThat(result.status()).isEqualTo(RetrainStatus.NO_FEEDBACK);
        assertThat(artifactStore.listVersions()).containsExactly("base");
    }

    @Test
    void asyncRunCompletesOnExecutor() {
        feedback(ModelFixtures.cluster(GEAR_CENTER, "gear_wear", 6, 11L));

        RetrainResult started = pipeline(new GaussianNaiveBayesTrainer()).retrainAsync(TENANT, MODEL, null);
        executor.shutdown();

        assertThat(started.status()).isEqualTo(RetrainStatus.STARTED);
        assertThat(started.success()).isTrue();
        verify(versionRepository).save(any(ModelVersion.class));
    }

    @Test
    void fullQueueRejectsAsyncRun() {
        feedback(ModelFixtures.cluster(GEAR_CENTER, "gear_wear", 6, 11L));
        ThreadPoolTaskExecutor saturated = mock(ThreadPoolTaskExecutor.class);
        doThrow(new TaskRejectedException("queue full")).when(saturated).execute(any(Runnable.class));
        RetrainingPipeline pipeline = new RetrainingPipeline(properties, feedbackService, modelRegistry, loader,
                new GaussianNaiveBayesTrainer(), artifactStore, versionRepository, tenantModelResolver,
                saturated, meterRegistry);

        RetrainResult result = pipeline.retrainAsync(TENANT, MODEL, null);

        assertThat(result.status()).isEqualTo(RetrainStatus.REJECTED);
        assertThat(result.success()).isFalse();
    }
}
