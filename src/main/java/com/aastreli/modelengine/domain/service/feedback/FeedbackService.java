package com.aastreli.modelengine.domain.service.feedback;

import com.aastreli.modelengine.domain.model.FeedbackRecord;
import com.aastreli.modelengine.domain.model.FeedbackType;
import com.aastreli.modelengine.domain.repository.FeedbackRepository;
import com.aastreli.modelengine.domain.service.TenantModelResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class FeedbackService {

    private final FeedbackRepository feedbackRepository;
    private final TenantModelResolver tenantModelResolver;

    @Transactional
    public FeedbackRecord store(FeedbackSubmission submission) {
        UUID tenantId = tenantModelResolver.resolveTenant(submission.tenantId())
                .orElseThrow(() -> new IllegalArgumentException("tenantId is required: no default tenant configured"));

        FeedbackRecord saved = feedbackRepository.save(FeedbackRecord.builder()
                .tenantId(tenantId)
                .assetId(submission.assetId())
                .sensorId(submission.sensorId())
                .predictionId(submission.predictionId())
                .predictionLabel(submission.originalPrediction())
                .probability(submission.confidence())
                .newLabel(submission.correctedLabel())
                .correction(submission.notes())
                .feedbackType(submission.feedbackType())
                .features(List.copyOf(submission.features()))
                .build());

        log.info("[Feedback] 피드백 저장: id={}, tenant={}, type={}, label={}->{}",
                saved.getId(), tenantId, saved.getFeedbackType().getCode(),
                saved.getPredictionLabel(), saved.getNewLabel());
        return saved;
    }

    @Transactional(readOnly = true)
    public long count(UUID tenantId) {
        return tenantId == null ? feedbackRepository.count() : feedbackRepository.countByTenantId(tenantId);
    }

    @Transactional(readOnly = true)
    public FeedbackStats stats(UUID tenantId) {
        Map<FeedbackType, Long> counts = new EnumMap<>(FeedbackType.class);
        for (Object[] row : feedbackRepository.countGroupedByType(tenantId)) {
            counts.put((FeedbackType) row[0], ((Number) row[1]).longValue());
        }
        long total = counts.values().stream().mapToLong(Long::longValue).sum();
        return new FeedbackStats(
                total,
                counts.getOrDefault(FeedbackType.CORRECT, 0L),
                counts.getOrDefault(FeedbackType.CORRECTION, 0L),
                counts.getOrDefault(FeedbackType.NEW_FAULT, 0L),
                counts.getOrDefault(FeedbackType.FALSE_POSITIVE, 0L));
    }

    /**
     * Rows without a stored feature vector are skipped.
     */
    @Transactional(readOnly = true)
    public FeedbackDataset loadForRetraining(UUID tenantId, Collection<UUID> feedbackIds) {
        List<FeedbackRecord> rows;
        boolean selected = feedbackIds != null && !feedbackIds.isEmpty();
        if (tenantId != null) {
            rows = selected
                    ? feedbackRepository.findByTenantIdAndIdInOrderByCreatedAtAsc(tenantId, feedbackIds)
                    : feedbackRepository.findByTenantIdOrderByCreatedAtAsc(tenantId);
        } else {
            rows = selected
                    ? feedbackRepository.findByIdInOrderByCreatedAtAsc(feedbackIds)
                    : feedbackRepository.findAllByOrderByCreatedAtAsc();
        }

        List<double[]> features = new ArrayList<>(rows.size());
        List<String> labels = new ArrayList<>(rows.size());
        List<UUID> ids = new ArrayList<>(rows.size());
        for (FeedbackRecord row : rows) {
            if (row.getFeatures() == null || row.getFeatures().isEmpty()) {
                continue;
            }
            features.add(row.getFeatures().stream().mapToDouble(Double::doubleValue).toArray());
            labels.add(row.getNewLabel());
            ids.add(row.getId());
        }
        if (features.size() < rows.size()) {
            log.debug("[Feedback] 특징 벡터 없는 피드백 제외: skipped={}", rows.size() - features.size());
        }
        return new FeedbackDataset(features.toArray(new double[0][]), labels, ids);
    }
}
