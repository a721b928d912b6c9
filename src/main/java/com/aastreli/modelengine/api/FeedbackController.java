package com.aastreli.modelengine.api;

import com.aastreli.modelengine.domain.model.FeedbackRecord;
import com.aastreli.modelengine.domain.model.FeedbackType;
import com.aastreli.modelengine.domain.service.feedback.FeedbackService;
import com.aastreli.modelengine.domain.service.feedback.FeedbackStats;
import com.aastreli.modelengine.domain.service.feedback.FeedbackSubmission;
import com.aastreli.modelengine.domain.service.retraining.RetrainingProperties;
import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
public class FeedbackController {

    private final FeedbackService feedbackService;
    private final RetrainingProperties retrainingProperties;

    @PostMapping("/feedback")
    public ResponseEntity<Map<String, Object>> submit(@Valid @RequestBody FeedbackRequest req) {
        FeedbackRecord saved = feedbackService.store(new FeedbackSubmission(
                req.features(),
                req.originalPrediction().trim(),
                req.correctedLabel().trim(),
                req.feedbackType(),
                req.confidence(),
                req.notes(),
                RequestIds.parseOrNull(req.tenantId()),
                RequestIds.parseOrNull(req.assetId()),
                RequestIds.parseOrNull(req.sensorId()),
                req.predictionId()));

        long total = feedbackService.count(saved.getTenantId());
        return ResponseEntity.ok(Map.of(
                "success", true,
                "feedbackId", saved.getId().toString(),
                "message", "Feedback stored. Total: " + total,
                "totalFeedback", total,
                "readyForRetraining", total >= retrainingProperties.getMinFeedback()
        ));
    }

    @GetMapping("/feedback/stats")
    public ResponseEntity<FeedbackStats> stats(@RequestParam(required = false) String tenantId) {
        return ResponseEntity.ok(feedbackService.stats(RequestIds.parseOrNull(tenantId)));
    }

    public record FeedbackRequest(
            @NotEmpty List<@NotNull Double> features,
            @JsonAlias("original_prediction") @NotBlank String originalPrediction,
            @JsonAlias("corrected_label") @NotBlank String correctedLabel,
            @JsonAlias("feedback_type") @NotNull FeedbackType feedbackType,
            Double confidence,
            @Size(max = 4000) String notes,
            @JsonAlias("tenant_id") String tenantId,
            @JsonAlias("asset_id") String assetId,
            @JsonAlias("sensor_id") String sensorId,
            @JsonAlias("prediction_id") @Size(max = 100) String predictionId
    ) {
    }
}
