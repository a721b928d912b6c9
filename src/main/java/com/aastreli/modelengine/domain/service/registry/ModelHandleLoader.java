package com.aastreli.modelengine.domain.service.registry;

import com.aastreli.modelengine.domain.classifier.Classifier;
import com.aastreli.modelengine.domain.classifier.FeatureScaler;
import com.aastreli.modelengine.domain.classifier.LabelEncoder;
import com.aastreli.modelengine.domain.classifier.TrainingDataset;
import com.aastreli.modelengine.domain.exception.ArtifactNotFoundException;
import com.aastreli.modelengine.domain.exception.ArtifactStorageException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class ModelHandleLoader {

    private final ObjectMapper objectMapper;
    private final CsvMapper csvMapper = new CsvMapper();

    public ModelHandle load(Map<String, Path> files) {
        Classifier classifier = read(files, ModelArtifacts.CLASSIFIER, Classifier.class);
        LabelEncoder encoder = read(files, ModelArtifacts.LABEL_ENCODER, LabelEncoder.class);
        FeatureScaler scaler = read(files, ModelArtifacts.FEATURE_SCALER, FeatureScaler.class);

        Map<String, Object> metadata;
        Path metadataFile = files.get(ModelArtifacts.METADATA);
        if (metadataFile != null) {
            try {
                metadata = objectMapper.readValue(metadataFile.toFile(), new TypeReference<LinkedHashMap<String, Object>>() {
                });
            } catch (IOException e) {
                throw new ArtifactStorageException("Corrupt " + ModelArtifacts.METADATA, e);
            }
        } else {
            metadata = new LinkedHashMap<>();
            metadata.put("version", "v1");
            metadata.put("createdAt", Instant.now().toString());
            metadata.put("numClasses", encoder.size());
        }

        try {
            return new ModelHandle(classifier, encoder, scaler, metadata, files);
        } catch (IllegalArgumentException e) {
            throw new ArtifactStorageException("Inconsistent model bundle: " + e.getMessage(), e);
        }
    }

    /**
     * Historical samples bundled with a model: {@code training_data.json}, or a CSV with a
     * header row whose last column is the label.
     */
    public Optional<TrainingDataset> loadTrainingData(Map<String, Path> files) {
        Path json = files.get(ModelArtifacts.TRAINING_DATA);
        if (json != null) {
            try {
                return Optional.of(objectMapper.readValue(json.toFile(), TrainingDataset.class));
            } catch (IOException e) {
                log.warn("[Registry] 학습 데이터 읽기 실패: file={}, error={}", json, e.getMessage());
                return Optional.empty();
            }
        }
        Path csv = files.get(ModelArtifacts.TRAINING_DATA_CSV);
        if (csv != null) {
            try {
                return Optional.of(readCsv(csv));
            } catch (IOException | RuntimeException e) {
                log.warn("[Registry] CSV 학습 데이터 읽기 실패: file={}, error={}", csv, e.getMessage());
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private <T> T read(Map<String, Path> files, String name, Class<T> type) {
        Path file = files.get(name);
        if (file == null || !Files.isRegularFile(file)) {
            throw new ArtifactNotFoundException(name);
        }
        try {
            return objectMapper.readValue(file.toFile(), type);
        } catch (IOException e) {
            throw new ArtifactStorageException("Corrupt " + name, e);
        }
    }

    private TrainingDataset readCsv(Path csv) throws IOException {
        List<double[]> rows = new ArrayList<>();
        List<String> labels = new ArrayList<>();
        int skipped = 0;
        ObjectReader reader = csvMapper.readerFor(String[].class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .with(CsvParser.Feature.SKIP_EMPTY_LINES)
                .with(CsvParser.Feature.TRIM_SPACES);
        try (MappingIterator<String[]> it = reader.readValues(csv.toFile())) {
            if (!it.hasNext()) {
                return new TrainingDataset(new double[0][], labels);
            }
            int width = it.next().length;
            if (width < 2) {
                throw new ArtifactStorageException("CSV header needs feature and label columns: " + csv);
            }
            while (it.hasNext()) {
                String[] cols = it.next();
                double[] features = cols.length == width ? parseFeatures(cols) : null;
                if (features == null || cols[width - 1].isEmpty()) {
                    skipped++;
                    continue;
                }
                rows.add(features);
                labels.add(cols[width - 1]);
            }
        }
        if (skipped > 0) {
            log.warn("[Registry] CSV 학습 데이터 일부 행 제외: file={}, skipped={}, kept={}", csv, skipped, rows.size());
        }
        return new TrainingDataset(rows.toArray(new double[0][]), labels);
    }

    private static double[] parseFeatures(String[] cols) {
        double[] features = new double[cols.length - 1];
        try {
            for (int i = 0; i < features.length; i++) {
                features[i] = Double.parseDouble(cols[i]);
            }
        } catch (NumberFormatException e) {
            return null;
        }
        return features;
    }
}
