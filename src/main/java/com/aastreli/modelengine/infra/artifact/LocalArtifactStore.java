package com.aastreli.modelengine.infra.artifact;

import com.aastreli.modelengine.domain.exception.ArtifactNotFoundException;
import com.aastreli.modelengine.domain.exception.ArtifactStorageException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Stream;

@Slf4j
public class LocalArtifactStore implements ArtifactStore {

    static final String VERSIONS_DIR = "versions";
    static final String METADATA_FILE = "metadata.json";

    private final Path versionsDir;
    private final ObjectWriter writer;
    private final ObjectMapper objectMapper;

    public LocalArtifactStore(Path baseDir, ObjectMapper objectMapper) {
        this.versionsDir = baseDir.resolve(VERSIONS_DIR);
        this.objectMapper = objectMapper;
        this.writer = objectMapper.writerWithDefaultPrettyPrinter();
    }

    @Override
    public String save(String version, Map<String, Object> artifacts) {
        return write(version, artifacts, false);
    }

    @Override
    public String replace(String version, Map<String, Object> artifacts) {
        return write(version, artifacts, true);
    }

    private String write(String version, Map<String, Object> artifacts, boolean overwrite) {
        Path target = versionDir(version);
        if (!overwrite && Files.exists(target)) {
            throw new ArtifactStorageException("Version already exists: " + version);
        }
        Path staging = versionsDir.resolve("." + version + ".tmp");
        try {
            Files.createDirectories(versionsDir);
            deleteRecursively(staging);
            Files.createDirectories(staging);
            for (Map.Entry<String, Object> entry : artifacts.entrySet()) {
                Path file = staging.resolve(entry.getKey());
                if (entry.getValue() instanceof byte[] bytes) {
                    Files.write(file, bytes);
                } else {
                    writer.writeValue(file.toFile(), entry.getValue());
                }
            }
            if (overwrite) {
                deleteRecursively(target);
            }
            Files.move(staging, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException | UncheckedIOException e) {
            discard(staging);
            if (e instanceof FileAlreadyExistsException || e instanceof DirectoryNotEmptyException) {
                throw new ArtifactStorageException("Version already exists: " + version, e);
            }
            throw new ArtifactStorageException("Failed to save artifacts for " + version, e);
        }
        log.info("[Artifacts] 버전 저장 완료: version={}, files={}, replaced={}, path={}",
                version, artifacts.size(), overwrite, target);
        return target.toAbsolutePath().toString();
    }

    private static void discard(Path staging) {
        try {
            deleteRecursively(staging);
        } catch (IOException e) {
            log.warn("[Artifacts] 임시 디렉터리 정리 실패: path={}, error={}", staging, e.getMessage());
        }
    }

    @Override
    public Map<String, Path> load(String version) {
        Path dir = versionDir(version);
        if (!Files.isDirectory(dir)) {
            throw new ArtifactNotFoundException(version);
        }
        return listFiles(dir);
    }

    @Override
    public Map<String, Path> open(String location) {
        Path dir = Path.of(location);
        if (!Files.isDirectory(dir)) {
            throw new ArtifactNotFoundException(location);
        }
        return listFiles(dir);
    }

    @Override
    public List<String> listVersions() {
        if (!Files.isDirectory(versionsDir)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(versionsDir)) {
            return entries.filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .filter(name -> !name.startsWith("."))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new ArtifactStorageException("Failed to list versions", e);
        }
    }

    @Override
    public boolean delete(String version) {
        Path dir = versionDir(version);
        if (!Files.isDirectory(dir)) {
            return false;
        }
        try {
            deleteRecursively(dir);
        } catch (IOException e) {
            throw new ArtifactStorageException("Failed to delete " + version, e);
        }
        log.info("[Artifacts] 버전 삭제: version={}", version);
        return true;
    }

    @Override
    public boolean exists(String version) {
        return Files.isDirectory(versionDir(version));
    }

    @Override
    public Optional<Map<String, Object>> getMetadata(String version) {
        Path file = versionDir(version).resolve(METADATA_FILE);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), new TypeReference<Map<String, Object>>() {
            }));
        } catch (IOException e) {
            log.warn("[Artifacts] 메타데이터 읽기 실패: version={}, error={}", version, e.getMessage());
            return Optional.empty();
        }
    }

    private Path versionDir(String version) {
        if (version == null || version.isBlank() || version.contains("/") || version.contains("\\")
                || version.startsWith(".")) {
            throw new IllegalArgumentException("Invalid version name: " + version);
        }
        return versionsDir.resolve(version);
    }

    private Map<String, Path> listFiles(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            Map<String, Path> result = new TreeMap<>();
            files.filter(Files::isRegularFile)
                    .forEach(f -> result.put(f.getFileName().toString(), f));
            return result;
        } catch (IOException e) {
            throw new ArtifactStorageException("Failed to read artifacts in " + dir, e);
        }
    }

    private static void deleteRecursively(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(p);
            }
        }
    }
}
