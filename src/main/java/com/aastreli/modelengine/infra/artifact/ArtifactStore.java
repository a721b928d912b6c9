package com.aastreli.modelengine.infra.artifact;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persists the file bundle of one model version. Values of type {@code byte[]} are written
 * as-is, anything else is serialised to JSON.
 */
public interface ArtifactStore {

    /**
     * Writes a new version. Existing versions are never overwritten.
     *
     * @return the location to record as the version's artifact path
     * @throws com.aastreli.modelengine.domain.exception.ArtifactStorageException if the version already exists
     */
    String save(String version, Map<String, Object> artifacts);

    /**
     * Writes the bundle, replacing any existing one under the same name.
     */
    String replace(String version, Map<String, Object> artifacts);

    /**
     * @throws com.aastreli.modelengine.domain.exception.ArtifactNotFoundException if the version has no bundle
     */
    Map<String, Path> load(String version);

    /**
     * Opens a bundle by the location previously returned from {@link #save}.
     */
    Map<String, Path> open(String location);

    List<String> listVersions();

    boolean delete(String version);

    boolean exists(String version);

    Optional<Map<String, Object>> getMetadata(String version);
}
