package org.pragmatica.slides.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Box geometry edited by hand, keyed by box id.
 *
 * <p>Edits survive recompiles because box ids are stable: {@link #applyTo(FrameList)} puts every
 * stored geometry back onto the box with the same id. The store is kept next to the markup file as
 * JSON:
 * <pre>
 * {
 *   "intro-intern-1" : { "left" : 120.0, "top" : 200.0, "width" : 600.0, "height" : 300.0, "angle" : 15.0 }
 * }
 * </pre>
 */
public final class BoxConfiguration {
    private static final Logger log = LoggerFactory.getLogger(BoxConfiguration.class);

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final TypeReference<TreeMap<String, StoredGeometry>> STORE_TYPE = new TypeReference<>() {};

    private final Map<String, BoxGeometry> geometries = new TreeMap<>();

    public BoxConfiguration() {}

    public BoxConfiguration(Map<String, BoxGeometry> geometries) {
        this.geometries.putAll(geometries);
    }

    public void put(String boxId, BoxGeometry geometry) {
        geometries.put(boxId, geometry);
    }

    public Optional<BoxGeometry> get(String boxId) {
        return Optional.ofNullable(geometries.get(boxId));
    }

    public void remove(String boxId) {
        geometries.remove(boxId);
    }

    public boolean isEmpty() {
        return geometries.isEmpty();
    }

    public int size() {
        return geometries.size();
    }

    public Set<String> boxIds() {
        return Set.copyOf(geometries.keySet());
    }

    /**
     * Copy of {@code frames} with every stored geometry applied to the owned box of the same id.
     * Borrowed template boxes are not touched.
     */
    public FrameList applyTo(FrameList frames) {
        if (geometries.isEmpty()) {
            return frames;
        }
        var updated = new ArrayList<Frame>(frames.size());
        for (var frame : frames) {
            var patched = frame;
            for (var box : frame.boxes()) {
                var stored = geometries.get(box.id());
                if (stored != null) {
                    patched = patched.withBoxGeometry(box.id(), stored);
                }
            }
            updated.add(patched);
        }
        return new FrameList(updated);
    }

    /**
     * Drop entries whose box no longer exists in {@code frames}.
     *
     * @return the removed box ids
     */
    public Set<String> retainUsed(FrameList frames) {
        var used = frames.stream()
                         .flatMap(frame -> frame.boxes().stream())
                         .map(Box::id)
                         .collect(Collectors.toSet());
        var removed = geometries.keySet()
                                .stream()
                                .filter(id -> !used.contains(id))
                                .collect(Collectors.toSet());
        geometries.keySet().removeAll(removed);
        if (!removed.isEmpty()) {
            log.debug("Removed unused box configurations {}", removed);
        }
        return removed;
    }

    /**
     * Read a store written by {@link #save(Path)}. A missing file yields an empty store.
     *
     * @throws IOException if the file cannot be read or is not a valid store
     */
    public static BoxConfiguration load(Path file) throws IOException {
        if (!Files.exists(file)) {
            log.info("No box configuration at {}, starting empty", file);
            return new BoxConfiguration();
        }
        TreeMap<String, StoredGeometry> stored = MAPPER.readValue(file.toFile(), STORE_TYPE);
        var configuration = new BoxConfiguration();
        stored.forEach((id, geometry) -> configuration.put(id, geometry.toGeometry()));
        log.debug("Loaded {} box configurations from {}", configuration.size(), file);
        return configuration;
    }

    public void save(Path file) throws IOException {
        var stored = new TreeMap<String, StoredGeometry>();
        geometries.forEach((id, geometry) -> stored.put(id, StoredGeometry.of(geometry)));
        MAPPER.writeValue(file.toFile(), stored);
        log.debug("Saved {} box configurations to {}", stored.size(), file);
    }

    record StoredGeometry(
        @JsonProperty("left") double left,
        @JsonProperty("top") double top,
        @JsonProperty("width") double width,
        @JsonProperty("height") double height,
        @JsonProperty("angle") double angle
    ) {
        static StoredGeometry of(BoxGeometry geometry) {
            return new StoredGeometry(geometry.left(), geometry.top(), geometry.width(), geometry.height(), geometry.angle());
        }

        BoxGeometry toGeometry() {
            return new BoxGeometry(left, top, width, height, angle);
        }
    }
}
