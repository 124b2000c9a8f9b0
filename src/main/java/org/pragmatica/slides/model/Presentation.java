package org.pragmatica.slides.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Holds the current document snapshot.
 *
 * <p>Every successful compile replaces the snapshot wholesale via {@link #setFrames(FrameList)}.
 * Interactive edits go through {@link #setBoxGeometry(String, BoxGeometry, int)}, which swaps in a
 * patched copy; readers holding an older {@link FrameList} keep a consistent view. Edited geometry
 * is also recorded in the {@link BoxConfiguration} and re-applied to every later snapshot.
 * Not thread-safe: compiles and gestures must run on the same thread.
 */
public final class Presentation {
    private static final Logger log = LoggerFactory.getLogger(Presentation.class);

    /**
     * Change notifications.
     */
    public interface Listener {
        void presentationChanged();

        default void frameChanged(int frameIndex) {}
    }

    /**
     * A frame together with one of its boxes.
     */
    public record Location(int frameIndex, Frame frame, Optional<Box> box) {}

    private final Layout layout;
    private final List<Listener> listeners = new ArrayList<>();
    private FrameList frames = FrameList.EMPTY;
    private BoxConfiguration configuration = new BoxConfiguration();

    public Presentation() {
        this(Layout.SIXTEEN_TO_NINE);
    }

    public Presentation(Layout layout) {
        this.layout = layout;
    }

    public void addListener(Listener listener) {
        listeners.add(listener);
    }

    public void removeListener(Listener listener) {
        listeners.remove(listener);
    }

    public Layout layout() {
        return layout;
    }

    public FrameList frames() {
        return frames;
    }

    /**
     * Install a freshly compiled document, with the stored box geometry applied.
     */
    public void setFrames(FrameList frames) {
        this.frames = configuration.applyTo(frames);
        listeners.forEach(Listener::presentationChanged);
    }

    public BoxConfiguration configuration() {
        return configuration;
    }

    /**
     * Replace the geometry store and re-apply it to the current snapshot.
     */
    public void setConfiguration(BoxConfiguration configuration) {
        this.configuration = configuration;
        setFrames(frames);
    }

    public void loadConfiguration(Path file) throws IOException {
        setConfiguration(BoxConfiguration.load(file));
    }

    public void saveConfiguration(Path file) throws IOException {
        configuration.save(file);
    }

    /**
     * Forget stored geometry of boxes that are no longer part of the document.
     *
     * @return the removed box ids
     */
    public Set<String> deleteUnusedConfigurations() {
        return configuration.retainUsed(frames);
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    public int size() {
        return frames.size();
    }

    public Frame frameAt(int frameIndex) {
        return frames.get(frameIndex);
    }

    public Optional<Frame> findFrame(String frameId) {
        return frames.findFrame(frameId);
    }

    public Optional<Box> findBox(String boxId) {
        return frames.stream()
                     .flatMap(frame -> frame.findBox(boxId).stream())
                     .findFirst();
    }

    /**
     * The frame and box whose source text contains {@code line}: the last frame starting at or
     * before the line and, inside it, the last box starting at or before the line.
     */
    public Optional<Location> findBoxForLine(int line) {
        Location found = null;
        for (int i = 0; i < frames.size(); i++) {
            var frame = frames.get(i);
            if (frame.line() > line) {
                break;
            }
            Box lastBox = null;
            for (var box : frame.boxes()) {
                if (box.line() > line) {
                    break;
                }
                lastBox = box;
            }
            found = new Location(i, frame, Optional.ofNullable(lastBox));
        }
        return Optional.ofNullable(found);
    }

    /**
     * Replace one box's geometry in the frame at {@code frameIndex} and remember it by box id.
     */
    public void setBoxGeometry(String boxId, BoxGeometry geometry, int frameIndex) {
        if (frameIndex < 0 || frameIndex >= frames.size()) {
            log.debug("Ignoring geometry for box {} on missing frame {}", boxId, frameIndex);
            return;
        }
        if (frames.get(frameIndex).findBox(boxId).isEmpty()) {
            log.debug("Ignoring geometry for unknown box {} on frame {}", boxId, frameIndex);
            return;
        }
        log.debug("Box {} on frame {} -> {}", boxId, frameIndex, geometry);
        configuration.put(boxId, geometry);
        frames = frames.withBoxGeometry(frameIndex, boxId, geometry);
        listeners.forEach(listener -> listener.frameChanged(frameIndex));
    }

    /**
     * Snap a box to a layout slot, keeping its rotation.
     */
    public void applyLayout(String boxId, Layout.Slot slot, int frameIndex) {
        if (frameIndex < 0 || frameIndex >= frames.size()) {
            return;
        }
        frames.get(frameIndex)
              .findBox(boxId)
              .ifPresent(box -> setBoxGeometry(boxId,
                                               layout.geometry(slot).withAngle(box.geometry().angle()),
                                               frameIndex));
    }
}
