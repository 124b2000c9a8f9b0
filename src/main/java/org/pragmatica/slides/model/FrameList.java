package org.pragmatica.slides.model;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * The compiled document: an immutable, ordered list of frames.
 */
public record FrameList(List<Frame> frames) implements Iterable<Frame> {

    public static final FrameList EMPTY = new FrameList(List.of());

    public FrameList {
        frames = List.copyOf(frames);
    }

    public int size() {
        return frames.size();
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    public Frame get(int index) {
        return frames.get(index);
    }

    public Stream<Frame> stream() {
        return frames.stream();
    }

    @Override
    public Iterator<Frame> iterator() {
        return frames.iterator();
    }

    public Optional<Frame> findFrame(String id) {
        return frames.stream()
                     .filter(frame -> frame.id().equals(id))
                     .findFirst();
    }

    public FrameList withFrame(int index, Frame frame) {
        var updated = new ArrayList<>(frames);
        updated.set(index, frame);
        return new FrameList(updated);
    }

    public FrameList withBoxGeometry(int frameIndex, String boxId, BoxGeometry geometry) {
        return withFrame(frameIndex, frames.get(frameIndex).withBoxGeometry(boxId, geometry));
    }
}
