package com.challenges.tslgen.generator;

import com.challenges.tslgen.model.FrameType;
import org.eclipse.collections.api.list.ImmutableList;

import java.util.Objects;

/**
 * Read-only view over the ordered frames of one generation run.
 */
public final class GeneratorResult {
    private final ImmutableList<Frame> frames;

    public GeneratorResult(ImmutableList<Frame> frames) {
        this.frames = Objects.requireNonNull(frames, "frames");
    }

    public ImmutableList<Frame> frames() {
        return frames;
    }

    public int totalFrames() {
        return frames.size();
    }

    public int normalFrames() {
        return count(FrameType.NORMAL);
    }

    public int singleFrames() {
        return count(FrameType.SINGLE);
    }

    public int errorFrames() {
        return count(FrameType.ERROR);
    }

    public int count(FrameType type) {
        return frames.count(frame -> frame.type() == type);
    }

    public ImmutableList<Frame> framesOf(FrameType type) {
        return frames.select(frame -> frame.type() == type);
    }

    public ImmutableList<Frame> normalFramesList() {
        return framesOf(FrameType.NORMAL);
    }

    public ImmutableList<Frame> singleFramesList() {
        return framesOf(FrameType.SINGLE);
    }

    public ImmutableList<Frame> errorFramesList() {
        return framesOf(FrameType.ERROR);
    }

    /** Normal frame keys in generation order. */
    public ImmutableList<String> keys() {
        return normalFramesList().collect(Frame::key);
    }

    public String toSummaryString() {
        return "Generated " + totalFrames() + " test frames:\n"
                + "- Normal frames: " + normalFrames() + "\n"
                + "- Single frames: " + singleFrames() + "\n"
                + "- Error frames: " + errorFrames() + "\n";
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof GeneratorResult other && frames.equals(other.frames);
    }

    @Override
    public int hashCode() {
        return frames.hashCode();
    }

    @Override
    public String toString() {
        return toSummaryString();
    }
}
