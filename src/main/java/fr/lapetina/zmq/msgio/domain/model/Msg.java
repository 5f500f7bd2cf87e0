package fr.lapetina.zmq.msgio.domain.model;

import fr.lapetina.zmq.msgio.domain.exception.MsgIoException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One complete logical message: an ordered sequence of frames, plus the failure
 * that produced it when it comes from a failed read.
 *
 * Immutable. Frames are copied on the way in and on the way out.
 */
public final class Msg {

    private static final Msg EMPTY = new Msg(List.of(), null);

    private final List<byte[]> frames;
    private final MsgIoException error;

    private Msg(List<byte[]> frames, MsgIoException error) {
        this.frames = frames;
        this.error = error;
    }

    /**
     * Creates a message from raw frames.
     */
    public static Msg of(byte[]... frames) {
        Objects.requireNonNull(frames, "frames");
        List<byte[]> copy = new ArrayList<>(frames.length);
        for (byte[] frame : frames) {
            copy.add(Objects.requireNonNull(frame, "frame").clone());
        }
        return new Msg(Collections.unmodifiableList(copy), null);
    }

    /**
     * Creates a message from frames, as a list.
     */
    public static Msg of(List<byte[]> frames) {
        return of(frames.toArray(new byte[0][]));
    }

    /**
     * Creates a message whose frames are the UTF-8 encoding of the given strings.
     */
    public static Msg ofStrings(String... frames) {
        byte[][] raw = new byte[frames.length][];
        for (int i = 0; i < frames.length; i++) {
            raw[i] = frames[i].getBytes(StandardCharsets.UTF_8);
        }
        return of(raw);
    }

    /**
     * Creates a message carrying a read failure and no frames.
     */
    public static Msg failed(MsgIoException error) {
        return new Msg(List.of(), Objects.requireNonNull(error, "error"));
    }

    public static Msg empty() {
        return EMPTY;
    }

    public List<byte[]> frames() {
        List<byte[]> copy = new ArrayList<>(frames.size());
        for (byte[] frame : frames) {
            copy.add(frame.clone());
        }
        return copy;
    }

    public byte[] frame(int index) {
        return frames.get(index).clone();
    }

    public int frameCount() {
        return frames.size();
    }

    /**
     * Returns the first frame decoded as UTF-8, or an empty string for a message without frames.
     */
    public String string() {
        return frames.isEmpty() ? "" : new String(frames.get(0), StandardCharsets.UTF_8);
    }

    public List<String> strings() {
        return frames.stream()
                .map(frame -> new String(frame, StandardCharsets.UTF_8))
                .toList();
    }

    public boolean isFailed() {
        return error != null;
    }

    /**
     * Returns the failure of the read that produced this message, or null.
     */
    public MsgIoException error() {
        return error;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Msg that = (Msg) o;
        if (isFailed() != that.isFailed() || frames.size() != that.frames.size()) {
            return false;
        }
        for (int i = 0; i < frames.size(); i++) {
            if (!Arrays.equals(frames.get(i), that.frames.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = Boolean.hashCode(isFailed());
        for (byte[] frame : frames) {
            result = 31 * result + Arrays.hashCode(frame);
        }
        return result;
    }

    @Override
    public String toString() {
        if (error != null) {
            return "Msg{failed=" + error.getMessage() + '}';
        }
        return "Msg{frames=" + strings() + '}';
    }
}
