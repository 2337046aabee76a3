package dumb.neurosym;

import java.util.EnumSet;
import java.util.Set;

/** Normal modal logics, identified by the frame conditions of their accessibility relation. */
public enum ModalLogic {
    K(EnumSet.noneOf(Frame.class)),
    T(EnumSet.of(Frame.REFLEXIVE, Frame.SERIAL)),
    D(EnumSet.of(Frame.SERIAL)),
    S4(EnumSet.of(Frame.REFLEXIVE, Frame.SERIAL, Frame.TRANSITIVE)),
    S5(EnumSet.allOf(Frame.class));

    private final EnumSet<Frame> frames;

    ModalLogic(EnumSet<Frame> frames) {
        this.frames = frames;
    }

    public boolean has(Frame f) {
        return frames.contains(f);
    }

    public Set<Frame> frames() {
        return frames.clone();
    }

    public enum Frame {
        SERIAL, REFLEXIVE, TRANSITIVE, EUCLIDEAN
    }
}
