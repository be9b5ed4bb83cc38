package com.linetrace.instrument.rewrite;

import java.util.*;

/**
 * Tracks which locals may be read at the current point of a method body.
 *
 * One frame per open block. A name is visible when its declaring frame is open and it has been
 * assigned in that frame or in a deeper frame that is still open. Assignments made in a frame
 * are forgotten when the frame closes, even after an if/else that assigns on both paths.
 */
public class ScopeTracker {

    private static final class Frame {
        final Set<String> declared = new LinkedHashSet<>();
        final Set<String> assigned = new HashSet<>();
    }

    private final Deque<Frame> frames = new ArrayDeque<>();

    public ScopeTracker() {
        frames.push(new Frame());
    }

    public void enter() {
        frames.push(new Frame());
    }

    public void exit() {
        if (frames.size() == 1) {
            throw new IllegalStateException("Cannot close the outermost frame");
        }
        frames.pop();
    }

    /** Declares a name in the current frame; it becomes visible once assigned. */
    public void declare(String name) {
        frames.peek().declared.add(name);
    }

    /** Declares a name that already holds a value (parameter, initialized local, loop variable). */
    public void declareAssigned(String name) {
        Frame top = frames.peek();
        top.declared.add(name);
        top.assigned.add(name);
    }

    /** Records a plain assignment in the current frame. Names not declared in any open frame are ignored. */
    public void assign(String name) {
        if (isDeclared(name)) {
            frames.peek().assigned.add(name);
        }
    }

    public boolean isDeclared(String name) {
        for (Frame f : frames) {
            if (f.declared.contains(name)) return true;
        }
        return false;
    }

    /** Visible names, outermost frame first, each frame in declaration order. */
    public List<String> visible() {
        List<Frame> outerFirst = new ArrayList<>(frames);
        Collections.reverse(outerFirst);

        List<String> names = new ArrayList<>();
        for (int i = 0; i < outerFirst.size(); i++) {
            for (String name : outerFirst.get(i).declared) {
                if (assignedFrom(outerFirst, i, name)) {
                    names.add(name);
                }
            }
        }
        return names;
    }

    private static boolean assignedFrom(List<Frame> outerFirst, int declaringFrame, String name) {
        for (int j = declaringFrame; j < outerFirst.size(); j++) {
            if (outerFirst.get(j).assigned.contains(name)) return true;
        }
        return false;
    }

    public int depth() {
        return frames.size();
    }
}
