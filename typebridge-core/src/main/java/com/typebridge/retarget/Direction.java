package com.typebridge.retarget;

/**
 * 改写方向。FORWARD：origin → target；BACKWARD：target → origin。
 */
public enum Direction {
    FORWARD,
    BACKWARD;

    public boolean isForward() {
        return this == FORWARD;
    }

    public Direction reverse() {
        return this == FORWARD ? BACKWARD : FORWARD;
    }
}
