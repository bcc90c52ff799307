package com.finsight.model;

public enum Direction {
    UP,
    DOWN,
    FLAT;

    /**
     * FLAT only when |delta| is strictly below the deadband.
     */
    public static Direction classify(double delta, double deadband) {
        if (Math.abs(delta) < deadband) {
            return FLAT;
        }
        return delta > 0.0 ? UP : DOWN;
    }
}
