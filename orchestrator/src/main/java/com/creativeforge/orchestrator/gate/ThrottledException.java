package com.creativeforge.orchestrator.gate;

/**
 * Thrown at submission time when the system-wide in-flight ceiling is reached.
 * No job is created; the caller may retry the submission later.
 */
public class ThrottledException extends RuntimeException {

    private final int ceiling;

    public ThrottledException(int ceiling) {
        super("Global in-flight ceiling of " + ceiling + " jobs reached");
        this.ceiling = ceiling;
    }

    public int ceiling() { return ceiling; }
}
