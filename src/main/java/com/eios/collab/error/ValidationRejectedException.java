package com.eios.collab.error;

/**
 * A domain edit violates a structural invariant of the scene graph. The edit is
 * never translated into replicated operations.
 */
public class ValidationRejectedException extends CollabException {

    public ValidationRejectedException(String message) {
        super(message);
    }
}
