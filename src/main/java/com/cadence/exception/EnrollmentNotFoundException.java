package com.cadence.exception;

import jakarta.persistence.EntityNotFoundException;

import java.util.UUID;

public class EnrollmentNotFoundException extends EntityNotFoundException {

    public EnrollmentNotFoundException(UUID enrollmentId) {
        super("Enrollment not found: " + enrollmentId);
    }
}
