package com.placement.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * A selected student. Identity within a company is the enrollment number.
 */
public record Student(
    String name,
    String enrollmentNumber,
    String role,
    @JsonProperty("package") BigDecimal packageValue
) {
    public Student withName(String newName) {
        return new Student(newName, enrollmentNumber, role, packageValue);
    }

    public Student withRoleAndPackage(String newRole, BigDecimal newPackage) {
        return new Student(name, enrollmentNumber, newRole, newPackage);
    }
}
