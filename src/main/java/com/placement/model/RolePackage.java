package com.placement.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * A role offered by a company and the package attached to it.
 * {@code packageValue} may be null when the announcement did not disclose it.
 */
public record RolePackage(
    String role,
    @JsonProperty("package") BigDecimal packageValue,
    String packageDetails
) {
    public RolePackage(String role, BigDecimal packageValue) {
        this(role, packageValue, null);
    }
}
