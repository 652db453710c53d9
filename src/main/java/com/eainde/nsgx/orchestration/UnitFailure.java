package com.eainde.nsgx.orchestration;

import com.eainde.nsgx.model.FailureKind;

/**
 * A unit that produced no result. Failed units are excluded from merging.
 */
public record UnitFailure(String documentId, String unitId, FailureKind kind, String message) {}
