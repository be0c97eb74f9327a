package com.opsdata.reconciliation.validation;

record FlagCandidate(Long lotId, String lotCode, String description) {
}
