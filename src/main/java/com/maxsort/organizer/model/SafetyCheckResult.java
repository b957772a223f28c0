package com.maxsort.organizer.model;

public record SafetyCheckResult(boolean safe, String reason, RiskLevel riskLevel) {

    public static SafetyCheckResult passed() {
        return new SafetyCheckResult(true, null, RiskLevel.LOW);
    }

    public static SafetyCheckResult unsafe(String reason, RiskLevel riskLevel) {
        return new SafetyCheckResult(false, reason, riskLevel);
    }
}
