package com.regimetrader.risk;

/**
 * Outcome of an admission check. The reason is for logs and the dashboard only; callers branch on
 * {@link #admitted()}.
 */
public record AdmissionDecision(boolean admitted, String reason) {

    private static final AdmissionDecision ADMITTED = new AdmissionDecision(true, null);

    public static AdmissionDecision admit() {
        return ADMITTED;
    }

    public static AdmissionDecision reject(String reason) {
        return new AdmissionDecision(false, reason);
    }
}
