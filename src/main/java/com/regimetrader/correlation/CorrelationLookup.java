package com.regimetrader.correlation;

public record CorrelationLookup(double coefficient, CorrelationSource source) {}
