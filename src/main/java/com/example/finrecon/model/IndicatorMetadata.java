package com.example.finrecon.model;

import lombok.Value;

/** Canonical taxonomy entry produced by the indicator classifier. */
@Value
public class IndicatorMetadata {
    String standardCode;
    String displayName;
    int importance;
    String marketImpact;
    String unit;
    String frequency;
    String periodType;
}
