package com.example.finrecon.provider;

import com.example.finrecon.model.EconomicIndicator;

/** Marker for adapters feeding the economic indicator pipeline. */
public interface IndicatorProvider extends ProviderAdapter<EconomicIndicator> {
}
