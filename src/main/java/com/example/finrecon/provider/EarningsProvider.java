package com.example.finrecon.provider;

import com.example.finrecon.model.EarningsReport;

/** Marker for adapters feeding the earnings pipeline. */
public interface EarningsProvider extends ProviderAdapter<EarningsReport> {
}
