package it.floro.soilstats.domain;

/**
 * Valore di una cella attribuito a una feature.
 */
public record ValueSample(int featureIndex, float value) {}
