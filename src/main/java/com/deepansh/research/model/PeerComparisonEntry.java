package com.deepansh.research.model;

public record PeerComparisonEntry(String ticker, Double peRatio, Double pbRatio, Double psRatio) {
}
