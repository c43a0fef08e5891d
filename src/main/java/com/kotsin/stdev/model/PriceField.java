package com.kotsin.stdev.model;

import java.util.function.Function;

/**
 * The three price series tracked per security.
 */
public enum PriceField {
    BID(Snapshot::getBid),
    MID(Snapshot::getMid),
    ASK(Snapshot::getAsk);

    private final Function<Snapshot, Double> extractor;

    PriceField(Function<Snapshot, Double> extractor) {
        this.extractor = extractor;
    }

    public Double valueOf(Snapshot snapshot) {
        return extractor.apply(snapshot);
    }
}
