package com.ibstrader.exchange;

/** One entry of the perpetuals universe. The index is the asset id used in order actions. */
public record AssetMeta(String name, int index, int sizeDecimals, int maxLeverage) {}
