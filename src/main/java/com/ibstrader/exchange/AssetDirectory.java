package com.ibstrader.exchange;

import com.ibstrader.exception.ExchangeException;
import java.util.List;

/** Lazily loaded, cached view of the perpetuals universe. */
public class AssetDirectory {

    private final HyperliquidInfoService infoService;
    private volatile List<AssetMeta> universe;

    public AssetDirectory(HyperliquidInfoService infoService) {
        this.infoService = infoService;
    }

    /**
     * @throws ExchangeException if the universe cannot be loaded or does not list the symbol
     */
    public AssetMeta require(String symbol) {
        List<AssetMeta> assets = universe;
        if (assets == null) {
            assets = infoService.meta();
            universe = assets;
        }
        return assets.stream()
                .filter(asset -> asset.name().equalsIgnoreCase(symbol))
                .findFirst()
                .orElseThrow(() -> ExchangeException.rejected("Unknown asset " + symbol));
    }
}
