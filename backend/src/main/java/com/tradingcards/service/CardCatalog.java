package com.tradingcards.service;

import com.tradingcards.model.Asset;
import com.tradingcards.model.AssetType;
import com.tradingcards.model.Direction;
import com.tradingcards.model.PredictionType;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable lookup tables a card identifier is decoded against.
 * Every lookup is taken modulo the table length, so any index resolves to an entry.
 */
public final class CardCatalog {

    public static final List<Integer> DEFAULT_TARGET_RANGES_BPS =
            List.of(100, 200, 300, 500, 1000, 1500, 2000, 2500, 3000, 5000);
    public static final List<Integer> DEFAULT_PERCENTAGE_CHANGE_RANGES_BPS =
            List.of(100, 200, 300, 500, 1000, 1500, 2000, 2500, 3000, 5000);

    private final List<Asset> assets;
    private final List<PredictionType> predictionTypes;
    private final List<Direction> directions;
    private final List<Integer> targetRangesBps;
    private final List<Integer> percentageChangeRangesBps;

    private CardCatalog(List<Asset> assets,
                        List<PredictionType> predictionTypes,
                        List<Direction> directions,
                        List<Integer> targetRangesBps,
                        List<Integer> percentageChangeRangesBps) {
        this.assets = requireNonEmpty(assets, "assets");
        this.predictionTypes = requireNonEmpty(predictionTypes, "predictionTypes");
        this.directions = requireNonEmpty(directions, "directions");
        this.targetRangesBps = requireNonEmpty(targetRangesBps, "targetRangesBps");
        this.percentageChangeRangesBps = requireNonEmpty(percentageChangeRangesBps, "percentageChangeRangesBps");
    }

    public static CardCatalog of(List<Asset> assets) {
        return new CardCatalog(
                assets,
                List.of(PredictionType.values()),
                List.of(Direction.values()),
                DEFAULT_TARGET_RANGES_BPS,
                DEFAULT_PERCENTAGE_CHANGE_RANGES_BPS
        );
    }

    public static CardCatalog defaults() {
        return of(List.of(
                new Asset("BTC", "Bitcoin", AssetType.CRYPTO,
                        "0xe62df6c8b4a85fe1a67db44dc12de5db330f7ac66b72dc658afedf0f4a415b43"),
                new Asset("ETH", "Ethereum", AssetType.CRYPTO,
                        "0xff61491a931112ddf1bd8147cd1b641375f79f5825126d665480874634fd0ace"),
                new Asset("SOL", "Solana", AssetType.CRYPTO,
                        "0xef0d8b6fda2ceba41da15d4095d1da392a0d2f8ed0c6c7bc0f4cfac8c280b56d"),
                new Asset("USDC", "USD Coin", AssetType.CRYPTO,
                        "0xeaa020c61cc479712813461ce153894a96a6c00b21ed0cfc2798d1f9a9e9c94a"),
                new Asset("CELO", "Celo", AssetType.CRYPTO,
                        "0x7d669ddcdd23d9ef1fa4aae953c630f8a3dc2f93876c1909b9bc3d5c97116516"),
                new Asset("AAPL", "Apple Inc.", AssetType.STOCK,
                        "0x49f6b65cb1de6b10eaf75e7c03ca029c306d0357e91b5311b175084a5ad55688"),
                new Asset("TSLA", "Tesla Inc.", AssetType.STOCK,
                        "0x16dad506d7db8da01c87581c87ca897a012a153557d4d578c3b9c9e1bc0632f1"),
                new Asset("GOOGL", "Alphabet Inc.", AssetType.STOCK,
                        "0x26b3bc67befc214058ca78ea9a2690298d731a2d4309485ec3d401b68f5c5c5e")
        ));
    }

    public Asset assetAt(int index) {
        return assets.get(Math.floorMod(index, assets.size()));
    }

    public PredictionType predictionTypeAt(int index) {
        return predictionTypes.get(Math.floorMod(index, predictionTypes.size()));
    }

    public Direction directionAt(int index) {
        return directions.get(Math.floorMod(index, directions.size()));
    }

    public int targetRangeBpsAt(int index) {
        return targetRangesBps.get(Math.floorMod(index, targetRangesBps.size()));
    }

    public int percentageChangeBpsAt(int index) {
        return percentageChangeRangesBps.get(Math.floorMod(index, percentageChangeRangesBps.size()));
    }

    public Optional<Asset> findByPriceFeedId(String priceFeedId) {
        if (priceFeedId == null) {
            return Optional.empty();
        }
        String normalized = normalizeFeedId(priceFeedId);
        return assets.stream()
                .filter(asset -> normalizeFeedId(asset.priceFeedId()).equals(normalized))
                .findFirst();
    }

    public List<Asset> assets() {
        return assets;
    }

    public static String normalizeFeedId(String feedId) {
        String trimmed = feedId.trim().toLowerCase();
        return trimmed.startsWith("0x") ? trimmed : "0x" + trimmed;
    }

    private static <T> List<T> requireNonEmpty(List<T> values, String name) {
        Objects.requireNonNull(values, name + " is required");
        if (values.isEmpty()) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
        return List.copyOf(values);
    }
}
