package com.tradingcards.config;

import com.tradingcards.model.Asset;
import com.tradingcards.model.AssetType;
import com.tradingcards.service.CardCatalog;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Asset lookup table used to decode cards. Order matters: the units digit of a card identifier
 * indexes into this list modulo its size, so reordering changes what existing identifiers mean.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "tradingcards.cards")
public class CardCatalogProperties {

    private List<AssetEntry> assets = new ArrayList<>(CardCatalog.defaults().assets().stream()
            .map(AssetEntry::from)
            .toList());

    public List<Asset> toAssets() {
        return assets.stream()
                .map(a -> new Asset(a.getSymbol(), a.getName(), a.getType(), a.getPriceFeedId()))
                .toList();
    }

    @Getter
    @Setter
    public static class AssetEntry {
        private String symbol;
        private String name;
        private AssetType type = AssetType.CRYPTO;
        private String priceFeedId;

        static AssetEntry from(Asset asset) {
            AssetEntry entry = new AssetEntry();
            entry.setSymbol(asset.symbol());
            entry.setName(asset.name());
            entry.setType(asset.type());
            entry.setPriceFeedId(asset.priceFeedId());
            return entry;
        }
    }
}
