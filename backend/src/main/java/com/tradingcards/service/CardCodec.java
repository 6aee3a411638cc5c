package com.tradingcards.service;

import com.tradingcards.model.Card;
import com.tradingcards.model.CardAttributes;
import com.tradingcards.model.Direction;
import com.tradingcards.model.PredictionType;

/**
 * Maps a four-digit card identifier to its card by base-10 digit extraction:
 * units -> asset, tens -> prediction type, hundreds -> direction, thousands -> target range.
 * Pure and total over {@code [MIN_IDENTIFIER, MAX_IDENTIFIER]}.
 */
public final class CardCodec {

    public static final int MIN_IDENTIFIER = 0;
    public static final int MAX_IDENTIFIER = 9_999;
    public static final int IDENTIFIER_SPACE = MAX_IDENTIFIER + 1;

    private CardCodec() {
    }

    public static boolean isValidIdentifier(int identifier) {
        return identifier >= MIN_IDENTIFIER && identifier <= MAX_IDENTIFIER;
    }

    public static CardAttributes decode(int identifier) {
        if (!isValidIdentifier(identifier)) {
            throw new IllegalArgumentException(
                    "Card identifier must be between " + MIN_IDENTIFIER + " and " + MAX_IDENTIFIER + ", got " + identifier);
        }
        return new CardAttributes(
                identifier % 10,
                (identifier / 10) % 10,
                (identifier / 100) % 10,
                (identifier / 1_000) % 10
        );
    }

    public static Card toCard(int identifier, CardCatalog catalog) {
        CardAttributes attributes = decode(identifier);
        PredictionType type = catalog.predictionTypeAt(attributes.predictionTypeIndex());

        Integer targetBps = null;
        Integer percentageChangeBps = null;
        Direction direction = null;
        if (type.hasTarget()) {
            targetBps = catalog.targetRangeBpsAt(attributes.targetIndex());
        } else if (type == PredictionType.PERCENTAGE_CHANGE) {
            percentageChangeBps = catalog.percentageChangeBpsAt(attributes.targetIndex());
            direction = catalog.directionAt(attributes.directionIndex());
        }

        return new Card(
                identifier,
                catalog.assetAt(attributes.assetIndex()),
                type,
                targetBps,
                percentageChangeBps,
                direction
        );
    }
}
