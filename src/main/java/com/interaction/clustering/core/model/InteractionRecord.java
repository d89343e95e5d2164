package com.interaction.clustering.core.model;

import java.time.Instant;

/**
 * One interaction (transaction) between a cardholder and a merchant.
 * Repeated records for the same pair accumulate weight; they never form distinct edges.
 *
 * @param cardholderId raw cardholder id (without namespace prefix)
 * @param merchantId   raw merchant id (without namespace prefix)
 * @param weight       positive interaction weight, 1 when the source carries none
 * @param timestamp    optional event time, may be null
 */
public record InteractionRecord(String cardholderId, String merchantId, long weight, Instant timestamp) {

    public static final long DEFAULT_WEIGHT = 1L;

    public static InteractionRecord of(String cardholderId, String merchantId) {
        return new InteractionRecord(cardholderId, merchantId, DEFAULT_WEIGHT, null);
    }

    public static InteractionRecord of(String cardholderId, String merchantId, long weight) {
        return new InteractionRecord(cardholderId, merchantId, weight, null);
    }

    public EntityId cardholder() {
        return EntityId.cardholder(cardholderId);
    }

    public EntityId merchant() {
        return EntityId.merchant(merchantId);
    }
}
