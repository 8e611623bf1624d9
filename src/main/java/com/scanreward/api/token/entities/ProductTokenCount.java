package com.scanreward.api.token.entities;

/**
 * A projection of the number of issued and redeemed tokens for a single product.
 */
public interface ProductTokenCount {

    String getProductName();

    long getTotal();

    long getRedeemed();
}
