package com.adsgateway.normalize;

import com.adsgateway.core.EntityKind;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Account implements NormalizedEntity {

    String id;
    String name;
    String currency;

    /**
     * Remote status code, e.g. 1 active, 2 disabled; null when not requested
     */
    Integer status;

    /**
     * Lifetime spend in minor units; null when not requested
     */
    Long amountSpentMinor;

    Long balanceMinor;

    String timezone;

    @Override
    public EntityKind getKind() {
        return EntityKind.ACCOUNT;
    }
}
