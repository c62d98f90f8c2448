package com.adsgateway.normalize;

import com.adsgateway.core.EntityKind;
import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

@Value
@Builder
public class Campaign implements NormalizedEntity {

    String id;
    String name;

    /**
     * Owning ad account, always {@code act_}-prefixed
     */
    String accountId;

    String status;
    String effectiveStatus;
    String objective;

    /**
     * Budgets in minor units; null when the campaign has none at this level
     */
    Long dailyBudgetMinor;
    Long lifetimeBudgetMinor;

    OffsetDateTime createdTime;

    @Override
    public EntityKind getKind() {
        return EntityKind.CAMPAIGN;
    }
}
