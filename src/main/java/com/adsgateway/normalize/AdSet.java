package com.adsgateway.normalize;

import com.adsgateway.core.EntityKind;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AdSet implements NormalizedEntity {

    String id;
    String name;
    String campaignId;
    String accountId;
    String status;
    String effectiveStatus;
    String optimizationGoal;
    Long dailyBudgetMinor;
    Long lifetimeBudgetMinor;

    @Override
    public EntityKind getKind() {
        return EntityKind.AD_SET;
    }
}
