package com.adsgateway.normalize;

import com.adsgateway.core.EntityKind;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Ad implements NormalizedEntity {

    String id;
    String name;
    String adSetId;
    String campaignId;
    String status;
    String effectiveStatus;

    @Override
    public EntityKind getKind() {
        return EntityKind.AD;
    }
}
