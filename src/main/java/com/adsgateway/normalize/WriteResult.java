package com.adsgateway.normalize;

import com.adsgateway.core.EntityKind;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a create or update. The remote service answers a create with the new
 * object's id and an update with a bare success flag.
 */
@Value
@Builder
public class WriteResult implements NormalizedEntity {

    /**
     * Id of the created object, or of the object that was updated
     */
    String id;

    boolean created;

    @Override
    public EntityKind getKind() {
        return EntityKind.WRITE_RESULT;
    }
}
