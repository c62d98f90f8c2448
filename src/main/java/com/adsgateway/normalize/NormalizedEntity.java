package com.adsgateway.normalize;

import com.adsgateway.core.EntityKind;

/**
 * Canonical internal representation of a remote object after parsing and unit conversion.
 */
public interface NormalizedEntity {

    String getId();

    EntityKind getKind();
}
