package com.tripmate.backend.modules.permission.application;

import java.util.UUID;

/**
 * Checks that trip-planning endpoints run before touching a travel plan.
 */
public interface TravelPlanPermissions {

    boolean canView(UUID userId, UUID travelPlanId);

    boolean canEdit(UUID userId, UUID travelPlanId);

    boolean canSuggest(UUID userId, UUID travelPlanId);
}
