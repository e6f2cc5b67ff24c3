package com.tripmate.backend.modules.permission.application;

import java.util.UUID;

import com.tripmate.backend.modules.permission.domain.Relations;

import org.springframework.stereotype.Service;

@Service
public class CachedTravelPlanPermissions implements TravelPlanPermissions {

    private final PermissionService permissionService;

    public CachedTravelPlanPermissions(PermissionService permissionService) {
        this.permissionService = permissionService;
    }

    @Override
    public boolean canView(UUID userId, UUID travelPlanId) {
        return check(userId, travelPlanId, Relations.CAN_VIEW);
    }

    @Override
    public boolean canEdit(UUID userId, UUID travelPlanId) {
        return check(userId, travelPlanId, Relations.CAN_EDIT);
    }

    @Override
    public boolean canSuggest(UUID userId, UUID travelPlanId) {
        return check(userId, travelPlanId, Relations.CAN_SUGGEST);
    }

    private boolean check(UUID userId, UUID travelPlanId, String relation) {
        return permissionService.hasPermission(userId, Relations.TRAVEL_PLAN_TYPE, travelPlanId.toString(), relation);
    }
}
