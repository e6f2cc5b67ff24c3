package com.tripmate.backend.modules.permission.application;

import com.tripmate.backend.modules.permission.domain.PermissionObject;

public record PermissionCheck(PermissionObject object, String relation) {
}
