package com.tripmate.backend.modules.permission.domain;

import java.util.Map;
import java.util.Set;
import java.util.UUID;

public final class Relations {

    public static final String CAN_MANAGE_ALL = "can_manage_all";

    public static final String OWNER = "owner";
    public static final String EDITOR = "editor";
    public static final String VIEWER = "viewer";

    public static final String CAN_VIEW = "can_view";
    public static final String CAN_EDIT = "can_edit";
    public static final String CAN_SUGGEST = "can_suggest";
    public static final String CAN_DELETE = "can_delete";

    public static final String PROFILE_TYPE = "profile";
    public static final String TRAVEL_PLAN_TYPE = "travel_plan";

    private static final Map<String, Set<String>> IMPLIED = Map.of(
            OWNER, Set.of(OWNER, CAN_EDIT, CAN_VIEW, CAN_SUGGEST, CAN_DELETE),
            EDITOR, Set.of(EDITOR, CAN_EDIT, CAN_VIEW, CAN_SUGGEST),
            VIEWER, Set.of(VIEWER, CAN_VIEW)
    );

    private Relations() {
    }

    /**
     * True when holding {@code granted} on an object also grants {@code requested} on it.
     */
    public static boolean implies(String granted, String requested) {
        if (granted.equals(requested)) {
            return true;
        }
        Set<String> implied = IMPLIED.get(granted);
        return implied != null && implied.contains(requested);
    }

    public static String subject(UUID userId) {
        return "user:" + userId;
    }
}
