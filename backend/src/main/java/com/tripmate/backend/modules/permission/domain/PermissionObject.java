package com.tripmate.backend.modules.permission.domain;

/**
 * Object side of a relation tuple, rendered as {@code type:id}.
 */
public record PermissionObject(String type, String id) {

    public static final PermissionObject SUPERADMIN = new PermissionObject("superadmin", "global");

    public PermissionObject {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("object type must not be blank");
        }
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("object id must not be blank");
        }
    }

    public static PermissionObject of(String type, String id) {
        return new PermissionObject(type, id);
    }

    public static PermissionObject parse(String value) {
        int separator = value == null ? -1 : value.indexOf(':');
        if (separator <= 0 || separator == value.length() - 1) {
            throw new IllegalArgumentException("Expected type:id but got " + value);
        }
        return new PermissionObject(value.substring(0, separator), value.substring(separator + 1));
    }

    @Override
    public String toString() {
        return type + ":" + id;
    }
}
