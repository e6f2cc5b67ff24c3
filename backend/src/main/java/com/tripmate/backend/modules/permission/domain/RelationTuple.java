package com.tripmate.backend.modules.permission.domain;

import com.tripmate.backend.global.jpa.AbstractUuidEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

@Entity
@Table(
        name = "relation_tuples",
        uniqueConstraints = @UniqueConstraint(name = "uq_relation_tuple",
                columnNames = {"subject", "relation", "object_type", "object_id"})
)
public class RelationTuple extends AbstractUuidEntity {

    @Column(name = "subject", nullable = false, length = 200)
    private String subject;

    @Column(name = "relation", nullable = false, length = 100)
    private String relation;

    @Column(name = "object_type", nullable = false, length = 100)
    private String objectType;

    @Column(name = "object_id", nullable = false, length = 200)
    private String objectId;

    protected RelationTuple() {
    }

    public RelationTuple(String subject, String relation, PermissionObject object) {
        this.subject = subject;
        this.relation = relation;
        this.objectType = object.type();
        this.objectId = object.id();
    }

    public String getSubject() {
        return subject;
    }

    public String getRelation() {
        return relation;
    }

    public String getObjectType() {
        return objectType;
    }

    public String getObjectId() {
        return objectId;
    }
}
