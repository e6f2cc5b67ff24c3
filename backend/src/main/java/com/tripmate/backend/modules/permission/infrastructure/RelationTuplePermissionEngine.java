package com.tripmate.backend.modules.permission.infrastructure;

import java.util.List;
import java.util.UUID;

import com.tripmate.backend.modules.permission.application.PermissionEngine;
import com.tripmate.backend.modules.permission.domain.PermissionObject;
import com.tripmate.backend.modules.permission.domain.RelationTuple;
import com.tripmate.backend.modules.permission.domain.Relations;
import com.tripmate.backend.modules.permission.infrastructure.persistence.RelationTupleRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.annotation.Transactional;

/**
 * Evaluates checks against the {@code relation_tuples} table. The superadmin tuple grants every
 * relation on every object; otherwise a direct tuple or one of the fixed role implications
 * (owner, editor, viewer) must match.
 */
@Transactional
public class RelationTuplePermissionEngine implements PermissionEngine {

    private static final Logger log = LoggerFactory.getLogger(RelationTuplePermissionEngine.class);

    private final RelationTupleRepository relationTupleRepository;

    public RelationTuplePermissionEngine(RelationTupleRepository relationTupleRepository) {
        this.relationTupleRepository = relationTupleRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public boolean check(UUID userId, String relation, PermissionObject object) {
        if (checkSuperAdmin(userId)) {
            return true;
        }
        List<String> granted = relationTupleRepository.findRelations(Relations.subject(userId), object.type(), object.id());
        return granted.stream().anyMatch(g -> Relations.implies(g, relation));
    }

    @Override
    @Transactional(readOnly = true)
    public boolean checkSuperAdmin(UUID userId) {
        PermissionObject superadmin = PermissionObject.SUPERADMIN;
        return relationTupleRepository.existsBySubjectAndRelationAndObjectTypeAndObjectId(
                Relations.subject(userId), Relations.CAN_MANAGE_ALL, superadmin.type(), superadmin.id());
    }

    @Override
    public void assignSuperAdmin(UUID userId) {
        if (checkSuperAdmin(userId)) {
            return;
        }
        relationTupleRepository.save(new RelationTuple(Relations.subject(userId), Relations.CAN_MANAGE_ALL, PermissionObject.SUPERADMIN));
        log.info("Assigned superadmin to user {}", userId);
    }

    @Override
    public void removeSuperAdmin(UUID userId) {
        PermissionObject superadmin = PermissionObject.SUPERADMIN;
        int removed = relationTupleRepository.deleteTuple(
                Relations.subject(userId), Relations.CAN_MANAGE_ALL, superadmin.type(), superadmin.id());
        log.info("Removed superadmin from user {} ({} tuple)", userId, removed);
    }

    @Override
    public void createProfileRelations(UUID userId, UUID profileId) {
        PermissionObject profile = PermissionObject.of(Relations.PROFILE_TYPE, profileId.toString());
        String subject = Relations.subject(userId);
        if (!relationTupleRepository.existsBySubjectAndRelationAndObjectTypeAndObjectId(
                subject, Relations.OWNER, profile.type(), profile.id())) {
            relationTupleRepository.save(new RelationTuple(subject, Relations.OWNER, profile));
        }
    }

    @Override
    public void deleteAllRelations(UUID userId) {
        int removed = relationTupleRepository.deleteAllBySubject(Relations.subject(userId));
        log.info("Deleted {} relation tuples of user {}", removed, userId);
    }
}
