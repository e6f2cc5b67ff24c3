package com.tripmate.backend.modules.permission.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.tripmate.backend.modules.permission.domain.RelationTuple;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RelationTupleRepository extends JpaRepository<RelationTuple, UUID> {

    boolean existsBySubjectAndRelationAndObjectTypeAndObjectId(
            String subject, String relation, String objectType, String objectId);

    @Query("""
            select t.relation
              from RelationTuple t
             where t.subject = :subject
               and t.objectType = :objectType
               and t.objectId = :objectId
            """)
    List<String> findRelations(@Param("subject") String subject,
                               @Param("objectType") String objectType,
                               @Param("objectId") String objectId);

    @Modifying
    @Query("""
            delete from RelationTuple t
             where t.subject = :subject
               and t.relation = :relation
               and t.objectType = :objectType
               and t.objectId = :objectId
            """)
    int deleteTuple(@Param("subject") String subject,
                    @Param("relation") String relation,
                    @Param("objectType") String objectType,
                    @Param("objectId") String objectId);

    @Modifying
    @Query("delete from RelationTuple t where t.subject = :subject")
    int deleteAllBySubject(@Param("subject") String subject);
}
