package com.discussboard.backend.modules.platform.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.discussboard.backend.modules.platform.domain.ForbiddenWord;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ForbiddenWordRepository extends JpaRepository<ForbiddenWord, UUID> {

    @Query("select w from ForbiddenWord w where w.id = :id and w.deletedAt is null")
    Optional<ForbiddenWord> findActiveById(@Param("id") UUID id);

    @Query("select w from ForbiddenWord w where w.deletedAt is null")
    List<ForbiddenWord> findAllActive();

    @Query("""
            select count(w) > 0
              from ForbiddenWord w
             where lower(w.expression) = lower(:expression)
               and w.deletedAt is null
            """)
    boolean existsActiveByExpression(@Param("expression") String expression);

    @Query(value = """
            select w
              from ForbiddenWord w
             where w.deletedAt is null
               and (:expressionPattern is null or lower(w.expression) like :expressionPattern escape '\\')
            """,
            countQuery = """
            select count(w)
              from ForbiddenWord w
             where w.deletedAt is null
               and (:expressionPattern is null or lower(w.expression) like :expressionPattern escape '\\')
            """)
    Page<ForbiddenWord> search(@Param("expressionPattern") String expressionPattern, Pageable pageable);
}
