package com.discussboard.backend.modules.platform.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.discussboard.backend.modules.platform.domain.Setting;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SettingRepository extends JpaRepository<Setting, UUID> {

    Optional<Setting> findByConfigKey(String configKey);

    @Query(value = """
            select s
              from Setting s
             where (:keyPattern is null or lower(s.configKey) like :keyPattern escape '\\')
            """,
            countQuery = """
            select count(s)
              from Setting s
             where (:keyPattern is null or lower(s.configKey) like :keyPattern escape '\\')
            """)
    Page<Setting> search(@Param("keyPattern") String keyPattern, Pageable pageable);
}
