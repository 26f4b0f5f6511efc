package com.discussboard.backend.modules.auth.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.discussboard.backend.modules.auth.domain.ConsentRecord;

import org.springframework.data.jpa.repository.JpaRepository;

public interface ConsentRecordRepository extends JpaRepository<ConsentRecord, UUID> {

    List<ConsentRecord> findByUserAccountIdOrderByCreatedAtAsc(UUID userAccountId);
}
