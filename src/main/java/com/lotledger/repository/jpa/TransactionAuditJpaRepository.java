package com.lotledger.repository.jpa;

import com.lotledger.entity.TransactionAuditEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * JPA repository for the transaction_audit table.
 */
@Repository
public interface TransactionAuditJpaRepository extends JpaRepository<TransactionAuditEntity, Long> {

    List<TransactionAuditEntity> findByRecordIdOrderByTimestampAscIdAsc(Long recordId);

    long countByRecordId(Long recordId);

    @Modifying
    @Transactional
    @Query("DELETE FROM TransactionAuditEntity a WHERE a.recordId = :recordId")
    int deleteByRecordId(@Param("recordId") Long recordId);
}
