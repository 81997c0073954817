package com.lotledger.repository.jpa;

import com.lotledger.domain.enums.TransactionType;
import com.lotledger.entity.LedgerTransactionEntity;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the ledger_transactions table.
 * Every list query returns records in FIFO order: transaction date ascending, ties broken by id.
 */
@Repository
public interface LedgerTransactionJpaRepository extends JpaRepository<LedgerTransactionEntity, Long> {

    List<LedgerTransactionEntity> findByInstrumentIdOrderByTransactionDateAscIdAsc(String instrumentId);

    List<LedgerTransactionEntity> findByInstrumentIdAndTransactionTypeOrderByTransactionDateAscIdAsc(
            String instrumentId, TransactionType transactionType);

    List<LedgerTransactionEntity> findAllByOrderByTransactionDateAscIdAsc();

    boolean existsByInstrumentIdAndTransactionTypeAndTransactionDateAfter(
            String instrumentId, TransactionType transactionType, LocalDate date);

    @Query("SELECT COALESCE(SUM(t.quantity), 0) FROM LedgerTransactionEntity t "
            + "WHERE t.instrumentId = :instrumentId AND t.transactionType = :type AND t.transactionDate < :date")
    BigDecimal sumQuantityBefore(
            @Param("instrumentId") String instrumentId,
            @Param("type") TransactionType type,
            @Param("date") LocalDate date);

    @Query("SELECT COALESCE(SUM(t.quantity), 0) FROM LedgerTransactionEntity t "
            + "WHERE t.instrumentId = :instrumentId AND t.transactionType = :type")
    BigDecimal sumQuantity(@Param("instrumentId") String instrumentId, @Param("type") TransactionType type);

    long countByInstrumentIdAndTransactionDateGreaterThanEqualAndIdNot(
            String instrumentId, LocalDate date, Long excludedId);

    @Query("SELECT DISTINCT t.instrumentId FROM LedgerTransactionEntity t ORDER BY t.instrumentId")
    List<String> findDistinctInstrumentIds();
}
