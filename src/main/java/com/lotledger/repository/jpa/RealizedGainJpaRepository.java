package com.lotledger.repository.jpa;

import com.lotledger.entity.RealizedGainEntity;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * JPA repository for the realized_gains table.
 * Lot availability is derived from these rows on every call ({@link #sumQuantityByAcquisitionId}),
 * never cached on the acquisition.
 */
@Repository
public interface RealizedGainJpaRepository extends JpaRepository<RealizedGainEntity, Long> {

    List<RealizedGainEntity> findByDisposalIdOrderByIdAsc(Long disposalId);

    List<RealizedGainEntity> findByAcquisitionIdOrderByIdAsc(Long acquisitionId);

    List<RealizedGainEntity> findByInstrumentIdOrderByDisposalDateAscIdAsc(String instrumentId);

    @Query("SELECT COALESCE(SUM(g.quantity), 0) FROM RealizedGainEntity g WHERE g.acquisitionId = :acquisitionId")
    BigDecimal sumQuantityByAcquisitionId(@Param("acquisitionId") Long acquisitionId);

    @Query("SELECT COALESCE(SUM(g.quantity), 0) FROM RealizedGainEntity g WHERE g.disposalId = :disposalId")
    BigDecimal sumQuantityByDisposalId(@Param("disposalId") Long disposalId);

    /** Rows of {@code [acquisitionId, matchedQuantity]} for the given acquisitions. */
    @Query("SELECT g.acquisitionId, SUM(g.quantity) FROM RealizedGainEntity g "
            + "WHERE g.acquisitionId IN :acquisitionIds GROUP BY g.acquisitionId")
    List<Object[]> sumQuantityGroupedByAcquisitionId(@Param("acquisitionIds") Collection<Long> acquisitionIds);

    /** Gains whose disposal falls in the financial year labelled e.g. "2024-25". */
    List<RealizedGainEntity> findByFinancialYearOrderByDisposalDateAscIdAsc(String financialYear);

    @Modifying
    @Transactional
    @Query("DELETE FROM RealizedGainEntity g WHERE g.disposalId IN :disposalIds")
    int deleteByDisposalIds(@Param("disposalIds") Collection<Long> disposalIds);
}
