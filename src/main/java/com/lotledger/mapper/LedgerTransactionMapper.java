package com.lotledger.mapper;

import com.lotledger.domain.model.LedgerTransaction;
import com.lotledger.entity.LedgerTransactionEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.MappingTarget;

/**
 * MapStruct mapper between the LedgerTransaction domain model and LedgerTransactionEntity.
 */
@Mapper
public interface LedgerTransactionMapper {

    LedgerTransactionEntity toEntity(LedgerTransaction transaction);

    LedgerTransaction toDomain(LedgerTransactionEntity entity);

    List<LedgerTransaction> toDomainList(List<LedgerTransactionEntity> entities);

    /** Copies the editable fields of {@code transaction} onto a managed entity. */
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    void updateEntity(LedgerTransaction transaction, @MappingTarget LedgerTransactionEntity entity);
}
