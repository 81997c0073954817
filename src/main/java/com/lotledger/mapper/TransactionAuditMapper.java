package com.lotledger.mapper;

import com.lotledger.domain.model.AuditEntry;
import com.lotledger.entity.TransactionAuditEntity;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper
public interface TransactionAuditMapper {

    TransactionAuditEntity toEntity(AuditEntry entry);

    AuditEntry toDomain(TransactionAuditEntity entity);

    List<AuditEntry> toDomainList(List<TransactionAuditEntity> entities);
}
