package com.lotledger.mapper;

import com.lotledger.api.dto.request.EditTransactionRequest;
import com.lotledger.domain.model.TransactionEdit;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper from edit request DTOs to the TransactionEdit domain model.
 */
@Mapper
public interface TransactionRequestMapper {

    TransactionEdit toEdit(EditTransactionRequest request);
}
