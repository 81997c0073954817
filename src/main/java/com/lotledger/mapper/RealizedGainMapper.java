package com.lotledger.mapper;

import com.lotledger.domain.model.RealizedGain;
import com.lotledger.entity.RealizedGainEntity;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper
public interface RealizedGainMapper {

    RealizedGainEntity toEntity(RealizedGain gain);

    RealizedGain toDomain(RealizedGainEntity entity);

    List<RealizedGain> toDomainList(List<RealizedGainEntity> entities);

    List<RealizedGainEntity> toEntityList(List<RealizedGain> gains);
}
