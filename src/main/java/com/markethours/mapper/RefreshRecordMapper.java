package com.markethours.mapper;

import com.markethours.domain.model.RefreshRecord;
import com.markethours.entity.RefreshRecordEntity;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper
public interface RefreshRecordMapper {

    RefreshRecordEntity toEntity(RefreshRecord refreshRecord);

    RefreshRecord toDomain(RefreshRecordEntity entity);

    List<RefreshRecord> toDomainList(List<RefreshRecordEntity> entities);
}
