package com.markethours.mapper;

import com.markethours.domain.model.EarlyCloseOverride;
import com.markethours.domain.model.Holiday;
import com.markethours.entity.EarlyCloseOverrideEntity;
import com.markethours.entity.HolidayEntity;
import java.util.List;
import org.mapstruct.Mapper;

/** MapStruct mapper between the calendar domain models and their JPA entities. */
@Mapper
public interface CalendarMapper {

    HolidayEntity toEntity(Holiday holiday);

    Holiday toDomain(HolidayEntity entity);

    List<HolidayEntity> toHolidayEntities(List<Holiday> holidays);

    List<Holiday> toHolidays(List<HolidayEntity> entities);

    EarlyCloseOverrideEntity toEntity(EarlyCloseOverride override);

    EarlyCloseOverride toDomain(EarlyCloseOverrideEntity entity);

    List<EarlyCloseOverrideEntity> toOverrideEntities(List<EarlyCloseOverride> overrides);

    List<EarlyCloseOverride> toOverrides(List<EarlyCloseOverrideEntity> entities);
}
