package com.nosota.tripfund.mapper;

import com.nosota.tripfund.api.dto.TimelineItemDTO;
import com.nosota.tripfund.api.response.TripResponse;
import com.nosota.tripfund.model.TimelineItem;
import com.nosota.tripfund.model.Trip;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

/**
 * MapStruct mapper for Trip and TimelineItem entities.
 */
@Mapper
public interface TripMapper {

    TripMapper INSTANCE = Mappers.getMapper(TripMapper.class);

    TripResponse toResponse(Trip trip);

    TimelineItemDTO toDTO(TimelineItem item);

    List<TimelineItemDTO> toTimelineDTOList(List<TimelineItem> items);
}
