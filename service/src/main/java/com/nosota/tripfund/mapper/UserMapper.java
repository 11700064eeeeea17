package com.nosota.tripfund.mapper;

import com.nosota.tripfund.api.dto.UserSummaryDTO;
import com.nosota.tripfund.api.response.UserResponse;
import com.nosota.tripfund.model.AppUser;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.factory.Mappers;

/**
 * MapStruct mapper for AppUser entity.
 */
@Mapper
public interface UserMapper {

    UserMapper INSTANCE = Mappers.getMapper(UserMapper.class);

    @Mapping(target = "userId", source = "id")
    @Mapping(target = "photoURL", source = "photoUrl")
    UserResponse toResponse(AppUser user);

    /**
     * Maps to the short form embedded in expenses; name falls back to email.
     */
    @Mapping(target = "photoURL", source = "photoUrl")
    UserSummaryDTO toSummary(AppUser user);
}
