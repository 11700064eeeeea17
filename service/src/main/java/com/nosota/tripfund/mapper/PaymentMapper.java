package com.nosota.tripfund.mapper;

import com.nosota.tripfund.api.dto.PaymentDTO;
import com.nosota.tripfund.model.Payment;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

@Mapper
public interface PaymentMapper {

    PaymentMapper INSTANCE = Mappers.getMapper(PaymentMapper.class);

    PaymentDTO toDTO(Payment payment);

    List<PaymentDTO> toDTOList(List<Payment> payments);
}
