package com.nosota.tripfund.mapper;

import com.nosota.tripfund.api.dto.CostAssignmentDTO;
import com.nosota.tripfund.model.CostAssignment;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

/**
 * MapStruct mapper for CostAssignment entity to CostAssignmentDTO conversion.
 *
 * <p>ExpenseDTO itself is assembled in ExpenseService since it combines the expense,
 * its payer and its assignments.
 */
@Mapper
public interface ExpenseMapper {

    ExpenseMapper INSTANCE = Mappers.getMapper(ExpenseMapper.class);

    CostAssignmentDTO toDTO(CostAssignment assignment);

    List<CostAssignmentDTO> toDTOList(List<CostAssignment> assignments);
}
