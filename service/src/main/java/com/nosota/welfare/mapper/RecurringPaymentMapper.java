package com.nosota.welfare.mapper;

import com.nosota.welfare.api.response.RecurringPaymentResponse;
import com.nosota.welfare.model.RecurringPayment;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

/**
 * MapStruct mapper for RecurringPayment entity to RecurringPaymentResponse conversion.
 */
@Mapper
public interface RecurringPaymentMapper {

    RecurringPaymentMapper INSTANCE = Mappers.getMapper(RecurringPaymentMapper.class);

    RecurringPaymentResponse toResponse(RecurringPayment recurringPayment);

    List<RecurringPaymentResponse> toResponseList(List<RecurringPayment> recurringPayments);
}
