package com.paycycle.obligation.mapper;

import com.paycycle.obligation.dto.PaymentScheduleResponse;
import com.paycycle.obligation.entity.PaymentSchedule;
import org.mapstruct.Context;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

import java.time.LocalDate;
import java.util.List;

/**
 * MapStruct mapper for payment schedules; status is derived at the given date
 */
@Mapper(
        componentModel = "spring",
        unmappedTargetPolicy = ReportingPolicy.IGNORE
)
public interface PaymentScheduleMapper {

    @Mapping(target = "status", expression = "java(schedule.statusAsOf(asOf))")
    PaymentScheduleResponse toResponse(PaymentSchedule schedule, @Context LocalDate asOf);

    List<PaymentScheduleResponse> toResponseList(List<PaymentSchedule> schedules, @Context LocalDate asOf);
}
