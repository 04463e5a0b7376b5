package com.paycycle.obligation.mapper;

import com.paycycle.obligation.dto.BillerResponse;
import com.paycycle.obligation.dto.CreateBillerRequest;
import com.paycycle.obligation.dto.CreateInstallmentRequest;
import com.paycycle.obligation.dto.InstallmentResponse;
import com.paycycle.obligation.entity.Biller;
import com.paycycle.obligation.entity.Installment;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper for biller and installment conversions
 */
@Mapper(
        componentModel = "spring",
        unmappedTargetPolicy = ReportingPolicy.IGNORE
)
public interface ObligationMapper {

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "status", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    @Mapping(target = "version", ignore = true)
    Biller toEntity(CreateBillerRequest request);

    @Mapping(target = "timingBucket", expression = "java(biller.getTimingBucket().orElse(null))")
    BillerResponse toResponse(Biller biller);

    List<BillerResponse> toBillerResponseList(List<Biller> billers);

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "cumulativePaid", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    @Mapping(target = "version", ignore = true)
    Installment toEntity(CreateInstallmentRequest request);

    InstallmentResponse toResponse(Installment installment);

    List<InstallmentResponse> toInstallmentResponseList(List<Installment> installments);
}
