package com.paycycle.obligation.mapper;

import com.paycycle.obligation.dto.BudgetLineItemDto;
import com.paycycle.obligation.dto.BudgetSnapshotResponse;
import com.paycycle.obligation.entity.BudgetLineItem;
import com.paycycle.obligation.entity.BudgetSnapshot;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * MapStruct mapper for budget snapshots and their line items
 */
@Mapper(
        componentModel = "spring",
        unmappedTargetPolicy = ReportingPolicy.IGNORE
)
public interface BudgetSnapshotMapper {

    @Mapping(target = "itemsByCategory", expression = "java(groupItems(snapshot))")
    BudgetSnapshotResponse toResponse(BudgetSnapshot snapshot);

    default BudgetLineItem toEntity(BudgetLineItemDto dto) {
        return BudgetLineItem.builder()
                .category(dto.getCategory())
                .label(dto.getLabel())
                .amount(dto.getAmount())
                .included(dto.getIncluded() == null || dto.getIncluded())
                .obligationId(dto.getObligationId())
                .build();
    }

    default List<BudgetLineItem> toEntityList(List<BudgetLineItemDto> dtos) {
        return dtos.stream().map(this::toEntity).collect(Collectors.toList());
    }

    default BudgetLineItemDto toDto(BudgetLineItem item) {
        return BudgetLineItemDto.builder()
                .category(item.getCategory())
                .label(item.getLabel())
                .amount(item.getAmount())
                .included(item.isIncluded())
                .obligationId(item.getObligationId())
                .build();
    }

    default Map<String, List<BudgetLineItemDto>> groupItems(BudgetSnapshot snapshot) {
        Map<String, List<BudgetLineItemDto>> grouped = new LinkedHashMap<>();
        snapshot.getItemsByCategory().forEach((category, items) ->
                grouped.put(category, items.stream().map(this::toDto).collect(Collectors.toList())));
        return grouped;
    }
}
