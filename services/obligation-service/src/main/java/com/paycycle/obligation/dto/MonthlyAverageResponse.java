package com.paycycle.obligation.dto;

import com.paycycle.obligation.domain.MonthlyAverage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonthlyAverageResponse {
    private List<MonthlyAverage> averages;
    private MonthlyAverage bestMonth;
    private MonthlyAverage worstMonth;
}
