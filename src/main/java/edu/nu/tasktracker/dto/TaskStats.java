package edu.nu.tasktracker.dto;

import lombok.*;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TaskStats {
    private long total;
    private long completed;
    private long pending;
    // percentage, two decimal places
    private BigDecimal completionRate;
}
