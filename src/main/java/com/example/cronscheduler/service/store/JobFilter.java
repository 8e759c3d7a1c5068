package com.example.cronscheduler.service.store;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional list filters, null means no filter
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobFilter {
    private Boolean active;
    private String tenantId;

    public static JobFilter all() {
        return new JobFilter();
    }
}
