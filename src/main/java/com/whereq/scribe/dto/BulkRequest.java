package com.whereq.scribe.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request to optimize a batch of pages
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkRequest {

    /**
     * Page URLs; entries may hold several URLs separated by commas or whitespace
     */
    @NotEmpty
    private List<String> urls;

    /**
     * Jobs run at once, defaults to optimizer.bulk.default-concurrency
     */
    @Min(1)
    @Max(20)
    private Integer concurrency;
}
