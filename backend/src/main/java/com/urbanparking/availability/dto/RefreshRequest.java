package com.urbanparking.availability.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RefreshRequest {

    @NotNull(message = "Records list cannot be null")
    private List<RawBayRecord> records;

    // street catalogue; streets listed here appear in rollups even with no bays
    private List<String> streets = new ArrayList<>();
}
