package com.example.SmartNews.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class UpgradeTierRequest {
    @NotBlank
    private String userId;

    @NotBlank
    private String tier;
}
