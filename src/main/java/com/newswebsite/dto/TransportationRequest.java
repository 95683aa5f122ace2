package com.newswebsite.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TransportationRequest {
    private String type;
    private String title;
    private String icon;
    private String bgColor;
    private String textColor;
    private String details;
    private String tip;
    private String tipColor;
    private Integer order;
    private Boolean isActive;
}
