package com.newswebsite.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FestivalHighlightRequest {
    private String title;
    private String content;
    private String icon;
    private String bgColor;
    private String hoverBg;
    private String borderColor;
    private String textColor;
    private Integer order;
    private Boolean isActive;
}
