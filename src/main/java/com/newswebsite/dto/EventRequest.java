package com.newswebsite.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body for both events and festival events. {@code date} is an ISO-8601 date or date-time.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EventRequest {
    private String title;
    private String description;
    private String date;
    private String location;
    private Boolean isOnline;
    private Boolean isActive;
    private String imageUrl;
}
