package com.newswebsite.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class NewsletterSubscribeRequest {
    private String email;
    private String firstName;
    private String lastName;
    private String countryCode;
}
