package com.newswebsite.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ContactRequest {
    private String firstName;
    private String lastName;
    private String email;
    private String phone;
    private String message;
}
