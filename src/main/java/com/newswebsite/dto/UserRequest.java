package com.newswebsite.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Dashboard user create/update. On update every field is optional and only non-null ones are applied.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserRequest {
    private String email;
    private String password;
    private String name;
    private String role;
    private Boolean isActive;
    private Boolean isVerified;
}
