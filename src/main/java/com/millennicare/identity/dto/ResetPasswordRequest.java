package com.millennicare.identity.dto;

import com.millennicare.identity.Validators.StrongPassword;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResetPasswordRequest {

    @NotBlank(message = "Token is required")
    private String token;

    @ToString.Exclude
    @NotBlank(message = "Password cannot be empty")
    @StrongPassword
    private String password;
}
