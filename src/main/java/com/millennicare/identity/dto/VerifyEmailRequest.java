package com.millennicare.identity.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerifyEmailRequest {

    @NotBlank(message = "Token is required")
    private String token;

    /** Optional. When present it must match the code that was emailed with the token. */
    @Pattern(regexp = "^\\d{6}$", message = "Code must be 6 digits")
    private String code;
}
