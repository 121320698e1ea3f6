package com.millennicare.identity.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.millennicare.identity.entity.User;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/** Public projection of a user. Never carries credentials. */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UserSummary {
    private String id;
    private String email;
    private String name;
    private String firstName;
    private String lastName;
    private boolean emailVerified;
    private List<String> roles;

    public static UserSummary of(User user, List<String> roles) {
        return UserSummary.builder()
                .id(user.getId() == null ? null : user.getId().toString())
                .email(user.getEmail())
                .name(user.getName())
                .firstName(user.getFirstName())
                .lastName(user.getLastName())
                .emailVerified(user.isEmailVerified())
                .roles(roles == null ? List.of() : List.copyOf(roles))
                .build();
    }
}
