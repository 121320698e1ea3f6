package com.millennicare.identity.model;

import com.millennicare.identity.entity.User;
import lombok.Builder;

/**
 * Partial update of a {@link User}. Fields left out of the builder stay unchanged.
 * {@code name} is required on the entity, so an explicit null for it is ignored.
 */
@Builder
public record UserUpdate(
        FieldPatch<String> name,
        FieldPatch<String> firstName,
        FieldPatch<String> lastName,
        FieldPatch<Boolean> emailVerified
) {

    public UserUpdate {
        name = FieldPatch.orUnset(name);
        firstName = FieldPatch.orUnset(firstName);
        lastName = FieldPatch.orUnset(lastName);
        emailVerified = FieldPatch.orUnset(emailVerified);
    }

    public void applyTo(User user) {
        name.ifSet(v -> {
            if (v != null) user.setName(v);
        });
        firstName.ifSet(user::setFirstName);
        lastName.ifSet(user::setLastName);
        emailVerified.ifSet(v -> user.setEmailVerified(Boolean.TRUE.equals(v)));
    }
}
