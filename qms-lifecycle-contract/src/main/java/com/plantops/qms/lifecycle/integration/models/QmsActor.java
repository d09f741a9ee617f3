package com.plantops.qms.lifecycle.integration.models;

import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.Set;

/**
 * The user performing a status change.
 */
@Getter
@Builder
@ToString
public final class QmsActor {

    @NotBlank(message = "actor id must not be blank")
    private final String id;

    private final String displayName;

    @Singular
    private final Set<String> roles;

    public static QmsActor of(String id, String... roles) {
        return QmsActor.builder().id(id).displayName(id).roles(Set.of(roles)).build();
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }
}
