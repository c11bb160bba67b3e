package com.z254.watchtower.vigil.domain.model;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "app_users")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserAccount {

    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "email", nullable = false, unique = true)
    private String email;

    @Column(name = "name")
    private String name;

    /**
     * Name when present, email otherwise.
     */
    public String displayLabel() {
        return name != null && !name.isBlank() ? name : email;
    }
}
