package com.z254.watchtower.vigil.domain.model;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "tags")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Tag {

    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "label", nullable = false, unique = true)
    private String label;
}
