package com.z254.watchtower.vigil.domain.model;

import jakarta.persistence.*;
import lombok.*;

/**
 * Entry of the service catalog an incident may be attached to.
 */
@Entity
@Table(name = "catalog_services")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogService {

    @Id
    @Column(name = "id", length = 36)
    private String id;

    /** Stable slug, e.g. {@code payments-api} */
    @Column(name = "service_key", nullable = false, unique = true, length = 100)
    private String key;

    @Column(name = "name", nullable = false)
    private String name;

    public String displayLabel() {
        return name != null && !name.isBlank() ? name : key;
    }
}
