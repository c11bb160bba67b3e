package com.z254.watchtower.vigil.domain.repository;

import com.z254.watchtower.vigil.domain.model.CatalogService;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CatalogServiceRepository extends JpaRepository<CatalogService, String> {

    Optional<CatalogService> findByKey(String key);
}
