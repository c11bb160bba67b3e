package com.z254.watchtower.vigil.domain.repository;

import com.z254.watchtower.vigil.domain.model.Tag;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TagRepository extends JpaRepository<Tag, String> {
}
