package org.example.content.repository;

import org.example.content.entity.ProductionProgressEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ProductionProgressRepository extends JpaRepository<ProductionProgressEntity, String> {

    Optional<ProductionProgressEntity> findFirstByEntityIdOrderByUpdatedAtDesc(String entityId);
}
