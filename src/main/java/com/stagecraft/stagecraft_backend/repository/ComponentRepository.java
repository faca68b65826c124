package com.stagecraft.stagecraft_backend.repository;

import com.stagecraft.stagecraft_backend.model.domain.Component;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface ComponentRepository extends JpaRepository<Component, UUID> {

    // Newest first, for the component library list
    List<Component> findAllByOrderByCreatedAtDesc();

    List<Component> findByStage(String stage);

    List<Component> findByNameContainingIgnoreCase(String name);

    List<Component> findByOutputType(String outputType);

    long countByStage(String stage);
}
