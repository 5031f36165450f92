package com.venueops.catalog.repository;

import com.venueops.catalog.entity.MenuItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface MenuItemRepository extends JpaRepository<MenuItem, Long> {

    @Query("SELECT m.category FROM MenuItem m WHERE m.id = :id AND m.venueId = :venueId")
    Optional<String> findCategory(@Param("venueId") String venueId, @Param("id") Long id);
}
