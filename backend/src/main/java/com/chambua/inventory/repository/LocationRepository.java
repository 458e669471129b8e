package com.chambua.inventory.repository;

import com.chambua.inventory.model.Location;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface LocationRepository extends JpaRepository<Location, Long> {
    List<Location> findAllByOrderByIdAsc();
}
