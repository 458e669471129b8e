package com.chambua.inventory.repository;

import com.chambua.inventory.model.InventoryItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface InventoryItemRepository extends JpaRepository<InventoryItem, Long> {

    Optional<InventoryItem> findBySku(String sku);

    List<InventoryItem> findBySkuIn(Collection<String> skus);

    @Query("select i.sku from InventoryItem i")
    List<String> findAllSkus();

    // Fetch-join references so the exporter can read names outside a transaction
    @Query("select i from InventoryItem i join fetch i.location l left join fetch i.category c left join fetch i.supplier s " +
            "where i.active = true " +
            "and (:locationId is null or l.id = :locationId) " +
            "and (:categoryId is null or c.id = :categoryId) " +
            "order by i.sku asc")
    List<InventoryItem> findActiveForExport(@Param("locationId") Long locationId, @Param("categoryId") Long categoryId);
}
