package com.chambua.pricing.repository;

import com.chambua.pricing.model.CatalogProduct;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface CatalogProductRepository extends JpaRepository<CatalogProduct, Long> {

    Optional<CatalogProduct> findByExternalId(String externalId);

    @Query("select p.id as id, p.externalId as externalId from CatalogProduct p "
            + "where p.inCurrentPricelist = true and p.id > :afterId order by p.id")
    List<ListedProduct> findListedAfter(@Param("afterId") Long afterId, Pageable pageable);

    @Query("select p.id from CatalogProduct p where p.id > :afterId order by p.id")
    List<Long> findIdsAfter(@Param("afterId") Long afterId, Pageable pageable);
}
