package com.florist.flowerservice.application.ports;

import com.florist.flowerservice.domain.flower.Flower;
import com.florist.flowerservice.domain.shared.Pagination;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage port for {@link Flower}. Listings are ordered newest first ({@code created_at DESC}),
 * ties broken by {@code id DESC}.
 */
public interface FlowerRepository {

    Optional<Flower> findById(UUID id);

    List<Flower> findAll(Pagination pagination);

    long count();

    /**
     * Finds flowers whose name contains {@code query} (case-insensitive, wildcards taken literally)
     * and whose color equals {@code color} (case-insensitive). A null criterion is not applied.
     */
    List<Flower> search(String query, String color, Pagination pagination);

    /** Counts the rows {@link #search} would page through. */
    long countSearch(String query, String color);

    /** Inserts the flower and returns the stored row. */
    Flower create(Flower flower);

    /** Writes every mutable column and returns the stored row. */
    Flower update(Flower flower);

    /** Returns true when a row was removed. */
    boolean delete(UUID id);
}
