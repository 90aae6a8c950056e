package com.florist.flowerservice.application.usecase;

import com.florist.flowerservice.application.dto.CreateFlowerRequest;
import com.florist.flowerservice.application.dto.FlowerResponse;
import com.florist.flowerservice.application.dto.UpdateFlowerRequest;
import com.florist.flowerservice.application.ports.FlowerRepository;
import com.florist.flowerservice.domain.flower.Flower;
import com.florist.flowerservice.domain.flower.FlowerErrors;
import com.florist.flowerservice.domain.shared.Page;
import com.florist.flowerservice.domain.shared.Pagination;
import com.florist.flowerservice.infrastructure.observability.FlowerMetrics;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Flower catalog operations exposed over HTTP.
 *
 * <p>Every method either returns a DTO or throws a {@link
 * com.florist.flowerservice.domain.shared.DomainException}; storage failures surface as Spring's
 * {@code DataAccessException}.
 */
@Service
public class FlowerUseCase {

    private static final Logger log = LoggerFactory.getLogger(FlowerUseCase.class);

    private final FlowerRepository repository;
    private final FlowerMetrics metrics;

    public FlowerUseCase(FlowerRepository repository, FlowerMetrics metrics) {
        this.repository = repository;
        this.metrics = metrics;
    }

    public FlowerResponse getFlower(UUID id) {
        return repository
                .findById(id)
                .map(FlowerResponse::from)
                .orElseThrow(() -> FlowerErrors.notFound(id));
    }

    public Page<FlowerResponse> listFlowers(Pagination pagination) {
        List<Flower> flowers = repository.findAll(pagination);
        long total = repository.count();
        return Page.of(flowers, total, pagination).map(FlowerResponse::from);
    }

    /**
     * Pages through flowers matching the given criteria.
     *
     * @param search substring of the name, case-insensitive; null or blank to skip
     * @param color exact color, case-insensitive; null or blank to skip
     */
    public Page<FlowerResponse> searchFlowers(String search, String color, Pagination pagination) {
        String query = blankToNull(search);
        String colorFilter = blankToNull(color);
        List<Flower> flowers = repository.search(query, colorFilter, pagination);
        long total = repository.countSearch(query, colorFilter);
        return Page.of(flowers, total, pagination).map(FlowerResponse::from);
    }

    public FlowerResponse createFlower(CreateFlowerRequest request) {
        Flower flower =
                Flower.create(
                        request.name(),
                        request.color(),
                        request.description(),
                        request.priceOrDefault(),
                        request.stockOrDefault());

        Flower created = repository.create(flower);
        metrics.created();
        log.info("Created flower {} ({})", created.id(), created.name());
        return FlowerResponse.from(created);
    }

    public FlowerResponse updateFlower(UUID id, UpdateFlowerRequest request) {
        Flower flower = repository.findById(id).orElseThrow(() -> FlowerErrors.notFound(id));

        if (request.name() != null) {
            flower.rename(request.name());
        }
        if (request.color() != null) {
            flower.recolor(request.color());
        }
        if (request.description() != null) {
            flower.describe(request.description());
        }
        if (request.price() != null) {
            flower.reprice(request.price());
        }
        if (request.stock() != null) {
            flower.restock(request.stock());
        }

        Flower updated = repository.update(flower);
        metrics.updated();
        log.info("Updated flower {}", id);
        return FlowerResponse.from(updated);
    }

    public void deleteFlower(UUID id) {
        if (!repository.delete(id)) {
            throw FlowerErrors.notFound(id);
        }
        metrics.deleted();
        log.info("Deleted flower {}", id);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
