package com.florist.flowerservice.api;

import com.florist.flowerservice.application.dto.ApiResponse;
import com.florist.flowerservice.application.dto.CreateFlowerRequest;
import com.florist.flowerservice.application.dto.FlowerResponse;
import com.florist.flowerservice.application.dto.UpdateFlowerRequest;
import com.florist.flowerservice.application.usecase.FlowerUseCase;
import com.florist.flowerservice.config.FlowerServiceProperties;
import com.florist.flowerservice.domain.shared.Page;
import com.florist.flowerservice.domain.shared.Pagination;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Flower catalog CRUD under {@code /api/flowers}. */
@RestController
@RequestMapping("/api/flowers")
@Tag(name = "Flowers", description = "Flower catalog")
public class FlowerController {

    static final String CREATED_MESSAGE = "Flower created successfully";
    static final String UPDATED_MESSAGE = "Flower updated successfully";

    private final FlowerUseCase flowerUseCase;
    private final FlowerServiceProperties properties;

    public FlowerController(FlowerUseCase flowerUseCase, FlowerServiceProperties properties) {
        this.flowerUseCase = flowerUseCase;
        this.properties = properties;
    }

    @GetMapping
    @Operation(summary = "List flowers, newest first, optionally filtered by name and color")
    public ApiResponse<Page<FlowerResponse>> listFlowers(
            @Parameter(description = "Page number, from 1")
                    @RequestParam(required = false)
                    Integer page,
            @Parameter(description = "Items per page")
                    @RequestParam(name = "per_page", required = false)
                    Integer perPage,
            @Parameter(description = "Case-insensitive substring of the name")
                    @RequestParam(required = false)
                    String search,
            @Parameter(description = "Exact color, case-insensitive")
                    @RequestParam(required = false)
                    String color) {

        Pagination pagination =
                Pagination.of(
                        page, perPage, properties.defaultPageSize(), properties.maxPageSize());

        if (hasText(search) || hasText(color)) {
            return ApiResponse.success(flowerUseCase.searchFlowers(search, color, pagination));
        }
        return ApiResponse.success(flowerUseCase.listFlowers(pagination));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a flower by id")
    public ApiResponse<FlowerResponse> getFlower(@PathVariable UUID id) {
        return ApiResponse.success(flowerUseCase.getFlower(id));
    }

    @PostMapping
    @Operation(summary = "Create a flower")
    public ResponseEntity<ApiResponse<FlowerResponse>> createFlower(
            @Valid @RequestBody CreateFlowerRequest request) {
        FlowerResponse created = flowerUseCase.createFlower(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.withMessage(created, CREATED_MESSAGE));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update a flower; omitted fields keep their value")
    public ApiResponse<FlowerResponse> updateFlower(
            @PathVariable UUID id, @Valid @RequestBody UpdateFlowerRequest request) {
        return ApiResponse.withMessage(flowerUseCase.updateFlower(id, request), UPDATED_MESSAGE);
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a flower")
    public ResponseEntity<Void> deleteFlower(@PathVariable UUID id) {
        flowerUseCase.deleteFlower(id);
        return ResponseEntity.noContent().build();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
