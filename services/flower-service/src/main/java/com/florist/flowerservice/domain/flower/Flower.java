package com.florist.flowerservice.domain.flower;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.UUID;

/**
 * The flower aggregate: one row of the catalog.
 *
 * <p>New flowers come from {@link #create}, which validates every field through {@link FlowerName},
 * {@link FlowerColor} and the price and stock rules. Rows loaded from the database come from {@link
 * #restore}, which keeps the stored values as they are, so rows written by other clients stay
 * readable. Every mutator validates its input and moves {@code updatedAt} forward.
 *
 * <p>Not thread-safe; instances live for the duration of one request.
 */
public final class Flower {

    private final UUID id;
    private String name;
    private String color;
    private String description;
    private double price;
    private int stock;
    private final Instant createdAt;
    private Instant updatedAt;
    private final Clock clock;

    private Flower(
            UUID id,
            String name,
            String color,
            String description,
            double price,
            int stock,
            Instant createdAt,
            Instant updatedAt,
            Clock clock) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.color = Objects.requireNonNull(color, "color");
        this.description = description;
        this.price = price;
        this.stock = stock;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.updatedAt = Objects.requireNonNull(updatedAt, "updatedAt");
        this.clock = clock;
    }

    public static Flower create(
            String name, String color, String description, double price, int stock) {
        return create(name, color, description, price, stock, Clock.systemUTC());
    }

    /**
     * Creates a new flower with a random id and {@code createdAt = updatedAt = now}.
     *
     * @throws com.florist.flowerservice.domain.shared.ValidationException if any field is invalid
     */
    public static Flower create(
            String name, String color, String description, double price, int stock, Clock clock) {
        Instant now = now(clock);
        return new Flower(
                UUID.randomUUID(),
                new FlowerName(name).value(),
                new FlowerColor(color).value(),
                description,
                requireValidPrice(price),
                requireValidStock(stock),
                now,
                now,
                clock);
    }

    /** Rebuilds a flower from a stored row without re-validating it. */
    public static Flower restore(
            UUID id,
            String name,
            String color,
            String description,
            double price,
            int stock,
            Instant createdAt,
            Instant updatedAt) {
        return new Flower(
                id,
                name,
                color,
                description,
                price,
                stock,
                createdAt,
                updatedAt,
                Clock.systemUTC());
    }

    // ── Mutators ──

    public void rename(String newName) {
        this.name = new FlowerName(newName).value();
        touch();
    }

    public void recolor(String newColor) {
        this.color = new FlowerColor(newColor).value();
        touch();
    }

    public void describe(String newDescription) {
        this.description = newDescription;
        touch();
    }

    public void reprice(double newPrice) {
        this.price = requireValidPrice(newPrice);
        touch();
    }

    public void restock(int newStock) {
        this.stock = requireValidStock(newStock);
        touch();
    }

    public void addStock(int quantity) {
        if (quantity <= 0) {
            throw FlowerErrors.invalidStock("quantity must be positive");
        }
        this.stock = Math.addExact(stock, quantity);
        touch();
    }

    public void reduceStock(int quantity) {
        if (quantity <= 0) {
            throw FlowerErrors.invalidStock("quantity must be positive");
        }
        if (stock < quantity) {
            throw FlowerErrors.insufficientStock();
        }
        this.stock -= quantity;
        touch();
    }

    // ── Accessors ──

    public UUID id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String color() {
        return color;
    }

    public String description() {
        return description;
    }

    public double price() {
        return price;
    }

    public int stock() {
        return stock;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Flower other && id.equals(other.id));
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Flower[id=" + id + ", name=" + name + ", color=" + color + "]";
    }

    // ── Helpers ──

    private void touch() {
        Instant now = now(clock);
        updatedAt = now.isAfter(updatedAt) ? now : updatedAt.plus(1, ChronoUnit.MICROS);
    }

    // PostgreSQL keeps microseconds
    private static Instant now(Clock clock) {
        return Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
    }

    private static double requireValidPrice(double price) {
        if (!Double.isFinite(price) || price < 0) {
            throw FlowerErrors.invalidPrice("price must be a non-negative number");
        }
        return price;
    }

    private static int requireValidStock(int stock) {
        if (stock < 0) {
            throw FlowerErrors.invalidStock("stock must not be negative");
        }
        return stock;
    }
}
