/**
 * Domain layer: the flower aggregate, its value objects and the error taxonomy.
 *
 * <ul>
 *   <li>{@code flower/}: {@link com.florist.flowerservice.domain.flower.Flower} and its value
 *       objects
 *   <li>{@code shared/}: pagination and the exceptions the API layer maps to HTTP statuses
 * </ul>
 *
 * <p>Nothing in this package depends on Spring, JDBC or the web layer.
 */
package com.florist.flowerservice.domain;
