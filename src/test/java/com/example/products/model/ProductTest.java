package com.example.products.model;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.DisplayName;

import static org.junit.jupiter.api.Assertions.*;

public class ProductTest {

    private Product product;

    @BeforeEach
    void setUp() {
        product = new Product();
    }

    @Test
    @DisplayName("Should set and get id correctly")
    void testSetAndGetId() {
        Long expectedId = 123L;
        product.setId(expectedId);
        assertEquals(expectedId, product.getId());
    }

    @Test
    @DisplayName("Should set and get name correctly")
    void testSetAndGetName() {
        product.setName("Chair");
        assertEquals("Chair", product.getName());
    }

    @Test
    @DisplayName("Should set and get price correctly")
    void testSetAndGetPrice() {
        product.setPrice(49.99);
        assertEquals(49.99, product.getPrice());
    }

    @Test
    @DisplayName("Should set and get color correctly")
    void testSetAndGetColor() {
        product.setColor("red");
        assertEquals("red", product.getColor());
    }

    @Test
    @DisplayName("Should set and get stock correctly")
    void testSetAndGetStock() {
        product.setStock(10);
        assertEquals(10, product.getStock());
    }

    @Test
    @DisplayName("Should leave id unassigned when built from fields")
    void testFieldConstructor() {
        Product chair = new Product("Chair", 49.99, "red", 10);

        assertNull(chair.getId());
        assertEquals("Chair", chair.getName());
        assertEquals(49.99, chair.getPrice());
        assertEquals("red", chair.getColor());
        assertEquals(10, chair.getStock());
    }

    @Test
    @DisplayName("Should allow a product without color")
    void testNullColor() {
        product.setColor(null);
        assertNull(product.getColor());
    }

    @Test
    @DisplayName("Should create product with default values")
    void testDefaultValues() {
        Product newProduct = new Product();
        assertNull(newProduct.getId());
        assertNull(newProduct.getName());
        assertNull(newProduct.getPrice());
        assertNull(newProduct.getColor());
        assertNull(newProduct.getStock());
    }
}
