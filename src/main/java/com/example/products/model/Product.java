package com.example.products.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.persistence.*;

@Schema(description = "Product entity")
@Entity
public class Product {
    @Schema(description = "Identifier assigned by the store", example = "1")
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Schema(description = "Product name", example = "Chair")
    @Column(nullable = false)
    private String name;

    @Schema(description = "Unit price", example = "49.99")
    @Column(nullable = false)
    private Double price;

    @Schema(description = "Product color", example = "red")
    private String color;

    @Schema(description = "Units in stock", example = "10")
    @Column(nullable = false)
    private Integer stock;

    public Product() {}

    public Product(String name, Double price, String color, Integer stock) {
        this.name = name;
        this.price = price;
        this.color = color;
        this.stock = stock;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public Double getPrice() { return price; }
    public void setPrice(Double price) { this.price = price; }
    public String getColor() { return color; }
    public void setColor(String color) { this.color = color; }
    public Integer getStock() { return stock; }
    public void setStock(Integer stock) { this.stock = stock; }
}
