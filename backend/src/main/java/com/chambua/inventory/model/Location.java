package com.chambua.inventory.model;

import jakarta.persistence.*;

@Entity
@Table(name = "locations", uniqueConstraints = {
        @UniqueConstraint(name = "uk_location_code", columnNames = {"code"})
})
public class Location {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false, length = 20)
    private String code;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    public Location() {}

    public Location(String name, String code) {
        this.name = name;
        this.code = code;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getCode() { return code; }
    public void setCode(String code) { this.code = code; }

    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }
}
