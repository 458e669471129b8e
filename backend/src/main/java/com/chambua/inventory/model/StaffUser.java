package com.chambua.inventory.model;

import jakarta.persistence.*;

@Entity
@Table(name = "staff_users", uniqueConstraints = {
        @UniqueConstraint(name = "uk_staff_username", columnNames = {"username"})
})
public class StaffUser {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 50)
    private String username;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private UserRole role = UserRole.CASHIER;

    // Default location for imports that omit one; null for head-office accounts
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "location_id", foreignKey = @ForeignKey(name = "fk_staff_location"))
    private Location location;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    public StaffUser() {}

    public StaffUser(String username, UserRole role, Location location) {
        this.username = username;
        this.role = role;
        this.location = location;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }

    public UserRole getRole() { return role; }
    public void setRole(UserRole role) { this.role = role; }

    public Location getLocation() { return location; }
    public void setLocation(Location location) { this.location = location; }

    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }
}
