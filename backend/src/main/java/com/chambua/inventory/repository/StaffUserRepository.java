package com.chambua.inventory.repository;

import com.chambua.inventory.model.StaffUser;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface StaffUserRepository extends JpaRepository<StaffUser, Long> {

    @Query("select u from StaffUser u left join fetch u.location where lower(u.username) = lower(:username) and u.active = true")
    Optional<StaffUser> findActiveByUsername(@Param("username") String username);
}
