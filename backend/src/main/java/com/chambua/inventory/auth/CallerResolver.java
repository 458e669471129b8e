package com.chambua.inventory.auth;

import com.chambua.inventory.model.StaffUser;
import com.chambua.inventory.repository.StaffUserRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Component
public class CallerResolver {

    public static final String CALLER_HEADER = "X-User";

    private final StaffUserRepository staffUserRepository;

    public CallerResolver(StaffUserRepository staffUserRepository) {
        this.staffUserRepository = staffUserRepository;
    }

    @Transactional(readOnly = true)
    public Optional<CallerContext> resolve(String username) {
        if (username == null || username.isBlank()) return Optional.empty();
        return staffUserRepository.findActiveByUsername(username.trim()).map(CallerResolver::toContext);
    }

    private static CallerContext toContext(StaffUser user) {
        Long locationId = user.getLocation() != null ? user.getLocation().getId() : null;
        return new CallerContext(user.getUsername(), user.getRole(), locationId);
    }
}
