package com.flamingo.ai.askdocs.service.admin;

import com.flamingo.ai.askdocs.domain.entity.AdminUser;
import com.flamingo.ai.askdocs.domain.repository.AdminUserRepository;
import com.flamingo.ai.askdocs.exception.AdminAccessDeniedException;
import com.flamingo.ai.askdocs.exception.LastAdminRemovalException;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of AdminAllowlistService backed by the admin_users table. */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdminAllowlistServiceImpl implements AdminAllowlistService {

  private final AdminUserRepository adminUserRepository;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional(readOnly = true)
  public List<AdminUser> list() {
    return adminUserRepository.findAllByOrderByUsernameAsc();
  }

  @Override
  @Transactional
  public AdminUser add(String username, String addedBy) {
    String normalized = normalize(username);
    return adminUserRepository
        .findById(normalized)
        .orElseGet(
            () -> {
              AdminUser admin =
                  AdminUser.builder()
                      .username(normalized)
                      .addedBy(addedBy == null ? null : normalize(addedBy))
                      .build();
              log.info("Adding admin {} (by {})", normalized, admin.getAddedBy());
              meterRegistry.counter("admin.changes", "action", "add").increment();
              return adminUserRepository.save(admin);
            });
  }

  @Override
  @Transactional
  public void remove(String username) {
    String normalized = normalize(username);
    if (!adminUserRepository.existsById(normalized)) {
      throw new IllegalArgumentException("Not an admin: " + normalized);
    }
    if (adminUserRepository.count() <= 1) {
      throw new LastAdminRemovalException(normalized);
    }
    adminUserRepository.deleteById(normalized);
    meterRegistry.counter("admin.changes", "action", "remove").increment();
    log.info("Removed admin {}", normalized);
  }

  @Override
  @Transactional(readOnly = true)
  public boolean isAdmin(String username) {
    if (username == null || username.isBlank()) {
      return false;
    }
    return adminUserRepository.existsById(normalize(username));
  }

  @Override
  public void requireAdmin(String username) {
    if (!isAdmin(username)) {
      meterRegistry.counter("admin.access.denied").increment();
      throw new AdminAccessDeniedException(username);
    }
  }

  @Override
  @Transactional
  public int seedIfEmpty(List<String> usernames) {
    if (adminUserRepository.count() > 0 || usernames == null) {
      return 0;
    }
    int added = 0;
    for (String username : usernames) {
      if (username != null && !username.isBlank()) {
        add(username, "system");
        added++;
      }
    }
    return added;
  }

  private static String normalize(String username) {
    if (username == null || username.isBlank()) {
      throw new IllegalArgumentException("username must not be blank");
    }
    return username.trim().toLowerCase(Locale.ROOT);
  }
}
