package com.flamingo.ai.askdocs.config;

import com.flamingo.ai.askdocs.service.admin.AdminAllowlistService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Startup bean that seeds the admin allowlist from {@code rag.admin.default-admins}.
 *
 * <p>Seeding only happens when the allowlist is empty, so admins removed at runtime are not
 * re-added on restart.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AdminAllowlistStartupBean implements CommandLineRunner {

  private final AdminAllowlistService adminAllowlistService;
  private final RagConfig ragConfig;

  @Override
  public void run(String... args) {
    try {
      int added = adminAllowlistService.seedIfEmpty(ragConfig.getAdmin().getDefaultAdmins());
      if (added > 0) {
        log.info("Seeded admin allowlist with {} user(s)", added);
      } else {
        log.info("Admin allowlist already initialized, skipping seed");
      }
    } catch (Exception e) {
      log.error("Admin allowlist seeding failed: {}", e.getMessage(), e);
    }
  }
}
