package com.flamingo.ai.askdocs.service.admin;

import com.flamingo.ai.askdocs.domain.entity.AdminUser;
import java.util.List;

/** Service interface for the admin allowlist that guards corpus management. */
public interface AdminAllowlistService {

  /** Returns all admins ordered by user name. */
  List<AdminUser> list();

  /**
   * Adds a user to the allowlist. Adding an existing admin returns the stored entry unchanged.
   *
   * @param username the user to add, compared case-insensitively
   * @param addedBy the admin performing the change
   * @return the stored entry
   */
  AdminUser add(String username, String addedBy);

  /**
   * Removes a user from the allowlist.
   *
   * @throws com.flamingo.ai.askdocs.exception.LastAdminRemovalException if the user is the only
   *     remaining admin
   */
  void remove(String username);

  boolean isAdmin(String username);

  /**
   * Throws unless the user is on the allowlist.
   *
   * @throws com.flamingo.ai.askdocs.exception.AdminAccessDeniedException if the user is not an
   *     admin
   */
  void requireAdmin(String username);

  /** Seeds the allowlist when it is empty. Returns how many admins were added. */
  int seedIfEmpty(List<String> usernames);
}
